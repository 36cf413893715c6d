package com.poc.svc.trace.web;

import com.poc.svc.trace.util.TraceIds;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * 入站請求最終採用的 Trace ID，以及該值的來源。
 */
public record InboundTraceId(String traceId, Outcome outcome) {

    public static InboundTraceId resolve(String candidate, boolean trustExistingHeader) {
        if (!StringUtils.hasLength(candidate)) {
            return new InboundTraceId(TraceIds.newTraceId(), Outcome.MISSING);
        }
        if (trustExistingHeader || TraceIds.isValidTraceId(candidate)) {
            return new InboundTraceId(candidate, Outcome.ACCEPTED);
        }
        return new InboundTraceId(TraceIds.newTraceId(), Outcome.INVALID);
    }

    public enum Outcome {
        ACCEPTED,
        MISSING,
        INVALID;

        public String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
