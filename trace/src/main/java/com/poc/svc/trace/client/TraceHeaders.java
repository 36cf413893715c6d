package com.poc.svc.trace.client;

import com.poc.svc.trace.context.RequestContext;
import com.poc.svc.trace.context.TraceContext;
import com.poc.svc.trace.util.TraceIds;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import java.util.Objects;

public final class TraceHeaders {

    private TraceHeaders() {
    }

    public static String applyTraceId(RequestContext context, HttpHeaders headers) {
        Objects.requireNonNull(headers, "headers must not be null");
        String traceId = TraceContext.traceIdFromContext(context);
        if (!StringUtils.hasLength(traceId)) {
            traceId = TraceIds.newTraceId();
        }
        headers.set(TraceContext.TRACE_ID_HEADER, traceId);
        return traceId;
    }

    static HttpHeaders copyOf(HttpHeaders source) {
        HttpHeaders copy = new HttpHeaders();
        copy.addAll(source);
        return copy;
    }
}
