package com.poc.svc.trace.context;

import com.poc.svc.trace.util.TraceIds;
import org.springframework.util.StringUtils;

import java.util.Objects;

/**
 * 提供在 {@link RequestContext} 上取得與設定 Trace ID 的工具。
 */
public final class TraceContext {

    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String TRACE_ID_LOG_FIELD = "trace_id";

    private static final RequestContext.Key<String> TRACE_ID_KEY = RequestContext.Key.named("traceId", String.class);

    private TraceContext() {
    }

    public static RequestContext withTraceId(RequestContext context, String traceId) {
        Objects.requireNonNull(context, "context must not be null");
        String id = StringUtils.hasLength(traceId) ? traceId : TraceIds.newTraceId();
        return context.with(TRACE_ID_KEY, id)
                .withLogField(TRACE_ID_LOG_FIELD, id);
    }

    public static String traceIdFromContext(RequestContext context) {
        Objects.requireNonNull(context, "context must not be null");
        String id = context.get(TRACE_ID_KEY);
        return id != null ? id : "";
    }

    public static RequestContext withTestingTraceId(RequestContext context, String traceId) {
        return withTraceId(context, TraceIds.withTestingPrefix(traceId));
    }

    public static RequestContext newTracedContext(RequestContext context) {
        return withTraceId(context, TraceIds.newTraceId());
    }

    public static RequestContext tracedContext(RequestContext context, String candidate) {
        String id = TraceIds.isValidTraceId(candidate) ? candidate : TraceIds.newTraceId();
        return withTraceId(context, id);
    }

    public static String traceId() {
        return traceIdFromContext(CurrentRequestContext.get());
    }
}
