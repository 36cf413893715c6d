package com.poc.svc.trace.web;

import com.poc.svc.trace.context.CurrentRequestContext;
import com.poc.svc.trace.context.RequestContext;
import com.poc.svc.trace.context.TraceContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.util.Objects;

/**
 * 在 HTTP Header 與 {@link RequestContext} 之間轉換 Trace ID 的伺服端工具。
 */
public final class HttpTraceSupport {

    public static final String CONTEXT_ATTRIBUTE = HttpTraceSupport.class.getName() + ".CONTEXT";

    private HttpTraceSupport() {
    }

    public static RequestContext tracedContext(HttpServletRequest request, HttpServletResponse response) {
        InboundTraceId inbound = InboundTraceId.resolve(request.getHeader(TraceContext.TRACE_ID_HEADER), false);
        return attach(CurrentRequestContext.get(), inbound, request, response);
    }

    public static String traceIdFromRequest(HttpServletRequest request) {
        return InboundTraceId.resolve(request.getHeader(TraceContext.TRACE_ID_HEADER), false).traceId();
    }

    public static RequestContext contextOf(HttpServletRequest request) {
        Object attribute = request.getAttribute(CONTEXT_ATTRIBUTE);
        if (attribute instanceof RequestContext context) {
            return context;
        }
        return CurrentRequestContext.get();
    }

    static RequestContext attach(RequestContext parent,
                                 InboundTraceId inbound,
                                 HttpServletRequest request,
                                 HttpServletResponse response) {
        Objects.requireNonNull(parent, "parent must not be null");
        response.setHeader(TraceContext.TRACE_ID_HEADER, inbound.traceId());
        RequestContext context = TraceContext.withTraceId(parent, inbound.traceId());
        request.setAttribute(CONTEXT_ATTRIBUTE, context);
        return context;
    }
}
