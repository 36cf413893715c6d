package com.poc.svc.trace.web;

import com.poc.svc.trace.context.CurrentRequestContext;
import com.poc.svc.trace.context.RequestContext;
import com.poc.svc.trace.context.TraceContext;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Objects;

/**
 * 於每次請求產生或沿用 TRACE ID，串接 Request Context、MDC 與 Response Header。
 */
public class TraceIdFilter extends OncePerRequestFilter implements Ordered {

    public static final String INBOUND_REQUESTS_METRIC = "trace.inbound.requests";

    private static final Logger log = LoggerFactory.getLogger(TraceIdFilter.class);

    private final MeterRegistry meterRegistry;
    private final boolean trustExistingHeader;
    private final int order;

    public TraceIdFilter(MeterRegistry meterRegistry) {
        this(meterRegistry, false, Ordered.HIGHEST_PRECEDENCE);
    }

    public TraceIdFilter(MeterRegistry meterRegistry, boolean trustExistingHeader, int order) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
        this.trustExistingHeader = trustExistingHeader;
        this.order = order;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String candidate = request.getHeader(TraceContext.TRACE_ID_HEADER);
        InboundTraceId inbound = InboundTraceId.resolve(candidate, trustExistingHeader);
        if (inbound.outcome() == InboundTraceId.Outcome.INVALID) {
            log.debug("Replacing invalid inbound trace id [{}] with {}", candidate, inbound.traceId());
        }
        meterRegistry.counter(INBOUND_REQUESTS_METRIC, "outcome", inbound.outcome().tagValue()).increment();

        RequestContext context = HttpTraceSupport.attach(CurrentRequestContext.get(), inbound, request, response);
        try (CurrentRequestContext.Scope ignored = CurrentRequestContext.open(context)) {
            filterChain.doFilter(request, response);
        }
    }

    @Override
    public int getOrder() {
        return order;
    }
}
