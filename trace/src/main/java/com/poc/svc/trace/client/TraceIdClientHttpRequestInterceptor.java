package com.poc.svc.trace.client;

import com.poc.svc.trace.context.CurrentRequestContext;
import com.poc.svc.trace.context.RequestContext;
import com.poc.svc.trace.context.TraceContext;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.support.HttpRequestWrapper;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 將目前上下文的 Trace ID 帶入對外呼叫的 {@code X-Trace-Id} Header。
 * <p>
 * 呼叫端已明確設定的 Header 一律保留；否則複製一份 Header 再寫入，不修改呼叫端持有的 Header。
 */
public class TraceIdClientHttpRequestInterceptor implements ClientHttpRequestInterceptor {

    private final Supplier<RequestContext> contextSource;

    public TraceIdClientHttpRequestInterceptor() {
        this(CurrentRequestContext::get);
    }

    public TraceIdClientHttpRequestInterceptor(Supplier<RequestContext> contextSource) {
        this.contextSource = Objects.requireNonNull(contextSource, "contextSource must not be null");
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request,
                                        byte[] body,
                                        ClientHttpRequestExecution execution) throws IOException {
        if (StringUtils.hasLength(request.getHeaders().getFirst(TraceContext.TRACE_ID_HEADER))) {
            return execution.execute(request, body);
        }
        HttpHeaders headers = TraceHeaders.copyOf(request.getHeaders());
        TraceHeaders.applyTraceId(contextSource.get(), headers);
        return execution.execute(new TracedHttpRequest(request, headers), body);
    }

    private static final class TracedHttpRequest extends HttpRequestWrapper {

        private final HttpHeaders headers;

        private TracedHttpRequest(HttpRequest request, HttpHeaders headers) {
            super(request);
            this.headers = headers;
        }

        @Override
        public HttpHeaders getHeaders() {
            return headers;
        }
    }
}
