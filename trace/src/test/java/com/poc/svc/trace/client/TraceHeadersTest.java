package com.poc.svc.trace.client;

import com.poc.svc.trace.context.RequestContext;
import com.poc.svc.trace.context.TraceContext;
import com.poc.svc.trace.util.TraceIds;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.assertj.core.api.Assertions.assertThat;

class TraceHeadersTest {

    @Test
    void applyTraceId_writesContextTraceId() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(TraceContext.TRACE_ID_HEADER, "stale");

        String written = TraceHeaders.applyTraceId(TraceContext.withTraceId(RequestContext.root(), "testing-ctx"), headers);

        assertThat(written).isEqualTo("testing-ctx");
        assertThat(headers.get(TraceContext.TRACE_ID_HEADER)).containsExactly("testing-ctx");
    }

    @Test
    void applyTraceId_generatesWhenContextIsEmpty() {
        HttpHeaders headers = new HttpHeaders();

        String written = TraceHeaders.applyTraceId(RequestContext.root(), headers);

        assertThat(TraceIds.isValidTraceId(written)).isTrue();
        assertThat(headers.getFirst(TraceContext.TRACE_ID_HEADER)).isEqualTo(written);
    }

    @Test
    void copyOf_isIndependentOfSource() {
        HttpHeaders source = new HttpHeaders();
        source.add("Accept", "application/json");

        HttpHeaders copy = TraceHeaders.copyOf(source);
        copy.add("Accept", "text/plain");
        copy.set(TraceContext.TRACE_ID_HEADER, "x");

        assertThat(source.get("Accept")).containsExactly("application/json");
        assertThat(source.containsKey(TraceContext.TRACE_ID_HEADER)).isFalse();
    }
}
