package com.poc.svc.trace.config;

import com.poc.svc.trace.context.CurrentRequestContext;
import com.poc.svc.trace.context.RequestContext;
import com.poc.svc.trace.context.TraceContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TraceContextTaskDecoratorTest {

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("trace-async-");
        executor.setTaskDecorator(new TraceContextTaskDecorator());
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void decoratedTask_seesSubmittingContextAndMdc() throws Exception {
        CompletableFuture<String> observed;
        try (CurrentRequestContext.Scope ignored =
                     CurrentRequestContext.open(TraceContext.withTraceId(RequestContext.root(), "testing-pool"))) {
            observed = CompletableFuture.supplyAsync(
                    () -> TraceContext.traceId() + "|" + MDC.get(TraceContext.TRACE_ID_LOG_FIELD), executor);
        }

        assertThat(observed.get(5, TimeUnit.SECONDS)).isEqualTo("testing-pool|testing-pool");
    }

    @Test
    void workerThread_isCleanAfterTask() throws Exception {
        try (CurrentRequestContext.Scope ignored =
                     CurrentRequestContext.open(TraceContext.withTraceId(RequestContext.root(), "testing-first"))) {
            executor.submit(() -> { }).get(5, TimeUnit.SECONDS);
        }

        String leftover = executor.submit(() -> TraceContext.traceId() + "|" + MDC.get(TraceContext.TRACE_ID_LOG_FIELD))
                .get(5, TimeUnit.SECONDS);

        assertThat(leftover).isEqualTo("|null");
    }
}
