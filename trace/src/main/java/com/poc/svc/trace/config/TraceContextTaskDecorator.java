package com.poc.svc.trace.config;

import com.poc.svc.trace.context.CurrentRequestContext;
import org.springframework.core.task.TaskDecorator;

/**
 * 讓 {@code ThreadPoolTaskExecutor} 執行的工作沿用提交時的 Request Context 與 MDC。
 */
public class TraceContextTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        return CurrentRequestContext.wrap(runnable);
    }
}
