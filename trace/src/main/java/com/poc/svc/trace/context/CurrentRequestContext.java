package com.poc.svc.trace.context;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * 將 {@link RequestContext} 綁定至目前執行緒，並把其日誌欄位寫入 MDC。
 * <p>
 * 綁定的值本身不可變；每個執行緒只看得到自己開啟的範圍。
 * 範圍內 MDC 只反映目前上下文的日誌欄位，外層範圍寫入但目前上下文沒有的欄位會暫時移除，
 * 關閉範圍時（須依開啟的相反順序、於同一執行緒）還原先前的綁定與 MDC。
 */
public final class CurrentRequestContext {

    private static final ThreadLocal<RequestContext> CURRENT = new ThreadLocal<>();

    private CurrentRequestContext() {
    }

    public static RequestContext get() {
        RequestContext context = CURRENT.get();
        return context != null ? context : RequestContext.root();
    }

    public static Scope open(RequestContext context) {
        Objects.requireNonNull(context, "context must not be null");
        RequestContext previous = CURRENT.get();
        Set<String> fields = new LinkedHashSet<>();
        fields.add(TraceContext.TRACE_ID_LOG_FIELD);
        if (previous != null) {
            fields.addAll(previous.logFields().keySet());
        }
        fields.addAll(context.logFields().keySet());

        Map<String, String> previousMdc = new LinkedHashMap<>();
        for (String name : fields) {
            previousMdc.put(name, MDC.get(name));
            String value = context.logFields().get(name);
            if (value != null) {
                MDC.put(name, value);
            } else {
                MDC.remove(name);
            }
        }
        CURRENT.set(context);
        return () -> {
            previousMdc.forEach((name, value) -> {
                if (value != null) {
                    MDC.put(name, value);
                } else {
                    MDC.remove(name);
                }
            });
            if (previous != null) {
                CURRENT.set(previous);
            } else {
                CURRENT.remove();
            }
        };
    }

    public static Runnable wrap(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        RequestContext captured = get();
        return () -> {
            try (Scope ignored = open(captured)) {
                task.run();
            }
        };
    }

    public static <T> Callable<T> wrap(Callable<T> task) {
        Objects.requireNonNull(task, "task must not be null");
        RequestContext captured = get();
        return () -> {
            try (Scope ignored = open(captured)) {
                return task.call();
            }
        };
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {

        @Override
        void close();
    }
}
