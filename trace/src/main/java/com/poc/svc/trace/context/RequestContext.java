package com.poc.svc.trace.context;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 請求範圍內的不可變上下文。
 * <p>
 * 每次寫入都會複製出新的實例，原實例保持不變，因此可在多個執行緒間安全共享。
 * 值以 {@link Key} 的物件身分查找，持有 key 的類別才能讀寫對應的值。
 * 另外保存一組結構化日誌欄位，於 {@link CurrentRequestContext#open(RequestContext)} 時同步至 MDC。
 */
public final class RequestContext {

    private static final RequestContext ROOT = new RequestContext(Map.of(), Map.of());

    private final Map<Key<?>, Object> values;
    private final Map<String, String> logFields;

    private RequestContext(Map<Key<?>, Object> values, Map<String, String> logFields) {
        this.values = values;
        this.logFields = logFields;
    }

    public static RequestContext root() {
        return ROOT;
    }

    public <T> RequestContext with(Key<T> key, T value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Map<Key<?>, Object> copy = new IdentityHashMap<>(values);
        copy.put(key, value);
        return new RequestContext(copy, logFields);
    }

    public <T> T get(Key<T> key) {
        Objects.requireNonNull(key, "key must not be null");
        return key.type.cast(values.get(key));
    }

    public RequestContext withLogField(String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Map<String, String> copy = new LinkedHashMap<>(logFields);
        copy.put(name, value);
        return new RequestContext(values, copy);
    }

    public Map<String, String> logFields() {
        return Collections.unmodifiableMap(logFields);
    }

    @Override
    public String toString() {
        Map<String, Object> named = new HashMap<>();
        values.forEach((key, value) -> named.put(key.name, value));
        return "RequestContext{values=" + named + ", logFields=" + logFields + "}";
    }

    public static final class Key<T> {

        private final String name;
        private final Class<T> type;

        private Key(String name, Class<T> type) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.type = Objects.requireNonNull(type, "type must not be null");
        }

        public static <T> Key<T> named(String name, Class<T> type) {
            return new Key<>(name, type);
        }

        public String name() {
            return name;
        }

        @Override
        public String toString() {
            return "Key[" + name + "]";
        }
    }
}
