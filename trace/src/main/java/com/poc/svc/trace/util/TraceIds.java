package com.poc.svc.trace.util;

import org.springframework.util.StringUtils;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Trace ID 的產生與驗證規則。
 * <p>
 * 標準 Trace ID 為 UUID 字串，接受 36 字元標準格式、{@code urn:uuid:} 前綴、大括號包覆
 * 以及 32 字元無連字號格式。以 {@value #TESTING_PREFIX} 開頭的 ID 視為測試用途，
 * 僅檢查前綴，不驗證其後內容，供下游稽核流程排除。
 */
public final class TraceIds {

    public static final String TESTING_PREFIX = "testing-";

    private static final String CANONICAL_UUID =
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}";

    private static final Pattern STANDARD_UUID = Pattern.compile(
            "(?i:urn:uuid:)?" + CANONICAL_UUID
                    + "|\\{" + CANONICAL_UUID + "}"
                    + "|[0-9a-fA-F]{32}");

    private TraceIds() {
    }

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValidTraceId(String id) {
        if (!StringUtils.hasLength(id)) {
            return false;
        }
        if (isTestingTraceId(id)) {
            return true;
        }
        return STANDARD_UUID.matcher(id).matches();
    }

    public static boolean isTestingTraceId(String id) {
        return id != null && id.startsWith(TESTING_PREFIX);
    }

    public static String withTestingPrefix(String id) {
        if (isTestingTraceId(id)) {
            return id;
        }
        String base = StringUtils.hasLength(id) ? id : newTraceId();
        return TESTING_PREFIX + base;
    }
}
