package com.calai.mealplan.common.trace;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * HTTP filter 跟 pipeline 共用的 traceId 規則。
 * 外部帶進來的 id 會進 log / alert payload，只收短的、安全字元組成的值。
 */
public final class TraceIds {

    public static final String MDC_KEY = "traceId";
    public static final int MAX_LENGTH = 64;

    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9._:-]+");

    private TraceIds() {}

    public static boolean isUsable(String id) {
        return id != null && !id.isBlank() && id.length() <= MAX_LENGTH && SAFE.matcher(id).matches();
    }

    /** 優先順序：指定的 → MDC 裡現有的 → 新產生 */
    public static String resolve(String requested) {
        if (isUsable(requested)) return requested;
        String fromMdc = MDC.get(MDC_KEY);
        if (isUsable(fromMdc)) return fromMdc;
        return newId();
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }
}
