package com.calai.mealplan.plan.model;

import java.util.Locale;

/**
 * 食材「以什麼形態計量」：
 * - DRY / RAW / AS_PACK：已是 as-sold，不需換算
 * - COOKED：需要 yield factor 換回 as-sold
 */
public enum ItemState {
    DRY("dry"),
    RAW("raw"),
    COOKED("cooked"),
    AS_PACK("as_pack");

    private final String code;

    ItemState(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isAsSold() {
        return this != COOKED;
    }

    /** 不認得就回 null（= unset），不丟例外 */
    public static ItemState fromCodeOrNull(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.isEmpty()) return null;
        for (ItemState s : values()) {
            if (s.code.equals(v)) return s;
        }
        return null;
    }
}
