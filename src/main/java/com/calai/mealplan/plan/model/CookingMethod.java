package com.calai.mealplan.plan.model;

import java.util.Locale;

public enum CookingMethod {
    BOILED("boiled"),
    FRIED("fried"),
    BAKED("baked"),
    STEAMED("steamed"),
    GRILLED("grilled"),
    ROASTED("roasted"),
    SAUTEED("sauteed"),
    POACHED("poached"),
    BRAISED("braised");

    private final String code;

    CookingMethod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static CookingMethod fromCodeOrNull(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.isEmpty()) return null;
        for (CookingMethod m : values()) {
            if (m.code.equals(v)) return m;
        }
        return null;
    }
}
