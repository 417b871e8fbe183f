package com.calai.mealplan.plan.model;

import java.util.Locale;

public enum MealType {
    BREAKFAST("breakfast"),
    LUNCH("lunch"),
    DINNER("dinner"),
    SNACK("snack"),
    MORNING_SNACK("morning_snack"),
    AFTERNOON_SNACK("afternoon_snack"),
    EVENING_SNACK("evening_snack");

    private final String code;

    MealType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static MealType fromCodeOrNull(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        for (MealType t : values()) {
            if (t.code.equals(v)) return t;
        }
        return null;
    }
}
