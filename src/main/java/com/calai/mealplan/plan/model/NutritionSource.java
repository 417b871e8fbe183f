package com.calai.mealplan.plan.model;

public enum NutritionSource {
    HOTPATH,
    CANONICAL,
    FALLBACK;

    public boolean isFallback() {
        return this == FALLBACK;
    }
}
