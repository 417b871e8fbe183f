package com.calai.mealplan.plan.pipeline;

/**
 * 最後一道防線修了幾個欄位（正常情況兩個都是 0）
 */
public record SanitizationStats(int fieldsCoerced, int mealsPatched) {

    public static final SanitizationStats EMPTY = new SanitizationStats(0, 0);
}
