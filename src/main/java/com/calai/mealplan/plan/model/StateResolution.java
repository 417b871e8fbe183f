package com.calai.mealplan.plan.model;

/**
 * state resolver 的輸出（含 ruleId 方便追查是哪條規則命中）
 */
public record StateResolution(
        ItemState state,
        CookingMethod method,
        Confidence confidence,
        String ruleId,
        String category
) {
    public boolean isResolved() {
        return state != null && confidence != null && confidence != Confidence.NONE;
    }
}
