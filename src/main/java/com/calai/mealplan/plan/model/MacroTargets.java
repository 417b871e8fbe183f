package com.calai.mealplan.plan.model;

/**
 * 呼叫端給的每日目標；fat / carbs 只拿來回傳，不參與 reconciliation
 */
public record MacroTargets(double kcal, double protein, Double fat, Double carbs) {

    public static MacroTargets of(double kcal, double protein) {
        return new MacroTargets(kcal, protein, null, null);
    }

    public MacroTargets perMeal(int mealCount) {
        int n = Math.max(1, mealCount);
        return new MacroTargets(kcal / n, protein / n,
                fat == null ? null : fat / n,
                carbs == null ? null : carbs / n);
    }
}
