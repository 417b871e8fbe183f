package com.calai.mealplan.plan.model;

/**
 * 每 100 g 的參考值（外部 lookup 擁有，這裡只讀）
 */
public record NutritionRecord(
        double calories,
        double protein,
        double fat,
        double carbs,
        NutritionSource source,
        Confidence confidence
) {
}
