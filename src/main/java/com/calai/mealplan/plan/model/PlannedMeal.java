package com.calai.mealplan.plan.model;

import java.util.List;

/**
 * computed=false：structure guard 排除的 meal（仍保留在回應裡，但不參與計算）
 */
public record PlannedMeal(
        MealType type,
        String name,
        List<PlannedItem> items,
        MacroTotals totals,
        boolean computed
) {
    public PlannedMeal {
        items = (items == null) ? List.of() : List.copyOf(items);
        totals = (totals == null) ? MacroTotals.ZERO : totals;
    }
}
