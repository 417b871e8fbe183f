package com.calai.mealplan.plan.reconcile;

import com.calai.mealplan.plan.model.Meal;
import com.calai.mealplan.plan.model.MacroTotals;

import java.util.List;

/**
 * factor=null：沒有算 factor（在容忍帶內 / 沒有基準）。
 * factorInBounds=false 時結果照樣回傳，只是多一個資料品質訊號。
 */
public record ReconcileResult(
        List<Meal> meals,
        boolean adjusted,
        Double factor,
        boolean factorInBounds,
        Reason reason,
        MacroTotals before,
        MacroTotals after
) {

    public enum Reason {
        WITHIN_TOLERANCE,
        NO_BASELINE,
        NOTHING_TO_SCALE,
        PROTEIN_FLOOR,
        SCALED
    }

    public ReconcileResult {
        meals = (meals == null) ? List.of() : List.copyOf(meals);
    }

    public Meal meal() {
        return meals.isEmpty() ? null : meals.get(0);
    }
}
