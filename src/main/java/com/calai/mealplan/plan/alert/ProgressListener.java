package com.calai.mealplan.plan.alert;

import com.calai.mealplan.plan.invariant.Violation;
import com.calai.mealplan.plan.model.NutritionSource;
import com.calai.mealplan.plan.model.Severity;

/**
 * 給「邊算邊推給使用者」的 caller 用（例如 SSE）；全部 optional
 */
public interface ProgressListener {

    ProgressListener NOOP = new ProgressListener() { };

    default void onIngredientFound(String normalizedKey, NutritionSource source) { }

    default void onIngredientFailed(String normalizedKey, String reason) { }

    default void onIngredientFlagged(String itemKey, Severity severity, double deviationPct) { }

    default void onInvariantWarning(Violation violation) { }

    default void onValidationWarning(String message) { }
}
