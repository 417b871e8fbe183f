package com.calai.mealplan.plan.invariant;

public enum InvariantId {
    MACRO_KCAL_CONSISTENCY,
    POSITIVE_QUANTITY,
    PORTION_BOUNDS,
    RECONCILIATION_FACTOR_BOUNDS,
    YIELD_COVERAGE,
    RESOLVED_STATE,
    MEAL_HAS_ITEMS,
    DAY_NON_NEGATIVE,
    DAY_KCAL_RANGE,
    DAY_TARGET_DEVIATION,
    RESPONSE_FLAGGED_RATE
}
