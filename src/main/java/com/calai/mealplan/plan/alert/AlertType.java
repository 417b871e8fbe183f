package com.calai.mealplan.plan.alert;

public enum AlertType {
    ELEVATED_FALLBACK_RATE,
    HIGH_FALLBACK_RATE,
    NUTRITION_LOOKUP_FAILED,
    QUANTITY_NORMALIZATION_FAILED,
    GRAMS_AS_SOLD_INVALID,
    YIELD_UNMAPPED,
    MACRO_INCONSISTENCY,
    STATE_DISAGREEMENT,
    RECONCILIATION_FACTOR_OUT_OF_BOUNDS,
    LLM_VALIDATION_FAILED,
    VALIDATION_CRITICAL,
    RESPONSE_BLOCKED,
    PIPELINE_FAILURE
}
