package com.calai.mealplan.plan.model;

/** 宣告順序 = 套用順序 */
public enum CorrectionRule {
    STRING_TO_NUMBER,
    SIZE_DESCRIPTOR_TO_GRAMS,
    UNIT_NORMALIZATION,
    STATE_HINT_NORMALIZATION,
    INVALID_STATE_HINT_CLEARED,
    METHOD_HINT_NORMALIZATION,
    INVALID_METHOD_HINT_CLEARED,
    QUANTITY_BOUNDS_CLAMPED
}
