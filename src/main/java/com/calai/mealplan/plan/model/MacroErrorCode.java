package com.calai.mealplan.plan.model;

/**
 * 單一 item 算不出來時的原因碼；結果一律是 0 macros，不往上丟例外
 */
public enum MacroErrorCode {
    QUANTITY_INVALID,
    GRAMS_AS_SOLD_INVALID,
    NUTRITION_NOT_FOUND,
    MACRO_INCONSISTENT
}
