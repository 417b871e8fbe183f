package com.calai.mealplan.plan.correction;

/**
 * LLM 輸出的形狀種類；validator 依此決定要檢查哪些欄位
 */
public enum SchemaKind {
    MEALS_ARRAY,
    MEAL,
    ITEM,
    GROCERY_QUERY
}
