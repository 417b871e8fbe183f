package com.calai.mealplan.plan.pipeline;

/** 宣告順序 = 執行順序 */
public enum PipelineStage {
    ENTRY_GUARD,
    VALIDATE_STRUCTURE,
    VALIDATE_LLM_OUTPUT,
    NORMALIZE_STATE,
    EXTRACT_INGREDIENTS,
    FETCH_NUTRITION,
    COMPUTE_MACROS,
    MEAL_RECONCILE,
    DAY_RECONCILE,
    SANITIZE,
    RESPONSE_BLOCK_CHECK,
    VALIDATE_PLAN,
    EMIT
}
