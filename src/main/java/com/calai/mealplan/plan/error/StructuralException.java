package com.calai.mealplan.plan.error;

import java.util.Map;

/**
 * shape 錯誤（非陣列、空計畫、所有 meal 都不合法）：一律 fail fast
 */
public class StructuralException extends PipelineException {

    public static final String CODE = "STRUCTURAL_ERROR";

    public StructuralException(String message, String traceId, String stage, Map<String, Object> context) {
        super(CODE, message, traceId, stage, context, null);
    }
}
