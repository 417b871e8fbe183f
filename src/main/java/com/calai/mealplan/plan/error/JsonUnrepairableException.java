package com.calai.mealplan.plan.error;

import java.util.Map;

/**
 * generator 原始文字修不回 meals array（進 pipeline 之前就失敗）
 */
public class JsonUnrepairableException extends PipelineException {

    public static final String CODE = "JSON_UNREPAIRABLE";

    public JsonUnrepairableException(int textLength, String traceId) {
        super(CODE, "Meals text could not be repaired into a JSON array", traceId, null,
                Map.of("textLength", textLength), null);
    }

    @Override
    public boolean recoverable() {
        return true;
    }
}
