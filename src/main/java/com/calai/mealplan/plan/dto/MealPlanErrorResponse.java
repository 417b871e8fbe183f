package com.calai.mealplan.plan.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MealPlanErrorResponse(
        String errorCode,
        String message,
        String traceId,
        String stage,
        Map<String, Object> details
) {
    public MealPlanErrorResponse(String errorCode, String message, String traceId) {
        this(errorCode, message, traceId, null, null);
    }
}
