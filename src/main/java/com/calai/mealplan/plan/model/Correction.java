package com.calai.mealplan.plan.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * auto-correction 的稽核紀錄（append-only）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Correction(
        String field,
        Object originalValue,
        Object correctedValue,
        CorrectionRule rule,
        Map<String, Object> details
) {
    public Correction(String field, Object originalValue, Object correctedValue, CorrectionRule rule) {
        this(field, originalValue, correctedValue, rule, null);
    }
}
