package com.calai.mealplan.plan.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ValidationIssue(
        String code,
        Level level,
        String message,
        Map<String, Object> details
) {

    public enum Level {
        CRITICAL,
        WARNING,
        INFO
    }

    public ValidationIssue {
        details = (details == null) ? Map.of() : details;
    }

    public static ValidationIssue critical(String code, String message, Map<String, Object> details) {
        return new ValidationIssue(code, Level.CRITICAL, message, details);
    }

    public static ValidationIssue warning(String code, String message, Map<String, Object> details) {
        return new ValidationIssue(code, Level.WARNING, message, details);
    }

    public static ValidationIssue info(String code, String message, Map<String, Object> details) {
        return new ValidationIssue(code, Level.INFO, message, details);
    }
}
