package com.calai.mealplan.plan.error;

import java.util.List;
import java.util.Map;

public class LlmValidationException extends PipelineException {

    public static final String CODE = "LLM_VALIDATION_FAILED";

    private final List<String> validationErrors;
    private final int attempts;

    public LlmValidationException(List<String> validationErrors, int attempts, String traceId, String stage) {
        super(CODE,
                "LLM output validation failed after " + attempts + " attempt(s)",
                traceId, stage,
                Map.of("attempts", attempts, "errorCount", validationErrors == null ? 0 : validationErrors.size()),
                null);
        this.validationErrors = (validationErrors == null) ? List.of() : List.copyOf(validationErrors);
        this.attempts = attempts;
    }

    public List<String> validationErrors() { return validationErrors; }
    public int attempts() { return attempts; }

    @Override
    public boolean recoverable() {
        return true;
    }
}
