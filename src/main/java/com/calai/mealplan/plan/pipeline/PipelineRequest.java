package com.calai.mealplan.plan.pipeline;

import com.calai.mealplan.plan.alert.ProgressListener;
import com.calai.mealplan.plan.config.PipelineConfigOverrides;
import com.calai.mealplan.plan.model.MacroTargets;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * retryCallback / config / listener / traceId 都可以是 null
 */
public record PipelineRequest(
        JsonNode rawMeals,
        MacroTargets targets,
        RetryCallback retryCallback,
        PipelineConfigOverrides config,
        ProgressListener listener,
        String traceId
) {

    public static PipelineRequest of(JsonNode rawMeals, MacroTargets targets) {
        return new PipelineRequest(rawMeals, targets, null, null, null, null);
    }

    public PipelineRequest withRetryCallback(RetryCallback cb) {
        return new PipelineRequest(rawMeals, targets, cb, config, listener, traceId);
    }

    public PipelineRequest withConfig(PipelineConfigOverrides overrides) {
        return new PipelineRequest(rawMeals, targets, retryCallback, overrides, listener, traceId);
    }

    public PipelineRequest withListener(ProgressListener l) {
        return new PipelineRequest(rawMeals, targets, retryCallback, config, l, traceId);
    }

    public PipelineRequest withTraceId(String id) {
        return new PipelineRequest(rawMeals, targets, retryCallback, config, listener, id);
    }
}
