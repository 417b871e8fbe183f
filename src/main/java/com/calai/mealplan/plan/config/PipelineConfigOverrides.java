package com.calai.mealplan.plan.config;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * per-request 調整；null = 沿用部署設定
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineConfigOverrides(
        Double flagThresholdPct,
        Double blockThresholdPct,
        Double responseBlockThresholdPct,
        Boolean enableConsistencyGate,
        Double reconciliationTolerancePct,
        Integer maxLlmRetries,
        Boolean enableBlockingValidation,
        Boolean mealProteinScaling
) {
    public static PipelineConfigOverrides none() {
        return new PipelineConfigOverrides(null, null, null, null, null, null, null, null);
    }
}
