package com.calai.mealplan.plan.config;

import java.time.Duration;

/**
 * 一次 pipeline run 用的不可變設定。
 * 由 {@link PipelineProperties} 轉出，per-request override 會產生新的 instance，不改原本的。
 */
public record PipelineConfig(
        double flagThresholdPct,
        double blockThresholdPct,
        double responseBlockThresholdPct,
        boolean enableConsistencyGate,
        double reconciliationTolerancePct,
        int maxLlmRetries,
        boolean enableBlockingValidation,
        boolean mealProteinScaling,
        double portionMinGrams,
        double portionMaxGrams,
        double factorMin,
        double factorMax,
        double dayMinKcal,
        double dayMaxKcal,
        double dayTolerancePct,
        Duration nutritionTimeout
) {

    public PipelineConfig {
        if (!(flagThresholdPct >= 0) || !(blockThresholdPct >= flagThresholdPct)) {
            throw new IllegalArgumentException("CONSISTENCY_THRESHOLDS_INVALID");
        }
        if (!(responseBlockThresholdPct >= 0) || responseBlockThresholdPct > 100) {
            throw new IllegalArgumentException("RESPONSE_BLOCK_THRESHOLD_INVALID");
        }
        if (!(reconciliationTolerancePct >= 0)) {
            throw new IllegalArgumentException("RECONCILIATION_TOLERANCE_INVALID");
        }
        if (maxLlmRetries < 0) {
            throw new IllegalArgumentException("MAX_LLM_RETRIES_INVALID");
        }
        if (!(portionMinGrams > 0) || !(portionMaxGrams > portionMinGrams)) {
            throw new IllegalArgumentException("PORTION_BOUNDS_INVALID");
        }
        if (!(factorMin > 0) || !(factorMax > factorMin)) {
            throw new IllegalArgumentException("FACTOR_BOUNDS_INVALID");
        }
        if (!(dayMinKcal >= 0) || !(dayMaxKcal > dayMinKcal)) {
            throw new IllegalArgumentException("DAY_KCAL_BOUNDS_INVALID");
        }
        if (nutritionTimeout == null || nutritionTimeout.isNegative() || nutritionTimeout.isZero()) {
            nutritionTimeout = Duration.ofSeconds(7);
        }
    }

    public static PipelineConfig defaults() {
        return new PipelineProperties().toConfig();
    }

    public PipelineConfig withOverrides(PipelineConfigOverrides o) {
        if (o == null) return this;
        return new PipelineConfig(
                pick(o.flagThresholdPct(), flagThresholdPct),
                pick(o.blockThresholdPct(), blockThresholdPct),
                pick(o.responseBlockThresholdPct(), responseBlockThresholdPct),
                pick(o.enableConsistencyGate(), enableConsistencyGate),
                pick(o.reconciliationTolerancePct(), reconciliationTolerancePct),
                pick(o.maxLlmRetries(), maxLlmRetries),
                pick(o.enableBlockingValidation(), enableBlockingValidation),
                pick(o.mealProteinScaling(), mealProteinScaling),
                portionMinGrams,
                portionMaxGrams,
                factorMin,
                factorMax,
                dayMinKcal,
                dayMaxKcal,
                dayTolerancePct,
                nutritionTimeout
        );
    }

    private static double pick(Double v, double fallback) {
        return (v == null || !Double.isFinite(v)) ? fallback : v;
    }

    private static int pick(Integer v, int fallback) {
        return v == null ? fallback : v;
    }

    private static boolean pick(Boolean v, boolean fallback) {
        return v == null ? fallback : v;
    }
}
