package com.calai.mealplan.plan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * application.yml:
 * app.mealplan.pipeline.*
 */
@ConfigurationProperties(prefix = "app.mealplan.pipeline")
public class PipelineProperties {

    /** macro-kcal 偏差超過此 % → WARNING（flag，但保留 item） */
    private double flagThresholdPct = 25.0;

    /** 超過此 % → CRITICAL（item 歸零 + flagged） */
    private double blockThresholdPct = 50.0;

    /** 整份計畫 flagged 比例超過此 % → 整個 response 擋下 */
    private double responseBlockThresholdPct = 80.0;

    /** 關掉就不做 macro-kcal consistency gate（只算不擋） */
    private boolean enableConsistencyGate = true;

    /** meal / day reconciliation 容忍帶（%） */
    private double reconciliationTolerancePct = 10.0;

    /** LLM 輸出驗證失敗時最多重打幾次 */
    private int maxLlmRetries = 2;

    /** VALIDATE-PLAN 有 critical issue 時是否直接擋 */
    private boolean enableBlockingValidation = true;

    /** meal-level reconciliation 是否連 protein item 一起縮放 */
    private boolean mealProteinScaling = true;

    private double portionMinGrams = 5.0;
    private double portionMaxGrams = 1000.0;

    /** reconciliation factor 合理範圍 */
    private double factorMin = 0.5;
    private double factorMax = 2.0;

    /** 每日總熱量合理範圍（非 0 時才檢查） */
    private double dayMinKcal = 500.0;
    private double dayMaxKcal = 10000.0;

    /** 每日總熱量與 target 的最大偏差（%） */
    private double dayTolerancePct = 50.0;

    /** nutrition fan-out 整體等待上限 */
    private Duration nutritionTimeout = Duration.ofSeconds(7);

    public PipelineConfig toConfig() {
        return new PipelineConfig(
                flagThresholdPct, blockThresholdPct, responseBlockThresholdPct, enableConsistencyGate,
                reconciliationTolerancePct, maxLlmRetries, enableBlockingValidation, mealProteinScaling,
                portionMinGrams, portionMaxGrams, factorMin, factorMax,
                dayMinKcal, dayMaxKcal, dayTolerancePct, nutritionTimeout
        );
    }

    // ===== getters/setters =====
    public double getFlagThresholdPct() { return flagThresholdPct; }
    public void setFlagThresholdPct(double flagThresholdPct) { this.flagThresholdPct = flagThresholdPct; }

    public double getBlockThresholdPct() { return blockThresholdPct; }
    public void setBlockThresholdPct(double blockThresholdPct) { this.blockThresholdPct = blockThresholdPct; }

    public double getResponseBlockThresholdPct() { return responseBlockThresholdPct; }
    public void setResponseBlockThresholdPct(double v) { this.responseBlockThresholdPct = v; }

    public boolean isEnableConsistencyGate() { return enableConsistencyGate; }
    public void setEnableConsistencyGate(boolean enableConsistencyGate) { this.enableConsistencyGate = enableConsistencyGate; }

    public double getReconciliationTolerancePct() { return reconciliationTolerancePct; }
    public void setReconciliationTolerancePct(double v) { this.reconciliationTolerancePct = v; }

    public int getMaxLlmRetries() { return maxLlmRetries; }
    public void setMaxLlmRetries(int maxLlmRetries) { this.maxLlmRetries = maxLlmRetries; }

    public boolean isEnableBlockingValidation() { return enableBlockingValidation; }
    public void setEnableBlockingValidation(boolean v) { this.enableBlockingValidation = v; }

    public boolean isMealProteinScaling() { return mealProteinScaling; }
    public void setMealProteinScaling(boolean mealProteinScaling) { this.mealProteinScaling = mealProteinScaling; }

    public double getPortionMinGrams() { return portionMinGrams; }
    public void setPortionMinGrams(double portionMinGrams) { this.portionMinGrams = portionMinGrams; }

    public double getPortionMaxGrams() { return portionMaxGrams; }
    public void setPortionMaxGrams(double portionMaxGrams) { this.portionMaxGrams = portionMaxGrams; }

    public double getFactorMin() { return factorMin; }
    public void setFactorMin(double factorMin) { this.factorMin = factorMin; }

    public double getFactorMax() { return factorMax; }
    public void setFactorMax(double factorMax) { this.factorMax = factorMax; }

    public double getDayMinKcal() { return dayMinKcal; }
    public void setDayMinKcal(double dayMinKcal) { this.dayMinKcal = dayMinKcal; }

    public double getDayMaxKcal() { return dayMaxKcal; }
    public void setDayMaxKcal(double dayMaxKcal) { this.dayMaxKcal = dayMaxKcal; }

    public double getDayTolerancePct() { return dayTolerancePct; }
    public void setDayTolerancePct(double dayTolerancePct) { this.dayTolerancePct = dayTolerancePct; }

    public Duration getNutritionTimeout() { return nutritionTimeout; }
    public void setNutritionTimeout(Duration nutritionTimeout) { this.nutritionTimeout = nutritionTimeout; }
}
