package com.calai.mealplan.plan.invariant;

import com.calai.mealplan.plan.model.Severity;

/**
 * macro-kcal consistency 的判定結果。skipped=true 代表沒有足夠資料可比（expected 為 0 或非有限值）。
 */
public record ConsistencyCheck(
        boolean valid,
        Severity severity,
        double reportedKcal,
        double expectedKcal,
        double deviationPct,
        boolean skipped
) {
    public static ConsistencyCheck skipped(double reportedKcal, double expectedKcal) {
        return new ConsistencyCheck(true, Severity.VALID, reportedKcal, expectedKcal, 0.0, true);
    }
}
