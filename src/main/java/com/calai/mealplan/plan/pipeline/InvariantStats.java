package com.calai.mealplan.plan.pipeline;

/**
 * flaggedRatePct = (warning + critical) / totalItems × 100
 */
public record InvariantStats(
        int totalItems,
        int warningCount,
        int criticalCount,
        int errorCount,
        int softViolations,
        double flaggedRatePct
) {
    public static final InvariantStats EMPTY = new InvariantStats(0, 0, 0, 0, 0, 0.0);

    public int flaggedCount() {
        return warningCount + criticalCount;
    }
}
