package com.calai.mealplan.plan.error;

import java.util.Locale;
import java.util.Map;

/**
 * flagged item 比例太高：就算沒有單一 CRITICAL，也整份不出貨
 */
public class ResponseBlockedException extends PipelineException {

    public static final String CODE = "RESPONSE_BLOCKED";

    private final int flaggedCount;
    private final int totalItems;
    private final double flaggedRatePct;
    private final double thresholdPct;

    public ResponseBlockedException(int flaggedCount, int totalItems, double flaggedRatePct, double thresholdPct,
                                    String traceId, String stage) {
        super(CODE,
                String.format(Locale.ROOT,
                        "Response blocked: %.1f%% of items have macro-kcal inconsistencies (threshold: %.1f%%)",
                        flaggedRatePct, thresholdPct),
                traceId, stage,
                Map.of("flaggedCount", flaggedCount,
                        "totalItems", totalItems,
                        "flaggedRatePct", flaggedRatePct,
                        "thresholdPct", thresholdPct),
                null);
        this.flaggedCount = flaggedCount;
        this.totalItems = totalItems;
        this.flaggedRatePct = flaggedRatePct;
        this.thresholdPct = thresholdPct;
    }

    public int flaggedCount() { return flaggedCount; }
    public int totalItems() { return totalItems; }
    public double flaggedRatePct() { return flaggedRatePct; }
    public double thresholdPct() { return thresholdPct; }
}
