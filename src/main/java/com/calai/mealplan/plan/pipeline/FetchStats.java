package com.calai.mealplan.plan.pipeline;

public record FetchStats(
        int uniqueKeys,
        int hotpath,
        int canonical,
        int fallback,
        int missing,
        int failed,
        double fallbackRatePct
) {
    public static final FetchStats EMPTY = new FetchStats(0, 0, 0, 0, 0, 0, 0.0);

    public int found() {
        return hotpath + canonical + fallback;
    }
}
