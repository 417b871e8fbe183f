package com.calai.mealplan.plan.pipeline;

import com.calai.mealplan.plan.reconcile.ReconcileResult;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * trace 用：某一個 scope（meal 名稱或 "day"）的 reconcile 結果，不含 meal 內容
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconcileSummary(
        String scope,
        boolean adjusted,
        Double factor,
        boolean factorInBounds,
        ReconcileResult.Reason reason
) {

    public static ReconcileSummary of(String scope, ReconcileResult r) {
        return new ReconcileSummary(scope, r.adjusted(), r.factor(), r.factorInBounds(), r.reason());
    }
}
