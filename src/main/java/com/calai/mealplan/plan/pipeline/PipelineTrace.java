package com.calai.mealplan.plan.pipeline;

import java.util.List;
import java.util.Map;

/**
 * 一次 run 的追蹤資料；只有 orchestrator 會寫（透過 {@link TraceRecorder}）
 */
public record PipelineTrace(
        String traceId,
        List<String> stages,
        Map<String, Long> timingsMs,
        int llmAttempts,
        int corrections,
        FetchStats fetchStats,
        InvariantStats invariantStats,
        SanitizationStats sanitizationStats,
        List<ReconcileSummary> mealReconciliations,
        ReconcileSummary dayReconciliation
) {
}
