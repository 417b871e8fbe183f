package com.calai.mealplan.plan.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * run 期間的可變紀錄；結束時轉成不可變的 {@link PipelineTrace}
 */
final class TraceRecorder {

    private final String traceId;
    private final List<String> stages = new ArrayList<>();
    private final Map<String, Long> timingsMs = new LinkedHashMap<>();

    int llmAttempts;
    int corrections;
    FetchStats fetchStats = FetchStats.EMPTY;
    InvariantStats invariantStats = InvariantStats.EMPTY;
    SanitizationStats sanitizationStats = SanitizationStats.EMPTY;
    final List<ReconcileSummary> mealReconciliations = new ArrayList<>();
    ReconcileSummary dayReconciliation;

    TraceRecorder(String traceId) {
        this.traceId = traceId;
    }

    String traceId() {
        return traceId;
    }

    void record(PipelineStage stage, long elapsedMs) {
        stages.add(stage.name());
        timingsMs.put(stage.name(), elapsedMs);
    }

    List<String> stages() {
        return Collections.unmodifiableList(stages);
    }

    PipelineTrace snapshot() {
        return new PipelineTrace(traceId, List.copyOf(stages), Collections.unmodifiableMap(new LinkedHashMap<>(timingsMs)),
                llmAttempts, corrections, fetchStats, invariantStats, sanitizationStats,
                List.copyOf(mealReconciliations), dayReconciliation);
    }
}
