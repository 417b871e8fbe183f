package com.calai.mealplan.plan.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * pipeline 的單行 key=value log（方便 grep / log pipeline 解析）
 */
@Slf4j
@Service
public class PipelineTelemetry {

    public void runStarted(String traceId, int mealCount, double targetKcal) {
        log.info("pipeline_run status=STARTED traceId={} meals={} targetKcal={}",
                safe(traceId), mealCount, targetKcal);
    }

    public void stage(String traceId, PipelineStage stage, long elapsedMs) {
        log.debug("pipeline_stage traceId={} stage={} elapsedMs={}", safe(traceId), stage.name(), elapsedMs);
    }

    public void runCompleted(PipelineTrace trace, long elapsedMs) {
        log.info("pipeline_run status=OK traceId={} elapsedMs={} llmAttempts={} corrections={} keys={} fallbackRatePct={} items={} flaggedRatePct={} coerced={}",
                safe(trace.traceId()), elapsedMs, trace.llmAttempts(), trace.corrections(),
                trace.fetchStats().uniqueKeys(), trace.fetchStats().fallbackRatePct(),
                trace.invariantStats().totalItems(), trace.invariantStats().flaggedRatePct(),
                trace.sanitizationStats().fieldsCoerced());
    }

    public void runFailed(String traceId, PipelineStage stage, long elapsedMs, String errorCode) {
        log.warn("pipeline_run status=FAIL traceId={} stage={} elapsedMs={} errorCode={}",
                safe(traceId), stage == null ? "UNKNOWN" : stage.name(), elapsedMs, safe(errorCode));
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
}
