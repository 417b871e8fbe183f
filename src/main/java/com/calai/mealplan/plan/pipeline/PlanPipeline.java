package com.calai.mealplan.plan.pipeline;

import com.calai.mealplan.common.trace.TraceIds;
import com.calai.mealplan.plan.alert.AlertLevel;
import com.calai.mealplan.plan.alert.AlertSink;
import com.calai.mealplan.plan.alert.AlertType;
import com.calai.mealplan.plan.alert.ProgressListener;
import com.calai.mealplan.plan.config.PipelineConfig;
import com.calai.mealplan.plan.correction.LlmOutputValidator;
import com.calai.mealplan.plan.correction.MealJsonMapper;
import com.calai.mealplan.plan.correction.SchemaKind;
import com.calai.mealplan.plan.correction.ValidationResult;
import com.calai.mealplan.plan.error.LlmValidationException;
import com.calai.mealplan.plan.error.PipelineException;
import com.calai.mealplan.plan.error.PlanValidationException;
import com.calai.mealplan.plan.error.ResponseBlockedException;
import com.calai.mealplan.plan.error.StructuralException;
import com.calai.mealplan.plan.invariant.InvariantEngine;
import com.calai.mealplan.plan.invariant.Violation;
import com.calai.mealplan.plan.model.Confidence;
import com.calai.mealplan.plan.model.CookingMethod;
import com.calai.mealplan.plan.model.Correction;
import com.calai.mealplan.plan.model.DayPlan;
import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.ItemState;
import com.calai.mealplan.plan.model.MacroErrorCode;
import com.calai.mealplan.plan.model.MacroResult;
import com.calai.mealplan.plan.model.MacroTargets;
import com.calai.mealplan.plan.model.MacroTotals;
import com.calai.mealplan.plan.model.Meal;
import com.calai.mealplan.plan.model.MealType;
import com.calai.mealplan.plan.model.PlannedItem;
import com.calai.mealplan.plan.model.PlannedMeal;
import com.calai.mealplan.plan.model.Severity;
import com.calai.mealplan.plan.model.StateResolution;
import com.calai.mealplan.plan.nutrition.IngredientKeys;
import com.calai.mealplan.plan.reconcile.ReconcileResult;
import com.calai.mealplan.plan.reconcile.ReconciliationEngine;
import com.calai.mealplan.plan.transform.CookingTransformEngine;
import com.calai.mealplan.plan.transform.StateResolver;
import com.calai.mealplan.plan.transform.UnitConverter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * meal plan 計算的主流程（嚴格依序，每個 stage 記錄耗時到 trace）：
 * <pre>
 * ENTRY_GUARD → VALIDATE_STRUCTURE → VALIDATE_LLM_OUTPUT(+retry) → NORMALIZE_STATE → EXTRACT_INGREDIENTS
 * → FETCH_NUTRITION → COMPUTE_MACROS → MEAL_RECONCILE → DAY_RECONCILE → SANITIZE
 * → RESPONSE_BLOCK_CHECK → VALIDATE_PLAN → EMIT
 * </pre>
 * 只有 FETCH_NUTRITION 會 fan-out；其他 stage 都同步跑完才進下一個。
 */
@Slf4j
@Component
public class PlanPipeline {

    public static final String MDC_KEY = TraceIds.MDC_KEY;

    private final PipelineConfig baseConfig;
    private final LlmOutputValidator outputValidator;
    private final CookingTransformEngine transform;
    private final InvariantEngine invariants;
    private final NutritionFetcher fetcher;
    private final ReconciliationEngine reconciler;
    private final PlanSanitizer sanitizer;
    private final PlanValidator planValidator;
    private final AlertSink alerts;
    private final PipelineTelemetry telemetry;

    public PlanPipeline(PipelineConfig baseConfig,
                        LlmOutputValidator outputValidator,
                        CookingTransformEngine transform,
                        InvariantEngine invariants,
                        NutritionFetcher fetcher,
                        ReconciliationEngine reconciler,
                        PlanSanitizer sanitizer,
                        PlanValidator planValidator,
                        AlertSink alerts,
                        PipelineTelemetry telemetry) {
        this.baseConfig = baseConfig;
        this.outputValidator = outputValidator;
        this.transform = transform;
        this.invariants = invariants;
        this.fetcher = fetcher;
        this.reconciler = reconciler;
        this.sanitizer = sanitizer;
        this.planValidator = planValidator;
        this.alerts = alerts;
        this.telemetry = telemetry;
    }

    /** 原始順序中的一格：computedIndex >= 0 代表參與計算，否則是被排除的 meal */
    private record Slot(int computedIndex, PlannedMeal excluded) {
    }

    private record StructureSplit(ArrayNode valid, List<Slot> slots, int excludedCount) {
    }

    /** 單次 run 的可變狀態（不跨 run 共用） */
    private static final class Run {
        final String traceId;
        final ProgressListener listener;
        final TraceRecorder trace;
        PipelineConfig cfg;
        PipelineStage current;
        int softViolations;

        Run(String traceId, ProgressListener listener) {
            this.traceId = traceId;
            this.listener = listener;
            this.trace = new TraceRecorder(traceId);
        }
    }

    public PipelineResult execute(PipelineRequest req) {
        String traceId = resolveTraceId(req.traceId());
        // override 不合法是呼叫端的錯，不算 pipeline failure
        PipelineConfig cfg = baseConfig.withOverrides(req.config());
        String previousMdc = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, traceId);

        Run run = new Run(traceId, req.listener() == null ? ProgressListener.NOOP : req.listener());
        long t0 = System.nanoTime();
        try {
            run.cfg = cfg;
            PipelineResult result = runStages(req, run);
            telemetry.runCompleted(result.trace(), elapsedMs(t0));
            return result;
        } catch (PipelineException e) {
            onFailure(run, e, e.code(), e.stage(), t0);
            throw e;
        } catch (RuntimeException e) {
            onFailure(run, e, "INTERNAL_ERROR", null, t0);
            throw e;
        } finally {
            if (previousMdc == null) MDC.remove(MDC_KEY);
            else MDC.put(MDC_KEY, previousMdc);
        }
    }

    private PipelineResult runStages(PipelineRequest req, Run run) {
        PipelineConfig cfg = run.cfg;
        String traceId = run.traceId;
        MacroTargets targets = req.targets();

        // ---- ENTRY_GUARD ----
        long t = begin(run, PipelineStage.ENTRY_GUARD);
        JsonNode raw = req.rawMeals();
        entryGuard(raw, traceId);
        telemetry.runStarted(traceId, raw.size(), targets == null ? 0 : targets.kcal());
        end(run, PipelineStage.ENTRY_GUARD, t);

        // ---- VALIDATE_STRUCTURE ----
        t = begin(run, PipelineStage.VALIDATE_STRUCTURE);
        StructureSplit split = structureGuard(raw, traceId);
        end(run, PipelineStage.VALIDATE_STRUCTURE, t);

        // ---- VALIDATE_LLM_OUTPUT (+retry) ----
        t = begin(run, PipelineStage.VALIDATE_LLM_OUTPUT);
        List<String> accumulated = new ArrayList<>();
        ValidationResult vr;
        int attempts = 0;
        while (true) {
            attempts++;
            vr = outputValidator.validate(split.valid(), SchemaKind.MEALS_ARRAY);
            if (vr.valid()) break;

            for (String e : vr.errors()) {
                accumulated.add("attempt " + attempts + ": " + e);
            }

            if (req.retryCallback() == null || attempts > cfg.maxLlmRetries()) {
                run.trace.llmAttempts = attempts;
                log.warn("llm_output_invalid traceId={} attempts={} errors={}", traceId, attempts, vr.errors().size());
                alerts.emit(AlertLevel.CRITICAL, AlertType.LLM_VALIDATION_FAILED, traceId,
                        Map.of("attempts", attempts, "errorCount", accumulated.size()));
                throw new LlmValidationException(accumulated, attempts, traceId, PipelineStage.VALIDATE_LLM_OUTPUT.name());
            }

            log.info("llm_output_invalid_retry traceId={} attempt={} maxRetries={} errors={}",
                    traceId, attempts, cfg.maxLlmRetries(), vr.errors().size());
            run.listener.onValidationWarning("Generated plan failed validation, regenerating (attempt " + (attempts + 1) + ")");

            // 重新產生的也要重過 entry / structure guard
            JsonNode regenerated = req.retryCallback().regenerate();
            entryGuard(regenerated, traceId);
            split = structureGuard(regenerated, traceId);
        }
        run.trace.llmAttempts = attempts;
        List<Correction> corrections = vr.corrections();
        run.trace.corrections = corrections.size();
        List<Meal> meals = MealJsonMapper.toMeals(vr.correctedOutput());
        end(run, PipelineStage.VALIDATE_LLM_OUTPUT, t);

        // ---- NORMALIZE_STATE ----
        t = begin(run, PipelineStage.NORMALIZE_STATE);
        List<Meal> normalized = new ArrayList<>(meals.size());
        for (Meal m : meals) {
            List<Item> items = new ArrayList<>(m.items().size());
            for (Item it : m.items()) {
                items.add(normalizeState(it, run));
            }
            normalized.add(m.withItems(items));
        }
        meals = normalized;
        end(run, PipelineStage.NORMALIZE_STATE, t);

        // ---- EXTRACT_INGREDIENTS ----
        t = begin(run, PipelineStage.EXTRACT_INGREDIENTS);
        Set<String> keys = new LinkedHashSet<>();
        for (Meal m : meals) {
            for (Item it : m.items()) {
                String k = IngredientKeys.normalize(it.key());
                if (!IngredientKeys.UNKNOWN.equals(k)) keys.add(k);
            }
        }
        end(run, PipelineStage.EXTRACT_INGREDIENTS, t);

        // ---- FETCH_NUTRITION ----
        t = begin(run, PipelineStage.FETCH_NUTRITION);
        NutritionFetcher.Outcome fetched = fetcher.fetchAll(keys, cfg.nutritionTimeout(), traceId, run.listener);
        run.trace.fetchStats = fetched.stats();
        end(run, PipelineStage.FETCH_NUTRITION, t);

        // ---- COMPUTE_MACROS ----
        t = begin(run, PipelineStage.COMPUTE_MACROS);
        MacroCalculator calc = new MacroCalculator(fetched.records(), transform, invariants, alerts, cfg, traceId, run.listener);
        for (Meal m : meals) {
            for (Item it : m.items()) {
                softCheckItem(it, run);
                calc.apply(it, m.items());
            }
        }
        end(run, PipelineStage.COMPUTE_MACROS, t);

        // ---- MEAL_RECONCILE ----
        t = begin(run, PipelineStage.MEAL_RECONCILE);
        if (targets != null && targets.kcal() > 0) {
            MacroTargets perMeal = targets.perMeal(meals.size());
            List<Meal> adjusted = new ArrayList<>(meals.size());
            for (Meal m : meals) {
                ReconcileResult r = reconciler.reconcileMeal(m, perMeal, calc, cfg, traceId);
                run.trace.mealReconciliations.add(ReconcileSummary.of(m.name(), r));
                adjusted.add(r.meal());
            }
            meals = adjusted;
        }
        end(run, PipelineStage.MEAL_RECONCILE, t);

        // ---- DAY_RECONCILE ----
        t = begin(run, PipelineStage.DAY_RECONCILE);
        ReconcileResult day = reconciler.reconcileDay(meals, targets, calc, cfg, traceId);
        run.trace.dayReconciliation = ReconcileSummary.of("day", day);
        meals = day.meals();
        end(run, PipelineStage.DAY_RECONCILE, t);

        // ---- SANITIZE ----
        t = begin(run, PipelineStage.SANITIZE);
        List<PlannedMeal> planned = buildPlannedMeals(split.slots(), meals, calc);
        PlanSanitizer.Sanitized sanitized = sanitizer.sanitize(planned);
        run.trace.sanitizationStats = sanitized.stats();
        if (sanitized.stats().fieldsCoerced() > 0 || sanitized.stats().mealsPatched() > 0) {
            log.warn("plan_sanitized traceId={} fieldsCoerced={} mealsPatched={}",
                    traceId, sanitized.stats().fieldsCoerced(), sanitized.stats().mealsPatched());
        }
        planned = sanitized.meals();
        MacroTotals dayTotals = MacroTotals.ZERO;
        for (PlannedMeal m : planned) {
            if (m.computed()) dayTotals = dayTotals.plus(m.totals());
        }
        dayTotals = dayTotals.rounded();
        end(run, PipelineStage.SANITIZE, t);

        // ---- RESPONSE_BLOCK_CHECK ----
        t = begin(run, PipelineStage.RESPONSE_BLOCK_CHECK);
        InvariantStats stats = invariantStats(planned, run.softViolations);
        run.trace.invariantStats = stats;
        if (stats.totalItems() > 0 && stats.flaggedRatePct() > cfg.responseBlockThresholdPct()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("flaggedCount", stats.flaggedCount());
            payload.put("totalItems", stats.totalItems());
            payload.put("flaggedRatePct", stats.flaggedRatePct());
            payload.put("thresholdPct", cfg.responseBlockThresholdPct());
            alerts.emit(AlertLevel.CRITICAL, AlertType.RESPONSE_BLOCKED, traceId, payload);
            throw new ResponseBlockedException(stats.flaggedCount(), stats.totalItems(), stats.flaggedRatePct(),
                    cfg.responseBlockThresholdPct(), traceId, PipelineStage.RESPONSE_BLOCK_CHECK.name());
        }
        end(run, PipelineStage.RESPONSE_BLOCK_CHECK, t);

        // ---- VALIDATE_PLAN ----
        t = begin(run, PipelineStage.VALIDATE_PLAN);
        DayPlan plan = new DayPlan(planned, dayTotals, targets);
        PlanValidationReport report = planValidator.validate(plan, run.trace.fetchStats, day, cfg);
        for (ValidationIssue w : report.warnings()) {
            run.listener.onValidationWarning(w.message());
        }
        if (!report.valid()) {
            alerts.emit(AlertLevel.CRITICAL, AlertType.VALIDATION_CRITICAL, traceId, Map.of(
                    "criticalCount", report.critical().size(),
                    "codes", report.critical().stream().map(ValidationIssue::code).distinct().toList(),
                    "blocking", cfg.enableBlockingValidation()));
            if (cfg.enableBlockingValidation()) {
                throw new PlanValidationException(report, traceId, PipelineStage.VALIDATE_PLAN.name());
            }
            log.warn("plan_validation_critical_not_blocking traceId={} criticalCount={}", traceId, report.critical().size());
        }
        end(run, PipelineStage.VALIDATE_PLAN, t);

        // ---- EMIT ----
        t = begin(run, PipelineStage.EMIT);
        end(run, PipelineStage.EMIT, t);
        return new PipelineResult(traceId, plan.meals(), plan.dayTotals(), targets, report, corrections, run.trace.snapshot());
    }

    // ===== guards =====

    private static void entryGuard(JsonNode raw, String traceId) {
        if (raw == null || !raw.isArray()) {
            String actual = raw == null ? "null" : raw.getNodeType().name().toLowerCase(Locale.ROOT);
            throw new StructuralException("Meals payload must be a JSON array, got " + actual,
                    traceId, PipelineStage.ENTRY_GUARD.name(), Map.of("actualType", actual));
        }
        if (raw.size() == 0) {
            throw new StructuralException("Meals payload is empty",
                    traceId, PipelineStage.ENTRY_GUARD.name(), Map.of("mealCount", 0));
        }
    }

    /**
     * items 不是非空 array 的 meal 排除在計算外（仍留在回應，computed=false）；全部都不合法 → 中止
     */
    private static StructureSplit structureGuard(JsonNode raw, String traceId) {
        ArrayNode valid = JsonNodeFactory.instance.arrayNode();
        List<Slot> slots = new ArrayList<>(raw.size());
        int excluded = 0;

        for (int i = 0; i < raw.size(); i++) {
            JsonNode m = raw.get(i);
            JsonNode items = (m != null && m.isObject()) ? m.get("items") : null;
            if (items != null && items.isArray() && items.size() > 0) {
                slots.add(new Slot(valid.size(), null));
                valid.add(m);
                continue;
            }
            excluded++;
            String reason = (m == null || !m.isObject()) ? "not_an_object"
                    : (items == null || items.isNull()) ? "missing_items"
                    : !items.isArray() ? "items_not_array" : "items_empty";
            log.warn("meal_excluded traceId={} index={} reason={}", traceId, i, reason);
            slots.add(new Slot(-1, excludedMeal(m)));
        }

        if (valid.size() == 0) {
            throw new StructuralException("No meal has a non-empty items array",
                    traceId, PipelineStage.VALIDATE_STRUCTURE.name(),
                    Map.of("mealCount", raw.size(), "excludedCount", excluded));
        }
        return new StructureSplit(valid, slots, excluded);
    }

    private static PlannedMeal excludedMeal(JsonNode m) {
        Meal shell = MealJsonMapper.toMeal(m);
        return new PlannedMeal(shell.type() == null ? MealType.SNACK : shell.type(), shell.name(),
                List.of(), MacroTotals.ZERO, false);
    }

    // ===== per item =====

    /**
     * upstream hint 預設保留；只有 HIGH confidence 的規則（烹調關鍵字 / 複合食材）才會蓋掉
     */
    private Item normalizeState(Item it, Run run) {
        StateResolution r = StateResolver.resolve(it.key());
        ItemState hint = it.stateHint();
        ItemState state;

        if (hint == null) {
            state = r.state();
        } else if (r.confidence() == Confidence.HIGH && r.state() != null && r.state() != hint) {
            log.info("state_override traceId={} key={} hint={} resolved={} ruleId={}",
                    run.traceId, it.keyOrEmpty(), hint.code(), r.state().code(), r.ruleId());
            alerts.emit(AlertLevel.INFO, AlertType.STATE_DISAGREEMENT, run.traceId, Map.of(
                    "key", it.keyOrEmpty(), "hint", hint.code(), "resolved", r.state().code(), "ruleId", r.ruleId()));
            state = r.state();
        } else {
            if (r.state() != null && r.state() != hint) {
                log.debug("state_disagreement_kept_hint traceId={} key={} hint={} resolved={} confidence={}",
                        run.traceId, it.keyOrEmpty(), hint.code(), r.state().code(), r.confidence());
            }
            state = hint;
        }

        CookingMethod method = it.methodHint() != null ? it.methodHint() : r.method();
        Item out = it.withResolution(r, state, method);

        invariants.checkResolvedState(out).ifPresent(v -> reportSoft(v, run));
        return out;
    }

    private void softCheckItem(Item it, Run run) {
        invariants.checkPositiveQuantity(it).ifPresent(v -> reportSoft(v, run));
        Double grams = UnitConverter.toGrams(UnitConverter.normalizeToGramsOrMl(it), it.key());
        invariants.checkReasonablePortion(it, grams, run.cfg).ifPresent(v -> reportSoft(v, run));
    }

    private static void reportSoft(Violation v, Run run) {
        run.softViolations++;
        log.debug("invariant_soft traceId={} id={} severity={} message={}",
                run.traceId, v.invariantId(), v.severity(), v.message());
        run.listener.onInvariantWarning(v);
    }

    // ===== assemble =====

    private static List<PlannedMeal> buildPlannedMeals(List<Slot> slots, List<Meal> meals, MacroCalculator calc) {
        List<PlannedMeal> out = new ArrayList<>(slots.size());
        for (Slot s : slots) {
            if (s.computedIndex() < 0) {
                out.add(s.excluded());
                continue;
            }
            Meal m = meals.get(s.computedIndex());
            List<PlannedItem> items = new ArrayList<>(m.items().size());
            MacroTotals totals = MacroTotals.ZERO;
            for (Item it : m.items()) {
                MacroResult r = calc.apply(it, m.items());
                items.add(new PlannedItem(it, r));
                totals = totals.plus(r);
            }
            out.add(new PlannedMeal(m.type(), m.name(), items, totals.rounded(), true));
        }
        return out;
    }

    static InvariantStats invariantStats(List<PlannedMeal> meals, int softViolations) {
        int total = 0, warning = 0, critical = 0, errors = 0;
        for (PlannedMeal m : meals) {
            if (!m.computed()) continue;
            for (PlannedItem pi : m.items()) {
                total++;
                MacroResult r = pi.macros();
                if (r.flagged() && r.severity() == Severity.CRITICAL) critical++;
                else if (r.flagged()) warning++;
                if (r.hasError() && r.errorCode() != MacroErrorCode.MACRO_INCONSISTENT) errors++;
            }
        }
        double rate = total == 0 ? 0.0 : Math.round((warning + critical) * 1000.0 / total) / 10.0;
        return new InvariantStats(total, warning, critical, errors, softViolations, rate);
    }

    // ===== run bookkeeping =====

    private long begin(Run run, PipelineStage stage) {
        run.current = stage;
        return System.nanoTime();
    }

    private void end(Run run, PipelineStage stage, long startNanos) {
        long ms = elapsedMs(startNanos);
        run.trace.record(stage, ms);
        telemetry.stage(run.traceId, stage, ms);
    }

    private void onFailure(Run run, RuntimeException e, String code, String stage, long t0) {
        String failedStage = stage != null ? stage : (run.current == null ? null : run.current.name());
        log.error("pipeline_failed traceId={} stage={} errorCode={} message={}",
                run.traceId, failedStage, code, e.getMessage(), e);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("errorCode", code);
        payload.put("stage", failedStage == null ? "UNKNOWN" : failedStage);
        payload.put("message", String.valueOf(e.getMessage()));
        payload.put("completedStages", run.trace.stages());
        alerts.emit(AlertLevel.CRITICAL, AlertType.PIPELINE_FAILURE, run.traceId, payload);
        telemetry.runFailed(run.traceId, run.current, elapsedMs(t0), code);
    }

    private static String resolveTraceId(String requested) {
        return TraceIds.resolve(requested);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
