package com.calai.mealplan.plan.pipeline;

import com.calai.mealplan.plan.config.PipelineConfig;
import com.calai.mealplan.plan.invariant.InvariantEngine;
import com.calai.mealplan.plan.invariant.InvariantId;
import com.calai.mealplan.plan.invariant.Violation;
import com.calai.mealplan.plan.model.DayPlan;
import com.calai.mealplan.plan.model.MacroErrorCode;
import com.calai.mealplan.plan.model.MacroResult;
import com.calai.mealplan.plan.model.MacroTargets;
import com.calai.mealplan.plan.model.PlannedItem;
import com.calai.mealplan.plan.model.PlannedMeal;
import com.calai.mealplan.plan.reconcile.ReconcileResult;
import com.calai.mealplan.plan.transform.GramsOrMl;
import com.calai.mealplan.plan.transform.UnitConverter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.calai.mealplan.plan.transform.KeyRules.containsAny;

/**
 * VALIDATE-PLAN：整份計畫出貨前的最後檢查。
 * 只產生 report，要不要擋由 orchestrator 看 enableBlockingValidation 決定。
 */
@Component
public class PlanValidator {

    public static final double ITEM_MAX_KCAL = 1200;
    public static final double ITEM_MIN_PORTION = 10;
    public static final double ITEM_MAX_PORTION = 800;
    public static final double DAY_DEVIATION_WARN_PCT = 15;
    public static final double DAY_DEVIATION_CRITICAL_PCT = 50;
    public static final double FALLBACK_WARN_PCT = 30;
    public static final double FALLBACK_CRITICAL_PCT = 50;

    private final InvariantEngine invariants;

    public PlanValidator(InvariantEngine invariants) {
        this.invariants = invariants;
    }

    public PlanValidationReport validate(DayPlan plan, FetchStats fetch, ReconcileResult dayReconcile, PipelineConfig cfg) {
        List<ValidationIssue> issues = new ArrayList<>();

        // ---- day totals（invariant）----
        List<Violation> dayViolations = invariants.checkDayTotals(plan.dayTotals(), plan.targets(), cfg);
        for (Violation v : dayViolations) {
            Map<String, Object> d = new LinkedHashMap<>(v.context());
            d.put("invariantId", v.invariantId().name());
            issues.add(ValidationIssue.critical("INVARIANT_VIOLATION", v.message(), d));
        }

        // ---- meals / items ----
        int flagged = 0;
        int zeroed = 0;
        int excluded = 0;
        for (PlannedMeal m : plan.meals()) {
            if (!m.computed()) {
                excluded++;
                continue;
            }
            if (m.items().isEmpty()) {
                issues.add(ValidationIssue.critical("MEAL_EMPTY", "Meal '" + m.name() + "' has no items",
                        Map.of("meal", m.name())));
                continue;
            }
            for (PlannedItem pi : m.items()) {
                MacroResult r = pi.macros();
                String key = pi.item().keyOrEmpty();
                if (r.flagged()) flagged++;
                if (r.hasError() && r.errorCode() != MacroErrorCode.MACRO_INCONSISTENT) zeroed++;
                checkItem(m, pi, key, r, issues);
            }
        }

        // ---- day deviation ----
        MacroTargets t = plan.targets();
        boolean invariantCoveredDeviation = dayViolations.stream()
                .anyMatch(v -> v.invariantId() == InvariantId.DAY_TARGET_DEVIATION);
        if (t != null && t.kcal() > 0 && plan.dayTotals().kcal() > 0) {
            double dev = Math.abs(plan.dayTotals().kcal() - t.kcal()) / t.kcal() * 100.0;
            Map<String, Object> d = Map.of("actualKcal", plan.dayTotals().kcal(), "targetKcal", t.kcal(), "deviationPct", round1(dev));
            String msg = String.format(Locale.ROOT, "Day calories deviate %.1f%% from target", dev);
            if (dev > DAY_DEVIATION_CRITICAL_PCT) {
                if (!invariantCoveredDeviation) issues.add(ValidationIssue.critical("DAY_CALORIE_DEVIATION", msg, d));
            } else if (dev > DAY_DEVIATION_WARN_PCT) {
                issues.add(ValidationIssue.warning("DAY_CALORIE_DEVIATION", msg, d));
            }
        }

        // ---- nutrition fallback ratio ----
        if (fetch != null && fetch.found() > 0) {
            double rate = fetch.fallbackRatePct();
            Map<String, Object> d = Map.of("fallbackRatePct", rate, "fallback", fetch.fallback(), "found", fetch.found());
            String msg = String.format(Locale.ROOT, "%.1f%% of nutrition data came from fallback matches", rate);
            if (rate > FALLBACK_CRITICAL_PCT) issues.add(ValidationIssue.critical("HIGH_FALLBACK_RATIO", msg, d));
            else if (rate > FALLBACK_WARN_PCT) issues.add(ValidationIssue.warning("HIGH_FALLBACK_RATIO", msg, d));
        }

        // ---- reconciliation：超界只是資料品質訊號 ----
        if (dayReconcile != null && dayReconcile.factor() != null && !dayReconcile.factorInBounds()) {
            issues.add(ValidationIssue.warning("RECONCILIATION_BOUNDS",
                    String.format(Locale.ROOT, "Day reconciliation factor %.3f outside [%.2f, %.2f]",
                            dayReconcile.factor(), cfg.factorMin(), cfg.factorMax()),
                    Map.of("factor", dayReconcile.factor())));
        }

        // ---- info ----
        if (flagged > 0) {
            issues.add(ValidationIssue.info("ITEMS_FLAGGED", flagged + " item(s) flagged for macro-kcal inconsistency",
                    Map.of("count", flagged)));
        }
        if (zeroed > 0) {
            issues.add(ValidationIssue.info("ITEMS_ZEROED", zeroed + " item(s) could not be computed and count as 0 kcal",
                    Map.of("count", zeroed)));
        }
        if (excluded > 0) {
            issues.add(ValidationIssue.info("MEALS_EXCLUDED", excluded + " meal(s) excluded by structure guard",
                    Map.of("count", excluded)));
        }

        return PlanValidationReport.of(issues);
    }

    private static void checkItem(PlannedMeal m, PlannedItem pi, String key, MacroResult r, List<ValidationIssue> issues) {
        Map<String, Object> base = new LinkedHashMap<>();
        base.put("meal", m.name());
        base.put("key", key);

        if (r.kcal() < 0 || r.protein() < 0 || r.fat() < 0 || r.carbs() < 0) {
            issues.add(ValidationIssue.critical("ITEM_NEGATIVE_VALUE", "Item '" + key + "' has negative macro values", base));
        }

        if (r.kcal() > ITEM_MAX_KCAL && !isFatItem(key)) {
            Map<String, Object> d = new LinkedHashMap<>(base);
            d.put("kcal", r.kcal());
            issues.add(ValidationIssue.critical("ITEM_HIGH_CALORIES",
                    String.format(Locale.ROOT, "Item '%s' has %.0f kcal (> %.0f)", key, r.kcal(), ITEM_MAX_KCAL), d));
        }

        GramsOrMl q = UnitConverter.normalizeToGramsOrMl(pi.item());
        if (q.valid() && q.value() > 0) {
            double v = q.value();
            boolean tooSmall = v < ITEM_MIN_PORTION && !isSmallPortionItem(key);
            if (tooSmall || v > ITEM_MAX_PORTION) {
                Map<String, Object> d = new LinkedHashMap<>(base);
                d.put("quantity", round1(v));
                d.put("measure", q.measure().name());
                issues.add(ValidationIssue.warning("ITEM_PORTION_SIZE",
                        String.format(Locale.ROOT, "Item '%s' portion %.1f is outside [%.0f, %.0f]",
                                key, v, ITEM_MIN_PORTION, ITEM_MAX_PORTION), d));
            }
        }
    }

    /** 油脂類本來就高熱量，不算異常 */
    static boolean isFatItem(String key) {
        return containsAny("oil", "butter", "ghee", "lard", "fat", "dripping").test(key.toLowerCase(Locale.ROOT));
    }

    static boolean isSmallPortionItem(String key) {
        return containsAny("oil", "spice", "salt").test(key.toLowerCase(Locale.ROOT));
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
