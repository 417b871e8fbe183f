package com.calai.mealplan.plan.invariant;

import com.calai.mealplan.plan.config.PipelineConfig;
import com.calai.mealplan.plan.model.DayPlan;
import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.ItemState;
import com.calai.mealplan.plan.model.MacroResult;
import com.calai.mealplan.plan.model.MacroTargets;
import com.calai.mealplan.plan.model.MacroTotals;
import com.calai.mealplan.plan.model.Meal;
import com.calai.mealplan.plan.model.PlannedMeal;
import com.calai.mealplan.plan.model.Severity;
import com.calai.mealplan.plan.model.StateResolution;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 無狀態的 invariant 檢查。
 * - checkXxx：不丟例外，回傳 Optional / report（tiered call site 用）
 * - assertXxx：有違規就丟 {@link InvariantViolationException}（hard-fail call site 用）
 * 門檻一律從 {@link PipelineConfig} 帶進來，不讀任何全域狀態。
 */
@Component
public class InvariantEngine {

    public static final double KCAL_PER_G_PROTEIN = 4.0;
    public static final double KCAL_PER_G_CARBS = 4.0;
    public static final double KCAL_PER_G_FAT = 9.0;

    // ===== macro-kcal consistency =====

    public ConsistencyCheck checkMacroCalorieConsistency(double kcal, double protein, double fat, double carbs,
                                                         double flagThresholdPct, double blockThresholdPct) {
        double expected = protein * KCAL_PER_G_PROTEIN + carbs * KCAL_PER_G_CARBS + fat * KCAL_PER_G_FAT;

        // expected=0：沒有 macro 可比，不判。kcal=0 但有 macro 照樣算 100% 偏差
        if (!Double.isFinite(kcal) || !Double.isFinite(expected) || expected == 0) {
            return ConsistencyCheck.skipped(kcal, expected);
        }

        double deviationPct = Math.abs(kcal - expected) / expected * 100.0;

        Severity sev;
        if (deviationPct > blockThresholdPct) sev = Severity.CRITICAL;
        else if (deviationPct > flagThresholdPct) sev = Severity.WARNING;
        else sev = Severity.VALID;

        return new ConsistencyCheck(sev == Severity.VALID, sev, kcal, expected, deviationPct, false);
    }

    public ConsistencyCheck checkMacroCalorieConsistency(MacroResult m, PipelineConfig cfg) {
        return checkMacroCalorieConsistency(m.kcal(), m.protein(), m.fat(), m.carbs(),
                cfg.flagThresholdPct(), cfg.blockThresholdPct());
    }

    public void assertMacroCalorieConsistency(MacroResult m, PipelineConfig cfg) {
        ConsistencyCheck c = checkMacroCalorieConsistency(m, cfg);
        if (!c.valid()) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("reportedKcal", c.reportedKcal());
            ctx.put("expectedKcal", Math.round(c.expectedKcal()));
            ctx.put("deviationPct", round2(c.deviationPct()));
            ctx.put("flagThresholdPct", cfg.flagThresholdPct());
            ctx.put("blockThresholdPct", cfg.blockThresholdPct());
            throw new InvariantViolationException(Violation.of(
                    InvariantId.MACRO_KCAL_CONSISTENCY, c.severity(),
                    String.format(Locale.ROOT,
                            "Macro-calorie inconsistency: reported %.0f kcal but macros suggest %.0f kcal (%.1f%% deviation)",
                            c.reportedKcal(), c.expectedKcal(), c.deviationPct()),
                    ctx));
        }
    }

    // ===== quantity =====

    public Optional<Violation> checkPositiveQuantity(Item item) {
        Double q = item.quantityValue();
        if (q == null) {
            return Optional.of(violation(InvariantId.POSITIVE_QUANTITY, Severity.CRITICAL,
                    "Missing quantity for item '" + item.keyOrEmpty() + "'", item, null));
        }
        if (!Double.isFinite(q)) {
            return Optional.of(violation(InvariantId.POSITIVE_QUANTITY, Severity.CRITICAL,
                    "Quantity must be finite for item '" + item.keyOrEmpty() + "', got " + q, item, null));
        }
        if (q <= 0) {
            return Optional.of(violation(InvariantId.POSITIVE_QUANTITY, Severity.CRITICAL,
                    "Quantity must be positive for item '" + item.keyOrEmpty() + "', got " + q, item, null));
        }
        return Optional.empty();
    }

    public void assertPositiveQuantity(Item item) {
        checkPositiveQuantity(item).ifPresent(InvariantEngine::raise);
    }

    /**
     * grams 為 null 代表算不出公克數 → 不檢查
     */
    public Optional<Violation> checkReasonablePortion(Item item, Double grams, PipelineConfig cfg) {
        if (grams == null || !Double.isFinite(grams)) return Optional.empty();

        if (grams < cfg.portionMinGrams()) {
            return Optional.of(violation(InvariantId.PORTION_BOUNDS, Severity.WARNING,
                    String.format(Locale.ROOT, "Portion size %.1fg for '%s' is below minimum %.0fg",
                            grams, item.keyOrEmpty(), cfg.portionMinGrams()),
                    item, Map.of("grams", grams, "minGrams", cfg.portionMinGrams())));
        }
        if (grams > cfg.portionMaxGrams()) {
            return Optional.of(violation(InvariantId.PORTION_BOUNDS, Severity.WARNING,
                    String.format(Locale.ROOT, "Portion size %.1fg for '%s' exceeds maximum %.0fg",
                            grams, item.keyOrEmpty(), cfg.portionMaxGrams()),
                    item, Map.of("grams", grams, "maxGrams", cfg.portionMaxGrams())));
        }
        return Optional.empty();
    }

    public void assertReasonablePortion(Item item, Double grams, PipelineConfig cfg) {
        checkReasonablePortion(item, grams, cfg).ifPresent(InvariantEngine::raise);
    }

    // ===== reconciliation factor =====

    public Optional<Violation> checkReconciliationFactor(Double factor, PipelineConfig cfg) {
        if (factor == null) return Optional.empty();

        if (!Double.isFinite(factor)) {
            return Optional.of(Violation.of(InvariantId.RECONCILIATION_FACTOR_BOUNDS, Severity.WARNING,
                    "Reconciliation factor must be a finite number, got " + factor,
                    Map.of("factor", String.valueOf(factor))));
        }
        if (factor < cfg.factorMin()) {
            return Optional.of(Violation.of(InvariantId.RECONCILIATION_FACTOR_BOUNDS, Severity.WARNING,
                    String.format(Locale.ROOT, "Reconciliation factor %.3f is below minimum %.2f", factor, cfg.factorMin()),
                    Map.of("factor", factor, "minBound", cfg.factorMin())));
        }
        if (factor > cfg.factorMax()) {
            return Optional.of(Violation.of(InvariantId.RECONCILIATION_FACTOR_BOUNDS, Severity.WARNING,
                    String.format(Locale.ROOT, "Reconciliation factor %.3f exceeds maximum %.2f", factor, cfg.factorMax()),
                    Map.of("factor", factor, "maxBound", cfg.factorMax())));
        }
        return Optional.empty();
    }

    public void assertReconciliationFactor(Double factor, PipelineConfig cfg) {
        checkReconciliationFactor(factor, cfg).ifPresent(InvariantEngine::raise);
    }

    // ===== yield coverage =====

    /**
     * cooked item 一定要有合法 yield factor（unmapped 會給 1.0，也算合法）
     */
    public Optional<Violation> checkYieldCoverage(Item item, ItemState resolvedState, Double yieldFactor) {
        if (resolvedState != ItemState.COOKED) return Optional.empty();
        if (yieldFactor == null || !Double.isFinite(yieldFactor) || yieldFactor <= 0) {
            return Optional.of(violation(InvariantId.YIELD_COVERAGE, Severity.WARNING,
                    "Cooked item '" + item.keyOrEmpty() + "' has no valid yield factor",
                    item, mapOfNullable("yieldFactor", yieldFactor)));
        }
        return Optional.empty();
    }

    public void assertYieldCoverage(Item item, ItemState resolvedState, Double yieldFactor) {
        checkYieldCoverage(item, resolvedState, yieldFactor).ifPresent(InvariantEngine::raise);
    }

    // ===== resolved state =====

    public Optional<Violation> checkResolvedState(Item item) {
        if (item.stateHint() == null) {
            return Optional.of(violation(InvariantId.RESOLVED_STATE, Severity.CRITICAL,
                    "Item '" + item.keyOrEmpty() + "' has no resolved state", item, null));
        }
        StateResolution r = item.resolution();
        if (r != null && !r.isResolved()) {
            return Optional.of(violation(InvariantId.RESOLVED_STATE, Severity.CRITICAL,
                    "Item '" + item.keyOrEmpty() + "' state resolution has no confidence",
                    item, mapOfNullable("ruleId", r.ruleId())));
        }
        return Optional.empty();
    }

    public void assertResolvedState(Item item) {
        checkResolvedState(item).ifPresent(InvariantEngine::raise);
    }

    // ===== meal / day =====

    public Optional<Violation> checkMealHasItems(Meal meal) {
        if (meal == null || !meal.hasItems()) {
            String name = meal == null ? "unknown" : meal.name();
            return Optional.of(Violation.of(InvariantId.MEAL_HAS_ITEMS, Severity.CRITICAL,
                    "Meal '" + name + "' has no items", mapOfNullable("mealName", name)));
        }
        return Optional.empty();
    }

    public List<Violation> checkDayTotals(MacroTotals totals, MacroTargets targets, PipelineConfig cfg) {
        List<Violation> out = new ArrayList<>();
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("kcal", totals.kcal());
        ctx.put("protein", totals.protein());
        ctx.put("fat", totals.fat());
        ctx.put("carbs", totals.carbs());

        if (totals.kcal() < 0 || totals.protein() < 0 || totals.fat() < 0 || totals.carbs() < 0) {
            out.add(Violation.of(InvariantId.DAY_NON_NEGATIVE, Severity.CRITICAL,
                    "Day totals contain negative values", ctx));
        }

        double kcal = totals.kcal();
        if (kcal > 0 && kcal < cfg.dayMinKcal()) {
            out.add(Violation.of(InvariantId.DAY_KCAL_RANGE, Severity.CRITICAL,
                    String.format(Locale.ROOT, "Day total calories %.0f is unreasonably low (< %.0f)", kcal, cfg.dayMinKcal()),
                    ctx));
        }
        if (kcal > cfg.dayMaxKcal()) {
            out.add(Violation.of(InvariantId.DAY_KCAL_RANGE, Severity.CRITICAL,
                    String.format(Locale.ROOT, "Day total calories %.0f is unreasonably high (> %.0f)", kcal, cfg.dayMaxKcal()),
                    ctx));
        }

        if (targets != null && targets.kcal() > 0) {
            double deviation = Math.abs(kcal - targets.kcal()) / targets.kcal() * 100.0;
            if (deviation > cfg.dayTolerancePct()) {
                Map<String, Object> dctx = new LinkedHashMap<>(ctx);
                dctx.put("targetKcal", targets.kcal());
                dctx.put("deviationPct", round2(deviation));
                out.add(Violation.of(InvariantId.DAY_TARGET_DEVIATION, Severity.CRITICAL,
                        String.format(Locale.ROOT, "Day calories %.0f deviate %.1f%% from target %.0f",
                                kcal, deviation, targets.kcal()),
                        dctx));
            }
        }
        return out;
    }

    public void assertReasonableDayTotals(MacroTotals totals, MacroTargets targets, PipelineConfig cfg) {
        List<Violation> vs = checkDayTotals(totals, targets, cfg);
        if (!vs.isEmpty()) raise(vs.get(0));
    }

    // ===== composite =====

    /**
     * item 層級：positive quantity + resolved state + portion。
     * soft=false 時遇到第一個違規就丟。
     */
    public InvariantReport checkItem(Item item, Double grams, boolean soft, PipelineConfig cfg) {
        List<Violation> vs = new ArrayList<>();
        checkPositiveQuantity(item).ifPresent(vs::add);
        checkResolvedState(item).ifPresent(vs::add);
        checkReasonablePortion(item, grams, cfg).ifPresent(vs::add);
        return finish(vs, soft);
    }

    /**
     * day 層級：每個 computed meal 都要有 item + day totals。
     */
    public InvariantReport checkDayPlan(DayPlan plan, boolean soft, PipelineConfig cfg) {
        List<Violation> vs = new ArrayList<>();
        for (PlannedMeal m : plan.meals()) {
            if (m.computed() && m.items().isEmpty()) {
                vs.add(Violation.of(InvariantId.MEAL_HAS_ITEMS, Severity.CRITICAL,
                        "Meal '" + m.name() + "' has no items", mapOfNullable("mealName", m.name())));
            }
        }
        vs.addAll(checkDayTotals(plan.dayTotals(), plan.targets(), cfg));
        return finish(vs, soft);
    }

    private static InvariantReport finish(List<Violation> vs, boolean soft) {
        if (!soft && !vs.isEmpty()) raise(vs.get(0));
        return InvariantReport.of(vs);
    }

    // ===== helpers =====

    private static void raise(Violation v) {
        throw new InvariantViolationException(v);
    }

    private static Violation violation(InvariantId id, Severity sev, String msg, Item item, Map<String, Object> extra) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("itemKey", item.key());
        ctx.put("quantityValue", item.quantityValue());
        ctx.put("quantityUnit", item.quantityUnit());
        if (extra != null) ctx.putAll(extra);
        return Violation.of(id, sev, msg, ctx);
    }

    private static Map<String, Object> mapOfNullable(String k, Object v) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(k, v);
        return m;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
