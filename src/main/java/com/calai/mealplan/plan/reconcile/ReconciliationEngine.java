package com.calai.mealplan.plan.reconcile;

import com.calai.mealplan.plan.alert.AlertLevel;
import com.calai.mealplan.plan.alert.AlertSink;
import com.calai.mealplan.plan.alert.AlertType;
import com.calai.mealplan.plan.config.PipelineConfig;
import com.calai.mealplan.plan.invariant.InvariantEngine;
import com.calai.mealplan.plan.invariant.Violation;
import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.MacroResult;
import com.calai.mealplan.plan.model.MacroTargets;
import com.calai.mealplan.plan.model.MacroTotals;
import com.calai.mealplan.plan.model.Meal;
import com.calai.mealplan.plan.transform.UnitCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 用「縮放數量」把 meal / day 的熱量拉回 target 附近。
 * - meal 層級：全部 item 一起縮（可設定），但不能把蛋白質縮到 target 的 80% 以下
 * - day 層級：蛋白質為主的 item 鎖住，只縮其他 item
 * factor 超出合理範圍只告警，不擋。
 */
@Slf4j
@Component
public class ReconciliationEngine {

    /** meal 縮小後 protein 至少要留在 target 的這個比例 */
    public static final double PROTEIN_FLOOR_RATIO = 0.80;

    private final InvariantEngine invariants;
    private final AlertSink alerts;

    public ReconciliationEngine(InvariantEngine invariants, AlertSink alerts) {
        this.invariants = invariants;
        this.alerts = alerts;
    }

    public ReconcileResult reconcileMeal(Meal meal, MacroTargets mealTarget, ItemMacrosFn fn,
                                         PipelineConfig cfg, String traceId) {
        return reconcile(List.of(meal), mealTarget, fn, cfg.reconciliationTolerancePct(),
                cfg.mealProteinScaling(), cfg, traceId);
    }

    public ReconcileResult reconcileDay(List<Meal> meals, MacroTargets dayTarget, ItemMacrosFn fn,
                                        PipelineConfig cfg, String traceId) {
        return reconcile(meals, dayTarget, fn, cfg.reconciliationTolerancePct(), false, cfg, traceId);
    }

    public ReconcileResult reconcile(List<Meal> scope, MacroTargets target, ItemMacrosFn fn,
                                     double tolerancePct, boolean allowProteinScaling,
                                     PipelineConfig cfg, String traceId) {
        MacroTotals current = totals(scope, fn);

        if (target == null || !(target.kcal() > 0) || !(current.kcal() > 0)) {
            return new ReconcileResult(scope, false, null, true, ReconcileResult.Reason.NO_BASELINE, current, current);
        }

        double deviationPct = Math.abs(current.kcal() - target.kcal()) / target.kcal() * 100.0;
        if (deviationPct <= tolerancePct) {
            return new ReconcileResult(scope, false, null, true, ReconcileResult.Reason.WITHIN_TOLERANCE, current, current);
        }

        List<Meal> scaled;
        double factor;

        if (allowProteinScaling) {
            factor = target.kcal() / current.kcal();

            // 縮小會把蛋白質壓太低 → 這次不動
            if (factor < 1.0 && target.protein() > 0
                    && current.protein() * factor < target.protein() * PROTEIN_FLOOR_RATIO) {
                log.info("reconcile_skipped reason=PROTEIN_FLOOR traceId={} factor={} currentProtein={} targetProtein={}",
                        traceId, round3(factor), current.protein(), target.protein());
                boolean inBounds = checkFactor(factor, cfg, traceId, current, target);
                return new ReconcileResult(scope, false, factor, inBounds, ReconcileResult.Reason.PROTEIN_FLOOR, current, current);
            }
            scaled = scaleMeals(scope, fn, factor, false);
        } else {
            double lockedKcal = 0;
            double unlockedKcal = 0;
            for (Meal m : scope) {
                for (Item it : m.items()) {
                    MacroResult r = fn.apply(it, m.items());
                    if (r.isProteinDominant()) lockedKcal += r.kcal();
                    else unlockedKcal += r.kcal();
                }
            }
            if (!(unlockedKcal > 0)) {
                return new ReconcileResult(scope, false, null, true, ReconcileResult.Reason.NOTHING_TO_SCALE, current, current);
            }
            factor = Math.max(target.kcal() - lockedKcal, 0.0) / unlockedKcal;
            scaled = scaleMeals(scope, fn, factor, true);
        }

        boolean inBounds = checkFactor(factor, cfg, traceId, current, target);
        MacroTotals after = totals(scaled, fn);

        log.debug("reconcile_applied traceId={} factor={} beforeKcal={} afterKcal={} targetKcal={} proteinScaling={}",
                traceId, round3(factor), current.kcal(), after.kcal(), target.kcal(), allowProteinScaling);

        return new ReconcileResult(scaled, true, factor, inBounds, ReconcileResult.Reason.SCALED, current, after);
    }

    // ===== scaling =====

    private static List<Meal> scaleMeals(List<Meal> scope, ItemMacrosFn fn, double factor, boolean lockProtein) {
        List<Meal> out = new ArrayList<>(scope.size());
        for (Meal m : scope) {
            List<Item> items = new ArrayList<>(m.items().size());
            for (Item it : m.items()) {
                if (lockProtein && fn.apply(it, m.items()).isProteinDominant()) {
                    items.add(it);
                } else {
                    items.add(scaleItem(it, factor));
                }
            }
            out.add(m.withItems(items));
        }
        return out;
    }

    static Item scaleItem(Item it, double factor) {
        Double q = it.quantityValue();
        if (q == null || !Double.isFinite(q) || q <= 0) return it;
        return it.withQuantityValue(roundQuantity(q * factor, it.quantityUnit()));
    }

    /**
     * g → 整數、ml → 5 的倍數、其他 → 0.1；原本 > 0 的不會被縮成 0
     */
    static double roundQuantity(double v, String unit) {
        String canonical = UnitCatalog.canonicalOrNull(unit);
        if ("g".equals(canonical)) {
            return Math.max(1.0, Math.round(v));
        }
        if ("ml".equals(canonical)) {
            return Math.max(1.0, Math.round(v / 5.0) * 5.0);
        }
        return Math.max(0.1, Math.round(v * 10.0) / 10.0);
    }

    // ===== helpers =====

    private boolean checkFactor(double factor, PipelineConfig cfg, String traceId, MacroTotals current, MacroTargets target) {
        Optional<Violation> v = invariants.checkReconciliationFactor(factor, cfg);
        if (v.isEmpty()) return true;

        log.warn("reconcile_factor_out_of_bounds traceId={} factor={} min={} max={}",
                traceId, round3(factor), cfg.factorMin(), cfg.factorMax());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("factor", round3(factor));
        payload.put("currentKcal", current.kcal());
        payload.put("targetKcal", target.kcal());
        payload.put("message", v.get().message());
        alerts.emit(AlertLevel.WARNING, AlertType.RECONCILIATION_FACTOR_OUT_OF_BOUNDS, traceId, payload);
        return false;
    }

    public static MacroTotals totals(List<Meal> scope, ItemMacrosFn fn) {
        MacroTotals t = MacroTotals.ZERO;
        for (Meal m : scope) {
            for (Item it : m.items()) {
                t = t.plus(fn.apply(it, m.items()));
            }
        }
        return t;
    }

    private static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
