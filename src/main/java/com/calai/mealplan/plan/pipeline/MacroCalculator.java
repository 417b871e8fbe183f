package com.calai.mealplan.plan.pipeline;

import com.calai.mealplan.plan.alert.AlertLevel;
import com.calai.mealplan.plan.alert.AlertSink;
import com.calai.mealplan.plan.alert.AlertType;
import com.calai.mealplan.plan.alert.ProgressListener;
import com.calai.mealplan.plan.config.PipelineConfig;
import com.calai.mealplan.plan.invariant.ConsistencyCheck;
import com.calai.mealplan.plan.invariant.InvariantEngine;
import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.ItemState;
import com.calai.mealplan.plan.model.MacroErrorCode;
import com.calai.mealplan.plan.model.MacroResult;
import com.calai.mealplan.plan.model.NutritionRecord;
import com.calai.mealplan.plan.model.Severity;
import com.calai.mealplan.plan.nutrition.IngredientKeys;
import com.calai.mealplan.plan.reconcile.ItemMacrosFn;
import com.calai.mealplan.plan.transform.AsSoldResult;
import com.calai.mealplan.plan.transform.CookingTransformEngine;
import com.calai.mealplan.plan.transform.GramsOrMl;
import com.calai.mealplan.plan.transform.OilAbsorption;
import com.calai.mealplan.plan.transform.UnitConverter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 單一 run 的 item macro 計算（不是 Spring bean，每個 run new 一個）。
 * - 一定回傳合法的 {@link MacroResult}：任何失敗都降級成 0 macros + errorCode
 * - base macros 依 (key, quantity, unit, state) 快取；吸油量依「這一餐」另外算
 */
@Slf4j
public class MacroCalculator implements ItemMacrosFn {

    record CacheKey(String key, Double quantityValue, String quantityUnit, ItemState state) {
    }

    private final Map<String, NutritionRecord> records;
    private final CookingTransformEngine transform;
    private final InvariantEngine invariants;
    private final AlertSink alerts;
    private final PipelineConfig cfg;
    private final String traceId;
    private final ProgressListener listener;

    private final Map<CacheKey, MacroResult> cache = new HashMap<>();
    private int computations;

    public MacroCalculator(Map<String, NutritionRecord> records,
                           CookingTransformEngine transform,
                           InvariantEngine invariants,
                           AlertSink alerts,
                           PipelineConfig cfg,
                           String traceId,
                           ProgressListener listener) {
        this.records = records == null ? Map.of() : records;
        this.transform = transform;
        this.invariants = invariants;
        this.alerts = alerts;
        this.cfg = cfg;
        this.traceId = traceId;
        this.listener = listener == null ? ProgressListener.NOOP : listener;
    }

    @Override
    public MacroResult apply(Item item, List<Item> mealItems) {
        MacroResult base = baseMacros(item);
        if (base.hasError() || mealItems == null || mealItems.isEmpty()) return base;

        if (OilAbsorption.isOilItem(item.key())) {
            // 被其他 item 吸走的油從油本身扣掉，整餐油量不重複計算
            double total = transform.mealOilGrams(mealItems);
            double absorbed = transform.distributeAbsorbedOil(mealItems).values().stream()
                    .mapToDouble(Double::doubleValue).sum();
            if (total > 0 && absorbed > 0) {
                return base.scaledBy(Math.max(0.0, 1.0 - absorbed / total));
            }
            return base;
        }

        double oil = transform.absorbedOilGrams(item, mealItems);
        return base.withAbsorbedOil(oil);
    }

    public MacroResult baseMacros(Item item) {
        CacheKey k = new CacheKey(item.key(), item.quantityValue(), item.quantityUnit(), item.stateHint());
        MacroResult cached = cache.get(k);
        if (cached != null) return cached;

        MacroResult r = compute(item);
        cache.put(k, r);
        computations++;
        return r;
    }

    /** 實際算過幾次（測 cache 用） */
    public int computations() {
        return computations;
    }

    // ===== compute =====

    private MacroResult compute(Item item) {
        String key = item.keyOrEmpty();

        // 1) quantity → g / ml
        GramsOrMl q = UnitConverter.normalizeToGramsOrMl(item);
        if (!q.valid() || !(q.value() > 0)) {
            alert(AlertLevel.WARNING, AlertType.QUANTITY_NORMALIZATION_FAILED, Map.of(
                    "key", key, "quantityValue", String.valueOf(item.quantityValue()),
                    "quantityUnit", String.valueOf(item.quantityUnit()), "note", String.valueOf(q.note())));
            return MacroResult.zero(MacroErrorCode.QUANTITY_INVALID, 0);
        }

        Double grams = UnitConverter.toGrams(q, item.key());
        if (grams == null || !Double.isFinite(grams) || grams <= 0) {
            return MacroResult.zero(MacroErrorCode.QUANTITY_INVALID, 0);
        }

        // 2) → as-sold
        AsSoldResult asSold = transform.toAsSoldGrams(item, grams);
        if (asSold.resolvedState() == ItemState.COOKED) {
            invariants.checkYieldCoverage(item, asSold.resolvedState(), asSold.yieldFactorValue())
                    .ifPresent(listener::onInvariantWarning);
            if (asSold.yieldFactor() != null && !asSold.yieldFactor().mapped()) {
                alert(AlertLevel.WARNING, AlertType.YIELD_UNMAPPED, Map.of("key", key, "grams", grams));
            }
        }
        double gramsAsSold = asSold.gramsAsSold();
        if (!asSold.valid() || !Double.isFinite(gramsAsSold) || gramsAsSold <= 0) {
            alert(AlertLevel.WARNING, AlertType.GRAMS_AS_SOLD_INVALID, Map.of("key", key, "grams", grams));
            return MacroResult.zero(MacroErrorCode.GRAMS_AS_SOLD_INVALID, 0);
        }

        // 3) nutrition
        NutritionRecord rec = records.get(IngredientKeys.normalize(item.key()));
        if (rec == null) {
            log.debug("macro_nutrition_missing traceId={} key={}", traceId, key);
            return MacroResult.zero(MacroErrorCode.NUTRITION_NOT_FOUND, gramsAsSold);
        }

        double factor = gramsAsSold / 100.0;
        double kcal = Math.round(rec.calories() * factor);
        double p = round1(rec.protein() * factor);
        double f = round1(rec.fat() * factor);
        double c = round1(rec.carbs() * factor);

        if (!Double.isFinite(kcal) || !Double.isFinite(p) || !Double.isFinite(f) || !Double.isFinite(c)) {
            return MacroResult.zero(MacroErrorCode.GRAMS_AS_SOLD_INVALID, gramsAsSold);
        }

        MacroResult result = MacroResult.of(kcal, p, f, c, round1(gramsAsSold), rec.source());

        // 4) consistency gate
        if (!cfg.enableConsistencyGate()) return result;

        ConsistencyCheck check = invariants.checkMacroCalorieConsistency(result, cfg);
        if (check.severity() == Severity.VALID) return result;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("key", key);
        payload.put("reportedKcal", check.reportedKcal());
        payload.put("expectedKcal", Math.round(check.expectedKcal()));
        payload.put("deviationPct", round1(check.deviationPct()));
        payload.put("severity", check.severity().name());
        listener.onIngredientFlagged(key, check.severity(), check.deviationPct());

        if (check.severity() == Severity.CRITICAL) {
            log.warn("macro_inconsistent traceId={} key={} severity=CRITICAL deviationPct={} blockPct={}",
                    traceId, key, round1(check.deviationPct()), cfg.blockThresholdPct());
            alert(AlertLevel.CRITICAL, AlertType.MACRO_INCONSISTENCY, payload);
            return MacroResult.zero(MacroErrorCode.MACRO_INCONSISTENT, gramsAsSold)
                    .asFlagged(Severity.CRITICAL, round1(check.deviationPct()));
        }

        log.info("macro_inconsistent traceId={} key={} severity=WARNING deviationPct={} flagPct={}",
                traceId, key, round1(check.deviationPct()), cfg.flagThresholdPct());
        alert(AlertLevel.WARNING, AlertType.MACRO_INCONSISTENCY, payload);
        return result.asFlagged(Severity.WARNING, round1(check.deviationPct()));
    }

    private void alert(AlertLevel level, AlertType type, Map<String, Object> payload) {
        alerts.emit(level, type, traceId, payload);
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
