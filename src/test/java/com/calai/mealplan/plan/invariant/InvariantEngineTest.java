package com.calai.mealplan.plan.invariant;

import com.calai.mealplan.plan.config.PipelineConfig;
import com.calai.mealplan.plan.model.Confidence;
import com.calai.mealplan.plan.model.DayPlan;
import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.ItemState;
import com.calai.mealplan.plan.model.MacroResult;
import com.calai.mealplan.plan.model.MacroTargets;
import com.calai.mealplan.plan.model.MacroTotals;
import com.calai.mealplan.plan.model.MealType;
import com.calai.mealplan.plan.model.NutritionSource;
import com.calai.mealplan.plan.model.PlannedMeal;
import com.calai.mealplan.plan.model.Severity;
import com.calai.mealplan.plan.model.StateResolution;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InvariantEngineTest {

    private final InvariantEngine engine = new InvariantEngine();
    private final PipelineConfig cfg = PipelineConfig.defaults();

    private static Item raw(String key, Double qty) {
        return new Item(key, qty, "g", ItemState.RAW, null);
    }

    // ===== macro-kcal consistency =====

    @Test
    void ten_percent_off_is_warning_with_tight_thresholds() {
        // expected = 30*4 + 40*4 + 10*9 = 370
        ConsistencyCheck c = engine.checkMacroCalorieConsistency(407, 30, 10, 40, 5, 20);

        assertThat(c.expectedKcal()).isEqualTo(370.0);
        assertThat(c.deviationPct()).isCloseTo(10.0, within(1e-9));
        assertThat(c.severity()).isEqualTo(Severity.WARNING);
        assertThat(c.valid()).isFalse();
    }

    @Test
    void same_item_is_valid_with_default_thresholds() {
        MacroResult m = MacroResult.of(407, 30, 10, 40, 100, NutritionSource.HOTPATH);

        ConsistencyCheck c = engine.checkMacroCalorieConsistency(m, cfg);

        assertThat(c.severity()).isEqualTo(Severity.VALID);
        assertThat(c.valid()).isTrue();
    }

    @Test
    void raising_thresholds_never_raises_severity() {
        // 30% 偏差
        double kcal = 370 * 1.30;
        Severity previous = Severity.CRITICAL;
        double[][] thresholds = {{10, 20}, {20, 40}, {25, 50}, {35, 50}, {40, 80}};
        for (double[] t : thresholds) {
            Severity s = engine.checkMacroCalorieConsistency(kcal, 30, 10, 40, t[0], t[1]).severity();
            assertThat(s.compareTo(previous)).as("flag=%s block=%s", t[0], t[1]).isLessThanOrEqualTo(0);
            previous = s;
        }
        assertThat(previous).isEqualTo(Severity.VALID);
    }

    @Test
    void zero_macros_is_skipped_but_zero_kcal_is_graded() {
        assertThat(engine.checkMacroCalorieConsistency(12, 0, 0, 0, 25, 50).skipped()).isTrue();
        assertThat(engine.checkMacroCalorieConsistency(0, 0, 0, 0, 25, 50).skipped()).isTrue();
        assertThat(engine.checkMacroCalorieConsistency(Double.NaN, 1, 1, 1, 25, 50).valid()).isTrue();

        ConsistencyCheck zeroKcal = engine.checkMacroCalorieConsistency(0, 30, 10, 40, 25, 50);
        assertThat(zeroKcal.skipped()).isFalse();
        assertThat(zeroKcal.deviationPct()).isEqualTo(100.0);
        assertThat(zeroKcal.severity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void growing_deviation_never_lowers_severity() {
        // expected 固定 370（30/10/40），reported 從 expected 往兩側越走越遠
        double expected = 370;
        double[] below = {370, 340, 300, 200, 100, 1, 0};
        double[] above = {370, 400, 450, 550, 800, 2000};
        for (double[] sweep : new double[][]{below, above}) {
            Severity previous = Severity.VALID;
            double previousDev = -1;
            for (double kcal : sweep) {
                ConsistencyCheck c = engine.checkMacroCalorieConsistency(kcal, 30, 10, 40, 5, 20);
                assertThat(c.expectedKcal()).isEqualTo(expected);
                assertThat(c.deviationPct()).as("kcal=%s", kcal).isGreaterThanOrEqualTo(previousDev);
                assertThat(c.severity().compareTo(previous)).as("kcal=%s", kcal).isGreaterThanOrEqualTo(0);
                previous = c.severity();
                previousDev = c.deviationPct();
            }
            assertThat(previous).isEqualTo(Severity.CRITICAL);
        }
    }

    @Test
    void assert_mode_throws_with_context() {
        MacroResult m = MacroResult.of(900, 30, 10, 40, 100, NutritionSource.FALLBACK);

        assertThatThrownBy(() -> engine.assertMacroCalorieConsistency(m, cfg))
                .isInstanceOfSatisfying(InvariantViolationException.class, e -> {
                    assertThat(e.invariantId()).isEqualTo(InvariantId.MACRO_KCAL_CONSISTENCY);
                    assertThat(e.severity()).isEqualTo(Severity.CRITICAL);
                    assertThat(e.violation().context()).containsKeys("expectedKcal", "deviationPct", "blockThresholdPct");
                    assertThat(e.getMessage()).contains("reported 900 kcal");
                });
    }

    // ===== item =====

    @Test
    void quantity_must_be_present_finite_and_positive() {
        assertThat(engine.checkPositiveQuantity(raw("rice", null))).isPresent();
        assertThat(engine.checkPositiveQuantity(raw("rice", Double.NaN))).isPresent();
        assertThat(engine.checkPositiveQuantity(raw("rice", 0.0))).isPresent();
        assertThat(engine.checkPositiveQuantity(raw("rice", 80.0))).isEmpty();

        Violation v = engine.checkPositiveQuantity(raw("rice", null)).orElseThrow();
        assertThat(v.context()).containsEntry("itemKey", "rice").containsEntry("quantityValue", null);
    }

    @Test
    void portion_bounds_are_warnings() {
        Optional<Violation> low = engine.checkReasonablePortion(raw("salt", 2.0), 2.0, cfg);
        Optional<Violation> high = engine.checkReasonablePortion(raw("rice", 1500.0), 1500.0, cfg);

        assertThat(low.orElseThrow().severity()).isEqualTo(Severity.WARNING);
        assertThat(low.get().context()).containsEntry("minGrams", cfg.portionMinGrams());
        assertThat(high.get().context()).containsEntry("maxGrams", cfg.portionMaxGrams());
        assertThat(engine.checkReasonablePortion(raw("rice", 100.0), null, cfg)).isEmpty();
    }

    @Test
    void reconciliation_factor_outside_bounds_is_reported() {
        assertThat(engine.checkReconciliationFactor(null, cfg)).isEmpty();
        assertThat(engine.checkReconciliationFactor(1.2, cfg)).isEmpty();
        assertThat(engine.checkReconciliationFactor(0.3, cfg).orElseThrow().context()).containsEntry("minBound", 0.5);
        assertThat(engine.checkReconciliationFactor(2.5, cfg).orElseThrow().context()).containsEntry("maxBound", 2.0);
        assertThat(engine.checkReconciliationFactor(Double.NaN, cfg).orElseThrow().context()).containsEntry("factor", "NaN");
        assertThatThrownBy(() -> engine.assertReconciliationFactor(3.0, cfg))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void yield_coverage_only_applies_to_cooked() {
        Item rice = new Item("rice", 300.0, "g", ItemState.COOKED, null);

        assertThat(engine.checkYieldCoverage(rice, ItemState.COOKED, null)).isPresent();
        assertThat(engine.checkYieldCoverage(rice, ItemState.COOKED, 0.0)).isPresent();
        assertThat(engine.checkYieldCoverage(rice, ItemState.COOKED, 1.0)).isEmpty();
        assertThat(engine.checkYieldCoverage(rice, ItemState.DRY, null)).isEmpty();
    }

    @Test
    void resolved_state_needs_state_and_confidence() {
        Item unset = new Item("rice", 100.0, "g", null, null);
        Item unresolved = unset.withResolution(
                new StateResolution(null, null, Confidence.NONE, "ERROR_INVALID_KEY", null), ItemState.AS_PACK, null);
        Item ok = unset.withResolution(
                new StateResolution(ItemState.DRY, null, Confidence.MEDIUM, "GRAINS_RICE", "GRAINS"), ItemState.DRY, null);

        assertThat(engine.checkResolvedState(unset)).isPresent();
        assertThat(engine.checkResolvedState(unresolved).orElseThrow().context()).containsEntry("ruleId", "ERROR_INVALID_KEY");
        assertThat(engine.checkResolvedState(ok)).isEmpty();
    }

    @Test
    void soft_item_check_collects_and_hard_check_throws_first() {
        Item bad = new Item("rice", 0.0, "g", null, null);

        InvariantReport report = engine.checkItem(bad, 0.0, true, cfg);

        assertThat(report.passed()).isFalse();
        assertThat(report.violations()).extracting(Violation::invariantId)
                .containsExactly(InvariantId.POSITIVE_QUANTITY, InvariantId.RESOLVED_STATE, InvariantId.PORTION_BOUNDS);
        assertThat(report.hasCritical()).isTrue();

        assertThatThrownBy(() -> engine.checkItem(bad, 0.0, false, cfg))
                .isInstanceOfSatisfying(InvariantViolationException.class,
                        e -> assertThat(e.invariantId()).isEqualTo(InvariantId.POSITIVE_QUANTITY));
    }

    // ===== day =====

    @Test
    void day_totals_out_of_range() {
        List<Violation> low = engine.checkDayTotals(new MacroTotals(300, 20, 10, 30), null, cfg);
        List<Violation> high = engine.checkDayTotals(new MacroTotals(12000, 500, 400, 1200), null, cfg);
        List<Violation> negative = engine.checkDayTotals(new MacroTotals(1000, -1, 10, 30), null, cfg);

        assertThat(low).extracting(Violation::invariantId).containsExactly(InvariantId.DAY_KCAL_RANGE);
        assertThat(high).extracting(Violation::invariantId).containsExactly(InvariantId.DAY_KCAL_RANGE);
        assertThat(negative).extracting(Violation::invariantId).containsExactly(InvariantId.DAY_NON_NEGATIVE);
    }

    @Test
    void day_deviation_from_target_uses_tolerance() {
        MacroTargets targets = MacroTargets.of(2000, 150);

        assertThat(engine.checkDayTotals(new MacroTotals(2800, 150, 80, 300), targets, cfg)).isEmpty();

        List<Violation> vs = engine.checkDayTotals(new MacroTotals(3500, 150, 120, 400), targets, cfg);
        assertThat(vs).extracting(Violation::invariantId).containsExactly(InvariantId.DAY_TARGET_DEVIATION);
        assertThat(vs.get(0).context()).containsEntry("deviationPct", 75.0);
    }

    @Test
    void day_plan_ignores_excluded_meals() {
        PlannedMeal excluded = new PlannedMeal(MealType.SNACK, "snack", List.of(), null, false);
        PlannedMeal empty = new PlannedMeal(MealType.LUNCH, "lunch", List.of(), null, true);
        MacroTotals totals = new MacroTotals(1800, 120, 60, 200);

        InvariantReport onlyExcluded = engine.checkDayPlan(new DayPlan(List.of(excluded), totals, null), true, cfg);
        InvariantReport withEmpty = engine.checkDayPlan(new DayPlan(List.of(excluded, empty), totals, null), true, cfg);

        assertThat(onlyExcluded.passed()).isTrue();
        assertThat(withEmpty.violations()).extracting(Violation::invariantId).containsExactly(InvariantId.MEAL_HAS_ITEMS);
        assertThatThrownBy(() -> engine.checkDayPlan(new DayPlan(List.of(empty), totals, null), false, cfg))
                .isInstanceOf(InvariantViolationException.class);
    }
}
