package com.calai.mealplan.plan.transform;

import com.calai.mealplan.plan.model.CookingMethod;
import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.ItemState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CookingTransformEngineTest {

    private final CookingTransformEngine engine = new CookingTransformEngine();

    private static Item item(String key, double qty, String unit, ItemState state, CookingMethod method) {
        return new Item(key, qty, unit, state, method);
    }

    @Test
    void cooked_rice_converts_back_to_dry_weight() {
        Item rice = item("cooked rice", 300, "g", ItemState.COOKED, null);

        AsSoldResult r = engine.toAsSoldGrams(rice, 300);

        assertThat(r.valid()).isTrue();
        assertThat(r.gramsAsSold()).isCloseTo(100.0, within(1e-9));
        assertThat(r.yieldFactorValue()).isEqualTo(3.0);
        assertThat(r.stateInferred()).isFalse();
    }

    @Test
    void as_sold_states_pass_through_without_yield() {
        Item chicken = item("chicken breast", 200, "g", ItemState.RAW, CookingMethod.GRILLED);

        AsSoldResult r = engine.toAsSoldGrams(chicken, 200);

        assertThat(r.gramsAsSold()).isEqualTo(200.0);
        assertThat(r.yieldFactor()).isNull();
        assertThat(r.resolvedMethod()).isEqualTo(CookingMethod.GRILLED);
    }

    @Test
    void missing_state_is_inferred_from_key() {
        AsSoldResult meat = engine.toAsSoldGrams(Item.of("beef steak", 150, "g"), 150);
        AsSoldResult grain = engine.toAsSoldGrams(Item.of("basmati rice", 150, "g"), 150);

        assertThat(meat.resolvedState()).isEqualTo(ItemState.RAW);
        assertThat(meat.stateInferred()).isTrue();
        assertThat(grain.resolvedState()).isEqualTo(ItemState.COOKED);
        assertThat(grain.resolvedMethod()).isEqualTo(CookingMethod.BOILED);
        assertThat(grain.gramsAsSold()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void unmapped_cooked_item_uses_one_to_one() {
        AsSoldResult r = engine.toAsSoldGrams(item("dragonfruit", 80, "g", ItemState.COOKED, null), 80);

        assertThat(r.gramsAsSold()).isEqualTo(80.0);
        assertThat(r.yieldFactor().mapped()).isFalse();
    }

    @Test
    void invalid_grams_give_invalid_result() {
        AsSoldResult r = engine.toAsSoldGrams(item("rice", 100, "g", ItemState.COOKED, null), Double.NaN);

        assertThat(r.valid()).isFalse();
        assertThat(r.gramsAsSold()).isEqualTo(0.0);
    }

    @Test
    void oil_goes_to_the_fried_item_only() {
        List<Item> meal = List.of(
                item("olive oil", 10, "g", ItemState.AS_PACK, null),
                item("chicken breast", 200, "g", ItemState.RAW, CookingMethod.FRIED),
                item("broccoli", 100, "g", ItemState.RAW, CookingMethod.STEAMED)
        );

        Map<Integer, Double> out = engine.distributeAbsorbedOil(meal);

        assertThat(out).containsOnlyKeys(1);
        assertThat(out.get(1)).isEqualTo(3.0);
    }

    @Test
    void oil_is_shared_by_as_sold_weight_and_method_rate() {
        List<Item> meal = List.of(
                item("chicken thigh", 200, "g", ItemState.RAW, CookingMethod.FRIED),
                item("potato", 200, "g", ItemState.RAW, CookingMethod.ROASTED),
                item("olive oil", 20, "g", ItemState.AS_PACK, null)
        );

        Map<Integer, Double> out = engine.distributeAbsorbedOil(meal);

        assertThat(out).containsEntry(0, 3.0).containsEntry(1, 1.5);
        Item copy = new Item("potato", 200.0, "g", ItemState.RAW, CookingMethod.ROASTED);
        assertThat(engine.absorbedOilGrams(copy, meal)).isEqualTo(1.5);
    }

    @Test
    void oil_in_ml_uses_oil_density() {
        List<Item> meal = List.of(item("olive oil", 1, "tbsp", ItemState.AS_PACK, null));

        assertThat(engine.mealOilGrams(meal)).isCloseTo(13.8, within(1e-9));
    }

    @Test
    void meal_without_oil_absorbs_nothing() {
        List<Item> meal = List.of(item("chicken breast", 200, "g", ItemState.RAW, CookingMethod.FRIED));

        assertThat(engine.distributeAbsorbedOil(meal)).isEmpty();
        assertThat(engine.absorbedOilGrams(meal.get(0), meal)).isEqualTo(0.0);
    }
}
