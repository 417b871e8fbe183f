package com.calai.mealplan.plan.transform;

import com.calai.mealplan.plan.model.CookingMethod;
import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.ItemState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.calai.mealplan.plan.transform.KeyRules.containsAny;

/**
 * 煮熟重量 ↔ as-sold 重量，加上同一餐裡「油」的吸收分配。
 */
@Slf4j
@Component
public class CookingTransformEngine {

    public record Hints(ItemState state, CookingMethod method, boolean inferred) {
    }

    // state 缺值時的推測：順序 = 優先順序
    private static final KeyRules<ItemState> STATE_INFERENCE = KeyRules.<ItemState>builder()
            .rule("explicit_cooked", containsAny("cooked", "baked", "grilled", "steamed", "boiled"), ItemState.COOKED)
            .rule("grain", containsAny("rice", "pasta", "oats", "quinoa"), ItemState.COOKED)
            .rule("meat_fish", containsAny("chicken", "beef", "pork", "salmon", "fish", "mince", "steak"), ItemState.RAW)
            .build();

    private static final KeyRules<CookingMethod> METHOD_INFERENCE = KeyRules.<CookingMethod>builder()
            .rule("baked", containsAny("baked"), CookingMethod.BAKED)
            .rule("grilled", containsAny("grilled"), CookingMethod.GRILLED)
            .rule("steamed", containsAny("steamed"), CookingMethod.STEAMED)
            .rule("boiled", containsAny("boiled"), CookingMethod.BOILED)
            .rule("grain", containsAny("rice", "pasta"), CookingMethod.BOILED)
            .build();

    /**
     * state 有給就用；沒給才從 key 猜（猜的一律 log warn）
     */
    public Hints inferHints(Item item) {
        ItemState state = item.stateHint();
        CookingMethod method = item.methodHint();
        boolean inferred = false;

        if (state == null) {
            state = STATE_INFERENCE.valueOr(item.key(), ItemState.AS_PACK);
            inferred = true;
            log.warn("state_inferred key={} state={} reason=missing_state_hint", item.keyOrEmpty(), state.code());
        }
        if (method == null && state == ItemState.COOKED) {
            method = METHOD_INFERENCE.valueOr(item.key(), null);
        }
        return new Hints(state, method, inferred);
    }

    /**
     * @param grams 已經換成公克的數量（ml 要先乘密度）
     */
    public AsSoldResult toAsSoldGrams(Item item, double grams) {
        Hints h = inferHints(item);

        if (!Double.isFinite(grams) || grams < 0) {
            log.warn("as_sold_invalid_input key={} grams={}", item.keyOrEmpty(), grams);
            return AsSoldResult.invalid(h.state(), h.method());
        }

        if (h.state().isAsSold()) {
            return new AsSoldResult(grams, h.state(), h.method(), null, h.inferred(), true);
        }

        YieldFactor y = YieldTable.lookup(item.key());
        if (!y.mapped()) {
            log.warn("yield_unmapped key={} grams={} fallbackFactor={}", item.keyOrEmpty(), grams, y.factor());
        }

        double asSold = grams / y.factor();
        if (!Double.isFinite(asSold)) {
            return AsSoldResult.invalid(h.state(), h.method());
        }
        return new AsSoldResult(asSold, h.state(), h.method(), y, h.inferred(), true);
    }

    /**
     * 整餐的油量（公克）：找不到油 item → 0
     */
    public double mealOilGrams(List<Item> mealItems) {
        if (mealItems == null) return 0.0;
        double total = 0.0;
        for (Item it : mealItems) {
            if (!OilAbsorption.isOilItem(it.key())) continue;
            GramsOrMl q = UnitConverter.normalizeToGramsOrMl(it);
            if (!q.valid()) continue;
            total += (q.measure() == Measure.MILLILITRES)
                    ? q.value() * OilAbsorption.OIL_DENSITY_G_PER_ML
                    : q.value();
        }
        return total;
    }

    /**
     * 依同餐「會吸油」item 的 as-sold 重量比例分配被吸收的油。
     * key = item 在 mealItems 的 index；油本身、不吸油的 item 不會出現在 map 裡。
     */
    public Map<Integer, Double> distributeAbsorbedOil(List<Item> mealItems) {
        Map<Integer, Double> out = new HashMap<>();
        double oil = mealOilGrams(mealItems);
        if (!(oil > 0)) return out;

        double[] weights = new double[mealItems.size()];
        double[] rates = new double[mealItems.size()];
        double pool = 0.0;

        for (int i = 0; i < mealItems.size(); i++) {
            Item it = mealItems.get(i);
            if (OilAbsorption.isOilItem(it.key())) continue;

            CookingMethod m = inferHints(it).method();
            double rate = OilAbsorption.rateOf(m);
            if (rate <= 0) continue;

            Double g = UnitConverter.toGrams(UnitConverter.normalizeToGramsOrMl(it), it.key());
            if (g == null || !(g > 0)) continue;

            double asSold = toAsSoldGrams(it, g).gramsAsSold();
            if (!(asSold > 0)) continue;

            weights[i] = asSold;
            rates[i] = rate;
            pool += asSold;
        }

        if (!(pool > 0)) return out;

        for (int i = 0; i < weights.length; i++) {
            if (weights[i] <= 0) continue;
            double share = weights[i] / pool;
            double absorbed = oil * rates[i] * share;
            out.put(i, Math.round(absorbed * 10.0) / 10.0);
        }
        log.debug("oil_distributed oilGrams={} poolGrams={} items={}", oil, pool, out.size());
        return out;
    }

    /**
     * 單一 item 在這餐吸到多少油（g）
     */
    public double absorbedOilGrams(Item item, List<Item> mealItems) {
        if (item == null || mealItems == null) return 0.0;
        int idx = indexOf(mealItems, item);
        if (idx < 0) return 0.0;
        return distributeAbsorbedOil(mealItems).getOrDefault(idx, 0.0);
    }

    private static int indexOf(List<Item> items, Item target) {
        // 先比 identity，再比 equals（record copy 也認得）
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == target) return i;
        }
        return items.indexOf(target);
    }
}
