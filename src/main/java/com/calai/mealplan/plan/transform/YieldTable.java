package com.calai.mealplan.plan.transform;

import static com.calai.mealplan.plan.transform.KeyRules.containsAny;

/**
 * cooked → as-sold 的 yield 表。
 * as_sold = cooked_grams / factor（兩種 factor 形狀都是除）
 */
public final class YieldTable {

    private YieldTable() {}

    public static final YieldFactor DEFAULT = new YieldFactor("default", 1.0, FactorType.RAW_TO_COOKED, false);

    // 順序有意義：beef_lean 要排在 beef_fatty 前面、fish 要在 salmon 後面
    private static final KeyRules<YieldFactor> RULES = KeyRules.<YieldFactor>builder()
            // 穀物
            .rule("rice", containsAny("rice"), dry("rice", 3.0))
            .rule("pasta", containsAny("pasta", "noodle", "spaghetti", "penne", "macaroni", "fusilli"), dry("pasta", 2.5))
            .rule("oats", containsAny("oat", "porridge"), dry("oats", 3.5))
            .rule("quinoa", containsAny("quinoa"), dry("quinoa", 3.0))
            .rule("couscous", containsAny("couscous"), dry("couscous", 2.5))
            .rule("lentils", containsAny("lentil"), dry("lentils", 2.8))
            // 肉
            .rule("chicken", containsAny("chicken"), raw("chicken", 0.75))
            .rule("beef_lean", k -> containsAny("beef", "steak", "mince").test(k) && k.contains("lean"), raw("beef_lean", 0.70))
            .rule("beef_fatty", containsAny("beef", "steak", "mince"), raw("beef_fatty", 0.65))
            .rule("pork", containsAny("pork"), raw("pork", 0.72))
            .rule("salmon", containsAny("salmon"), raw("salmon", 0.80))
            .rule("fish_white", containsAny("fish", "cod", "basa", "snapper"), raw("fish_white", 0.85))
            // 蔬菜
            .rule("potato", containsAny("potato"), raw("potato", 0.90))
            .rule("veg_watery", containsAny("spinach", "mushroom"), raw("veg_watery", 0.85))
            .rule("veg_dense", containsAny("broccoli", "carrot", "bean", "veg"), raw("veg_dense", 0.95))
            // 兜底
            .rule("default_grain", containsAny("grain", "cereal"), dry("default_grain", 2.8))
            .rule("default_meat", containsAny("meat", "poultry"), raw("default_meat", 0.75))
            .build();

    public static YieldFactor lookup(String itemKey) {
        return RULES.valueOr(itemKey, DEFAULT);
    }

    public static KeyRules<YieldFactor> rules() {
        return RULES;
    }

    /** 反向：as-sold → cooked（round-trip 用） */
    public static double toCooked(double gramsAsSold, YieldFactor y) {
        return gramsAsSold * y.factor();
    }

    private static YieldFactor dry(String c, double f) {
        return new YieldFactor(c, f, FactorType.DRY_TO_COOKED, true);
    }

    private static YieldFactor raw(String c, double f) {
        return new YieldFactor(c, f, FactorType.RAW_TO_COOKED, true);
    }
}
