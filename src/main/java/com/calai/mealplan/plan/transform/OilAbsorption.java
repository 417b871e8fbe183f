package com.calai.mealplan.plan.transform;

import com.calai.mealplan.plan.model.CookingMethod;

import java.util.EnumMap;
import java.util.Map;

/**
 * 各烹調法吸收「加進去的油」的比例。
 * fried / sauteed 都當 pan-fried 看。
 */
public final class OilAbsorption {

    private OilAbsorption() {}

    public static final double OIL_DENSITY_G_PER_ML = 0.92;

    private static final Map<CookingMethod, Double> RATES = new EnumMap<>(CookingMethod.class);

    static {
        RATES.put(CookingMethod.FRIED, 0.30);
        RATES.put(CookingMethod.SAUTEED, 0.30);
        RATES.put(CookingMethod.ROASTED, 0.15);
        RATES.put(CookingMethod.BAKED, 0.05);
        RATES.put(CookingMethod.GRILLED, 0.0);
        RATES.put(CookingMethod.BOILED, 0.0);
        RATES.put(CookingMethod.STEAMED, 0.0);
        RATES.put(CookingMethod.POACHED, 0.0);
        RATES.put(CookingMethod.BRAISED, 0.0);
    }

    public static double rateOf(CookingMethod method) {
        if (method == null) return 0.0;
        return RATES.getOrDefault(method, 0.0);
    }

    public static boolean absorbsOil(CookingMethod method) {
        return rateOf(method) > 0.0;
    }

    /**
     * 用 token 判斷，避免 "boiled" 這種子字串誤判成油
     */
    public static boolean isOilItem(String key) {
        return KeyRules.hasWord("oil", "oils").test(KeyRules.lower(key));
    }
}
