package com.calai.mealplan.plan.correction;

import com.calai.mealplan.plan.model.CookingMethod;
import com.calai.mealplan.plan.model.ItemState;

import java.util.Locale;
import java.util.Map;

/**
 * stateHint / methodHint 的封閉字彙 + 常見別名
 */
public final class HintAliases {

    private HintAliases() {}

    private static final Map<String, String> STATE_ALIASES = Map.of(
            "dried", "dry",
            "uncooked", "raw",
            "fresh", "raw",
            "packaged", "as_pack",
            "packed", "as_pack",
            "as-pack", "as_pack",
            "as pack", "as_pack",
            "aspack", "as_pack"
    );

    private static final Map<String, String> METHOD_ALIASES = Map.ofEntries(
            Map.entry("sautéed", "sauteed"),
            Map.entry("saute", "sauteed"),
            Map.entry("sauté", "sauteed"),
            Map.entry("pan fried", "fried"),
            Map.entry("pan-fried", "fried"),
            Map.entry("stir fried", "fried"),
            Map.entry("stir-fried", "fried"),
            Map.entry("deep fried", "fried"),
            Map.entry("deep-fried", "fried"),
            Map.entry("bbq", "grilled"),
            Map.entry("barbecued", "grilled"),
            Map.entry("chargrilled", "grilled")
    );

    /** 回 canonical code；對不到回 null */
    public static String normalizeState(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (ItemState.fromCodeOrNull(v) != null) return v;
        return STATE_ALIASES.get(v);
    }

    public static String normalizeMethod(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (CookingMethod.fromCodeOrNull(v) != null) return v;
        return METHOD_ALIASES.get(v);
    }
}
