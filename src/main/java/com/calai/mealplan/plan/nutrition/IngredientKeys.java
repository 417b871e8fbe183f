package com.calai.mealplan.plan.nutrition;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * item key → lookup 用的 normalized key（snake_case、單數、去掉品牌/包裝字）。
 * 同一食材不同寫法要收斂成同一個 key，fan-out 才能去重。
 */
public final class IngredientKeys {

    private IngredientKeys() {}

    public static final String UNKNOWN = "unknown";

    private static final List<String> PREFIXES = List.of(
            "coles_", "woolworths_", "aldi_", "iga_", "organic_", "fresh_", "free_range_", "premium_", "homebrand_",
            "cooked_", "uncooked_", "raw_"
    );

    private static final List<String> SUFFIXES = List.of(
            "_value_pack", "_family_pack", "_multipack", "_bulk", "_pack"
    );

    private static final Map<String, String> SYNONYMS = Map.ofEntries(
            Map.entry("capsicum", "bell_pepper"),
            Map.entry("red_capsicum", "bell_pepper"),
            Map.entry("green_capsicum", "bell_pepper"),
            Map.entry("courgette", "zucchini"),
            Map.entry("aubergine", "eggplant"),
            Map.entry("coriander", "cilantro"),
            Map.entry("rocket", "arugula"),
            Map.entry("prawn", "shrimp"),
            Map.entry("mince", "beef_mince"),
            Map.entry("ground_beef", "beef_mince"),
            Map.entry("minced_beef", "beef_mince"),
            Map.entry("chicken_breast_fillet", "chicken_breast"),
            Map.entry("rolled_oats", "oats"),
            Map.entry("oat", "oats"),
            Map.entry("porridge_oats", "oats"),
            Map.entry("extra_virgin_olive_oil", "olive_oil"),
            Map.entry("evoo", "olive_oil"),
            Map.entry("natural_yogurt", "plain_yogurt"),
            Map.entry("kumara", "sweet_potato")
    );

    // 結尾是 s 但不是複數
    private static final Set<String> KEEP_TRAILING_S = Set.of(
            "oats", "hummus", "couscous", "asparagus", "lentils", "molasses", "swiss", "brussels"
    );

    public static String normalize(String raw) {
        if (raw == null) return UNKNOWN;

        String k = raw.toLowerCase(Locale.ROOT).trim()
                .replace("%", "pct")
                .replace("yoghurt", "yogurt")
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        if (k.isEmpty()) return UNKNOWN;

        for (String p : PREFIXES) {
            if (k.startsWith(p) && k.length() > p.length()) {
                k = k.substring(p.length());
                break;
            }
        }
        for (String s : SUFFIXES) {
            if (k.endsWith(s) && k.length() > s.length()) {
                k = k.substring(0, k.length() - s.length());
                break;
            }
        }

        k = singularizeLastToken(k);
        k = SYNONYMS.getOrDefault(k, k);

        return k.isEmpty() ? UNKNOWN : k;
    }

    /** 只處理最後一個 token（chicken_thighs → chicken_thigh） */
    static String singularizeLastToken(String key) {
        int idx = key.lastIndexOf('_');
        String head = idx < 0 ? "" : key.substring(0, idx + 1);
        String last = idx < 0 ? key : key.substring(idx + 1);
        return head + singularize(last);
    }

    static String singularize(String w) {
        if (w.length() <= 3 || KEEP_TRAILING_S.contains(w)) return w;
        if (w.endsWith("ies")) return w.substring(0, w.length() - 3) + "y";
        if (w.endsWith("oes")) return w.substring(0, w.length() - 2);
        if (w.endsWith("ss") || w.endsWith("us")) return w;
        if (w.endsWith("s")) return w.substring(0, w.length() - 1);
        return w;
    }
}
