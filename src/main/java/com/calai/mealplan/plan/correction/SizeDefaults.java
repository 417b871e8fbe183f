package com.calai.mealplan.plan.correction;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 「2 medium egg」這種尺寸描述 → 每顆幾公克
 * 查表順序：完整 "size key" → 部分符合 → 通用尺寸 → 100g
 */
public final class SizeDefaults {

    private SizeDefaults() {}

    public static final double FALLBACK_GRAMS = 100.0;

    private static final Map<String, Double> TABLE = new LinkedHashMap<>();

    static {
        // Eggs
        put("egg", 45, 50, 55);
        TABLE.put("extra large egg", 60.0);
        TABLE.put("xl egg", 60.0);
        TABLE.put("jumbo egg", 70.0);
        // Produce
        put("potato", 120, 170, 280);
        put("onion", 70, 110, 150);
        put("tomato", 75, 120, 180);
        put("carrot", 50, 70, 100);
        put("apple", 100, 150, 200);
        put("banana", 80, 120, 150);
    }

    private static final Map<String, Double> GENERIC = Map.of(
            "small", 75.0,
            "medium", 120.0,
            "large", 180.0,
            "extra large", 180.0,
            "xl", 180.0,
            "jumbo", 180.0
    );

    private static void put(String key, double s, double m, double l) {
        TABLE.put("small " + key, s);
        TABLE.put("medium " + key, m);
        TABLE.put("large " + key, l);
    }

    public static double gramsPerUnit(String size, String ingredientKey) {
        String sz = size == null ? "" : size.trim().toLowerCase(Locale.ROOT);
        String key = ingredientKey == null ? "" : ingredientKey.trim().toLowerCase(Locale.ROOT).replace('_', ' ');

        Double exact = TABLE.get(sz + " " + key);
        if (exact != null) return exact;

        // 部分符合：key = "eggs" / "free range egg" 也要認得
        for (Map.Entry<String, Double> e : TABLE.entrySet()) {
            String k = e.getKey();
            if (!k.startsWith(sz + " ")) continue;
            String food = k.substring(sz.length() + 1);
            if (key.contains(food)) return e.getValue();
        }

        return GENERIC.getOrDefault(sz, FALLBACK_GRAMS);
    }
}
