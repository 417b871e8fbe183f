package com.calai.mealplan.plan.transform;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 單位字彙表：每個單位家族只留一個 canonical token。
 * - metric weight: g / kg
 * - metric volume: ml / L
 * - imperial: oz / lb / cup / tbsp / tsp / fl oz
 * - count: piece / slice / ... / egg 尺寸
 */
public final class UnitCatalog {

    private UnitCatalog() {}

    public static final Set<String> MASS_UNITS = Set.of("g", "kg", "oz", "lb");
    public static final Set<String> VOLUME_UNITS = Set.of("ml", "L", "cup", "tbsp", "tsp", "fl oz");

    /** 不是真單位，是尺寸描述（corrector 會換成公克） */
    public static final Set<String> SIZE_DESCRIPTORS = Set.of("small", "medium", "large", "extra large", "xl", "jumbo");

    /** corrector 只對這些「字面上就是 g / ml」的單位做 clamp */
    public static final Set<String> LITERAL_GRAM_UNITS = Set.of("g", "gram", "grams");
    public static final Set<String> LITERAL_ML_UNITS = Set.of("ml", "milliliter", "milliliters", "millilitre", "millilitres");

    // alias(lower-case) -> canonical
    private static final Map<String, String> ALIAS = new LinkedHashMap<>();

    static {
        alias("g", "g", "gram", "grams", "gr", "gm");
        alias("kg", "kg", "kgs", "kilogram", "kilograms");
        alias("ml", "ml", "mls", "milliliter", "milliliters", "millilitre", "millilitres");
        alias("L", "l", "liter", "liters", "litre", "litres");
        alias("oz", "oz", "ounce", "ounces");
        alias("lb", "lb", "lbs", "pound", "pounds");
        alias("cup", "cup", "cups");
        alias("tbsp", "tbsp", "tablespoon", "tablespoons", "tbs");
        alias("tsp", "tsp", "teaspoon", "teaspoons");
        alias("fl oz", "fl oz", "fl. oz", "fluid ounce", "fluid ounces", "floz");
        alias("piece", "piece", "pieces", "pc", "pcs");
        alias("slice", "slice", "slices");
        alias("whole", "whole");
        alias("clove", "clove", "cloves");
        alias("stalk", "stalk", "stalks");
        alias("sprig", "sprig", "sprigs");
        alias("bunch", "bunch", "bunches");
        alias("head", "head", "heads");
        alias("leaf", "leaf", "leaves");
        alias("fillet", "fillet", "fillets");
        alias("breast", "breast", "breasts");
        alias("thigh", "thigh", "thighs");
        alias("rasher", "rasher", "rashers");
        alias("strip", "strip", "strips");
        alias("can", "can", "cans");
        alias("tin", "tin", "tins");
        alias("jar", "jar", "jars");
        alias("packet", "packet", "packets");
        alias("sachet", "sachet", "sachets");
        alias("serving", "serving", "servings", "serve", "serves");
        alias("egg", "egg", "eggs");
        alias("large egg", "large egg", "large eggs");
        alias("medium egg", "medium egg", "medium eggs");
        alias("small egg", "small egg", "small eggs");
    }

    private static void alias(String canonical, String... spellings) {
        for (String s : spellings) ALIAS.put(s, canonical);
    }

    /** 小寫、去頭尾空白、連續空白收成一個 */
    public static String clean(String raw) {
        if (raw == null) return null;
        return raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /** 不認得回 null */
    public static String canonicalOrNull(String raw) {
        String c = clean(raw);
        if (c == null || c.isEmpty()) return null;
        return ALIAS.get(c);
    }

    public static boolean isCanonical(String unit) {
        return unit != null && ALIAS.containsValue(unit) && unit.equals(canonicalOrNull(unit));
    }

    public static boolean isAllowed(String raw) {
        return canonicalOrNull(raw) != null;
    }

    public static boolean isSizeDescriptor(String raw) {
        String c = clean(raw);
        return c != null && SIZE_DESCRIPTORS.contains(c);
    }

    public static boolean isMass(String canonical) {
        return canonical != null && MASS_UNITS.contains(canonical);
    }

    public static boolean isVolume(String canonical) {
        return canonical != null && VOLUME_UNITS.contains(canonical);
    }
}
