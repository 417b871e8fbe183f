package com.calai.mealplan.plan.transform;

import com.calai.mealplan.plan.model.Item;

import java.util.Map;

import static com.calai.mealplan.plan.transform.KeyRules.containsAny;

/**
 * quantity + unit → 公克或毫升。
 * 非有限值 / 負數一律回 invalid（value=0），呼叫端再決定要怎麼降級。
 */
public final class UnitConverter {

    private UnitConverter() {}

    private static final Map<String, Double> MASS_TO_G = Map.of(
            "g", 1.0,
            "kg", 1000.0,
            "oz", 28.35,
            "lb", 453.6
    );

    private static final Map<String, Double> VOLUME_TO_ML = Map.of(
            "ml", 1.0,
            "L", 1000.0,
            "cup", 240.0,
            "tbsp", 15.0,
            "tsp", 5.0,
            "fl oz", 29.57
    );

    /** 固定重量的計數單位 */
    private static final Map<String, Double> FIXED_UNIT_WEIGHT_G = Map.ofEntries(
            Map.entry("egg", 50.0),
            Map.entry("large egg", 55.0),
            Map.entry("medium egg", 50.0),
            Map.entry("small egg", 45.0),
            Map.entry("slice", 35.0),
            Map.entry("clove", 5.0),
            Map.entry("stalk", 40.0),
            Map.entry("sprig", 2.0),
            Map.entry("bunch", 100.0),
            Map.entry("head", 300.0),
            Map.entry("leaf", 2.0),
            Map.entry("fillet", 170.0),
            Map.entry("breast", 170.0),
            Map.entry("thigh", 120.0),
            Map.entry("rasher", 25.0),
            Map.entry("strip", 25.0),
            Map.entry("can", 400.0),
            Map.entry("tin", 400.0),
            Map.entry("jar", 300.0),
            Map.entry("packet", 100.0),
            Map.entry("sachet", 30.0),
            Map.entry("serving", 150.0)
    );

    public static final double DEFAULT_UNIT_WEIGHT_G = 150.0;

    /** piece / whole：看食材決定一顆多重 */
    private static final KeyRules<Double> PIECE_WEIGHT_G = KeyRules.<Double>builder()
            .rule("egg", containsAny("egg"), 50.0)
            .rule("banana", containsAny("banana"), 120.0)
            .rule("potato", containsAny("potato"), 200.0)
            .rule("apple", containsAny("apple"), 150.0)
            .rule("tortilla", containsAny("tortilla", "wrap"), 60.0)
            .rule("bread", containsAny("bread", "toast"), 35.0)
            .build();

    /** ml → g 的密度（g/ml） */
    private static final KeyRules<Double> DENSITY = KeyRules.<Double>builder()
            .rule("milk", containsAny("milk"), 1.03)
            .rule("cream", containsAny("cream"), 1.01)
            .rule("oil", k -> OilAbsorption.isOilItem(k), 0.92)
            .rule("sauce", containsAny("sauce"), 1.05)
            .rule("water", containsAny("water"), 1.0)
            .rule("juice", containsAny("juice"), 1.04)
            .rule("yogurt", containsAny("yogurt", "yoghurt"), 1.05)
            .rule("wine", containsAny("wine"), 0.98)
            .rule("beer", containsAny("beer"), 1.01)
            .build();

    public static GramsOrMl normalizeToGramsOrMl(Item item) {
        return normalizeToGramsOrMl(item.quantityValue(), item.quantityUnit(), item.key());
    }

    public static GramsOrMl normalizeToGramsOrMl(Double qty, String unit, String key) {
        if (qty == null || !Double.isFinite(qty)) return GramsOrMl.invalid("QUANTITY_NOT_FINITE");
        if (qty < 0) return GramsOrMl.invalid("QUANTITY_NEGATIVE");

        String canonical = UnitCatalog.canonicalOrNull(unit);
        if (canonical == null) {
            if (unit == null || unit.isBlank()) {
                // 沒單位：當公克
                return GramsOrMl.grams(qty, "UNIT_MISSING_ASSUMED_G");
            }
            return GramsOrMl.grams(qty * DEFAULT_UNIT_WEIGHT_G, "UNIT_UNKNOWN_DEFAULT_WEIGHT");
        }

        Double mass = MASS_TO_G.get(canonical);
        if (mass != null) return GramsOrMl.grams(qty * mass, canonical);

        Double vol = VOLUME_TO_ML.get(canonical);
        if (vol != null) return GramsOrMl.millilitres(qty * vol, canonical);

        Double fixed = FIXED_UNIT_WEIGHT_G.get(canonical);
        if (fixed != null) return GramsOrMl.grams(qty * fixed, canonical);

        // piece / whole
        double perPiece = PIECE_WEIGHT_G.valueOr(key, DEFAULT_UNIT_WEIGHT_G);
        return GramsOrMl.grams(qty * perPiece, canonical);
    }

    public static double densityOf(String key) {
        return DENSITY.valueOr(key, 1.0);
    }

    /** 毫升換公克（用密度表）；公克原樣回傳；invalid 回 null */
    public static Double toGrams(GramsOrMl v, String key) {
        if (v == null || !v.valid()) return null;
        if (v.measure() == Measure.GRAMS) return v.value();
        return v.value() * densityOf(key);
    }
}
