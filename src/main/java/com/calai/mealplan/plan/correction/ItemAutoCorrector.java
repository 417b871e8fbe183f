package com.calai.mealplan.plan.correction;

import com.calai.mealplan.plan.model.Correction;
import com.calai.mealplan.plan.model.CorrectionRule;
import com.calai.mealplan.plan.transform.UnitCatalog;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.calai.mealplan.plan.correction.ItemFields.KEY;
import static com.calai.mealplan.plan.correction.ItemFields.METHOD_HINT;
import static com.calai.mealplan.plan.correction.ItemFields.QUANTITY_UNIT;
import static com.calai.mealplan.plan.correction.ItemFields.QUANTITY_VALUE;
import static com.calai.mealplan.plan.correction.ItemFields.STATE_HINT;

/**
 * 單一 item 的確定性修正（直接改傳進來的 node）。
 * 套用順序固定：
 * 1) 字串數字 → number
 * 2) 尺寸描述（medium…）→ 公克
 * 3) 單位拼法 → canonical
 * 4) stateHint / methodHint → 封閉字彙（對不到就清掉）
 * 5) 字面上是 g / ml 的才 clamp
 */
public final class ItemAutoCorrector {

    private ItemAutoCorrector() {}

    public static final double SOLID_MIN_G = 1;
    public static final double SOLID_MAX_G = 2000;
    public static final double LIQUID_MIN_ML = 5;
    public static final double LIQUID_MAX_ML = 1000;

    public static List<Correction> correct(ObjectNode item) {
        List<Correction> out = new ArrayList<>();
        if (item == null) return out;

        ItemFields.canonicalize(item);

        // clamp 只看「原本」的單位，size 換算出來的 g 不算
        String originalUnit = UnitCatalog.clean(textOrNull(item.get(QUANTITY_UNIT)));

        coerceNumber(item, out);
        resolveSizeDescriptor(item, out);
        normalizeUnit(item, out);
        normalizeStateHint(item, out);
        normalizeMethodHint(item, out);
        clampQuantity(item, originalUnit, out);

        return out;
    }

    // ===== 1) STRING_TO_NUMBER =====

    private static void coerceNumber(ObjectNode item, List<Correction> out) {
        JsonNode q = item.get(QUANTITY_VALUE);
        if (q == null || !q.isTextual()) return;

        Double parsed = numFlexible(q.asText());
        if (parsed == null) return;

        item.put(QUANTITY_VALUE, parsed);
        out.add(new Correction(QUANTITY_VALUE, q.asText(), parsed, CorrectionRule.STRING_TO_NUMBER));
    }

    private static final Pattern MIXED_FRACTION = Pattern.compile("^(\\d+)\\s+(\\d+)/(\\d+)");
    private static final Pattern FRACTION = Pattern.compile("^(\\d+)/(\\d+)");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?");

    /**
     * "2" / " 2.5 " / "1,5" / "1/2" / "1 1/2" → number；
     * 後面黏著字的（"100g"、"2 large"）取開頭的數字；開頭不是數字回 null
     */
    static Double numFlexible(String raw) {
        if (raw == null) return null;
        String s = raw.trim().replace(',', '.');
        if (s.isEmpty()) return null;

        Matcher m = MIXED_FRACTION.matcher(s);
        if (m.find()) {
            double den = Double.parseDouble(m.group(3));
            return den == 0 ? null : Double.parseDouble(m.group(1)) + Double.parseDouble(m.group(2)) / den;
        }
        m = FRACTION.matcher(s);
        if (m.find()) {
            double den = Double.parseDouble(m.group(2));
            return den == 0 ? null : Double.parseDouble(m.group(1)) / den;
        }
        m = LEADING_NUMBER.matcher(s);
        if (m.find()) {
            return Double.parseDouble(m.group());
        }
        return null;
    }

    // ===== 2) SIZE_DESCRIPTOR_TO_GRAMS =====

    private static void resolveSizeDescriptor(ObjectNode item, List<Correction> out) {
        String unit = textOrNull(item.get(QUANTITY_UNIT));
        if (!UnitCatalog.isSizeDescriptor(unit)) return;

        JsonNode q = item.get(QUANTITY_VALUE);
        if (q == null || !q.isNumber()) return;

        double count = q.asDouble();
        double perUnit = SizeDefaults.gramsPerUnit(UnitCatalog.clean(unit), textOrNull(item.get(KEY)));
        double grams = Math.round(count * perUnit * 10.0) / 10.0;

        item.put(QUANTITY_VALUE, grams);
        item.put(QUANTITY_UNIT, "g");

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("gramsPerUnit", perUnit);
        details.put("count", count);
        out.add(new Correction(QUANTITY_UNIT, q.asText() + " " + unit, formatGrams(grams),
                CorrectionRule.SIZE_DESCRIPTOR_TO_GRAMS, details));
    }

    // ===== 3) UNIT_NORMALIZATION =====

    private static void normalizeUnit(ObjectNode item, List<Correction> out) {
        String unit = textOrNull(item.get(QUANTITY_UNIT));
        if (unit == null) return;

        String canonical = UnitCatalog.canonicalOrNull(unit);
        if (canonical == null || canonical.equals(unit)) return;

        item.put(QUANTITY_UNIT, canonical);
        out.add(new Correction(QUANTITY_UNIT, unit, canonical, CorrectionRule.UNIT_NORMALIZATION));
    }

    // ===== 4) hints =====

    private static void normalizeStateHint(ObjectNode item, List<Correction> out) {
        JsonNode n = item.get(STATE_HINT);
        if (n == null || n.isNull()) return;

        String raw = n.isTextual() ? n.asText() : n.toString();
        String normalized = HintAliases.normalizeState(raw);
        if (normalized == null) {
            item.remove(STATE_HINT);
            out.add(new Correction(STATE_HINT, raw, null, CorrectionRule.INVALID_STATE_HINT_CLEARED));
        } else if (!normalized.equals(raw)) {
            item.put(STATE_HINT, normalized);
            out.add(new Correction(STATE_HINT, raw, normalized, CorrectionRule.STATE_HINT_NORMALIZATION));
        }
    }

    private static void normalizeMethodHint(ObjectNode item, List<Correction> out) {
        JsonNode n = item.get(METHOD_HINT);
        if (n == null || n.isNull()) return;

        String raw = n.isTextual() ? n.asText() : n.toString();
        String normalized = HintAliases.normalizeMethod(raw);
        if (normalized == null) {
            item.remove(METHOD_HINT);
            out.add(new Correction(METHOD_HINT, raw, null, CorrectionRule.INVALID_METHOD_HINT_CLEARED));
        } else if (!normalized.equals(raw)) {
            item.put(METHOD_HINT, normalized);
            out.add(new Correction(METHOD_HINT, raw, normalized, CorrectionRule.METHOD_HINT_NORMALIZATION));
        }
    }

    // ===== 5) QUANTITY_BOUNDS_CLAMPED =====

    private static void clampQuantity(ObjectNode item, String originalUnit, List<Correction> out) {
        if (originalUnit == null) return;
        JsonNode q = item.get(QUANTITY_VALUE);
        if (q == null || !q.isNumber()) return;

        double min;
        double max;
        if (UnitCatalog.LITERAL_GRAM_UNITS.contains(originalUnit)) {
            min = SOLID_MIN_G;
            max = SOLID_MAX_G;
        } else if (UnitCatalog.LITERAL_ML_UNITS.contains(originalUnit)) {
            min = LIQUID_MIN_ML;
            max = LIQUID_MAX_ML;
        } else {
            return;
        }

        double v = q.asDouble();
        // 0 / 負數不 clamp，交給 constraint validation 報錯
        if (!(v > 0) || (v >= min && v <= max)) return;

        double clamped = Math.max(min, Math.min(max, v));
        item.put(QUANTITY_VALUE, clamped);
        out.add(new Correction(QUANTITY_VALUE, v, clamped, CorrectionRule.QUANTITY_BOUNDS_CLAMPED,
                Map.of("min", min, "max", max)));
    }

    // ===== helpers =====

    static String textOrNull(JsonNode n) {
        if (n == null || n.isNull() || !n.isTextual()) return null;
        return n.asText();
    }

    private static String formatGrams(double g) {
        if (g == Math.rint(g)) return String.format(Locale.ROOT, "%.0fg", g);
        return String.format(Locale.ROOT, "%.1fg", g);
    }
}
