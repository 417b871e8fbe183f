package com.calai.mealplan.plan.correction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * item JSON 的欄位名稱。generator 不同版本用過不同名字，統一搬到 canonical 名稱。
 */
public final class ItemFields {

    private ItemFields() {}

    public static final String KEY = "key";
    public static final String QUANTITY_VALUE = "quantityValue";
    public static final String QUANTITY_UNIT = "quantityUnit";
    public static final String STATE_HINT = "stateHint";
    public static final String METHOD_HINT = "methodHint";

    // canonical -> aliases（前面的優先）
    private static final Map<String, List<String>> ALIASES = Map.of(
            QUANTITY_VALUE, List.of("qty_value", "qty", "quantity"),
            QUANTITY_UNIT, List.of("qty_unit", "unit"),
            STATE_HINT, List.of("state"),
            METHOD_HINT, List.of("method")
    );

    /**
     * canonical 欄位不存在時，用第一個有值的 alias 補上，並移除 alias 欄位。
     * 不算 correction（只是欄位名稱）。
     */
    public static void canonicalize(ObjectNode item) {
        if (item == null) return;
        for (Map.Entry<String, List<String>> e : ALIASES.entrySet()) {
            String canonical = e.getKey();
            for (String alias : e.getValue()) {
                if (!item.has(alias)) continue;
                JsonNode v = item.remove(alias);
                if (!item.has(canonical) && v != null && !v.isNull()) {
                    item.set(canonical, v);
                }
            }
        }
    }
}
