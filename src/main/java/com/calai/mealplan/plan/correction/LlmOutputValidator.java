package com.calai.mealplan.plan.correction;

import com.calai.mealplan.plan.model.Correction;
import com.calai.mealplan.plan.model.MealType;
import com.calai.mealplan.plan.transform.UnitCatalog;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.calai.mealplan.plan.correction.ItemFields.KEY;
import static com.calai.mealplan.plan.correction.ItemFields.METHOD_HINT;
import static com.calai.mealplan.plan.correction.ItemFields.QUANTITY_UNIT;
import static com.calai.mealplan.plan.correction.ItemFields.QUANTITY_VALUE;
import static com.calai.mealplan.plan.correction.ItemFields.STATE_HINT;

/**
 * LLM 輸出的 schema + constraint 驗證。
 * 結構錯誤只記錄、不中斷：就算 schema 不過也照樣修 item，能少重打一次 LLM 就少一次。
 * 原本的 JsonNode 不會被改，修正結果放在 correctedOutput。
 */
@Slf4j
@Component
public class LlmOutputValidator {

    public ValidationResult validate(JsonNode output, SchemaKind kind) {
        List<String> errors = new ArrayList<>();
        List<Correction> corrections = new ArrayList<>();

        if (output == null || output.isNull() || output.isMissingNode()) {
            errors.add("Output is null");
            return new ValidationResult(false, errors, corrections, output);
        }

        JsonNode copy = output.deepCopy();

        switch (kind) {
            case MEALS_ARRAY -> validateMealsArray(copy, errors, corrections);
            case MEAL -> validateMeal(copy, "meal", errors, corrections);
            case ITEM -> validateItem(copy, errors, corrections);
            case GROCERY_QUERY -> validateGroceryQuery(copy, errors);
        }

        if (!corrections.isEmpty()) {
            log.info("llm_output_corrected kind={} corrections={} remainingErrors={}", kind, corrections.size(), errors.size());
        }
        return new ValidationResult(errors.isEmpty(), errors, corrections, copy);
    }

    // ===== meals =====

    private void validateMealsArray(JsonNode node, List<String> errors, List<Correction> corrections) {
        if (!node.isArray()) {
            errors.add("Expected array, got " + typeName(node));
            return;
        }
        ArrayNode arr = (ArrayNode) node;
        if (arr.isEmpty()) {
            errors.add("Array must have at least 1 meal");
            return;
        }
        for (int i = 0; i < arr.size(); i++) {
            validateMeal(arr.get(i), "Meal " + i, errors, corrections);
        }
    }

    private void validateMeal(JsonNode node, String label, List<String> errors, List<Correction> corrections) {
        if (node == null || !node.isObject()) {
            errors.add(label + ": expected object, got " + typeName(node));
            return;
        }

        JsonNode type = node.get("type");
        if (type == null || type.isNull()) {
            errors.add(label + ": missing required field 'type'");
        } else if (!type.isTextual()) {
            errors.add(label + ": field 'type' must be a string");
        } else if (MealType.fromCodeOrNull(type.asText()) == null) {
            errors.add(label + ": invalid meal type '" + type.asText() + "'");
        }

        JsonNode name = node.get("name");
        if (name == null || name.isNull()) {
            errors.add(label + ": missing required field 'name'");
        } else if (!name.isTextual() || name.asText().isBlank()) {
            errors.add(label + ": field 'name' must be a non-empty string");
        }

        JsonNode items = node.get("items");
        if (items == null || items.isNull()) {
            errors.add(label + ": missing required field 'items'");
            return;
        }
        if (!items.isArray()) {
            errors.add(label + ": field 'items' must be an array");
            return;
        }
        if (items.isEmpty()) {
            errors.add(label + ": 'items' must have at least 1 item");
            return;
        }
        for (JsonNode it : items) {
            validateItem(it, errors, corrections);
        }
    }

    // ===== item =====

    private void validateItem(JsonNode node, List<String> errors, List<Correction> corrections) {
        if (node == null || !node.isObject()) {
            errors.add("Item: expected object, got " + typeName(node));
            return;
        }
        ObjectNode item = (ObjectNode) node;

        corrections.addAll(ItemAutoCorrector.correct(item));

        String key = ItemAutoCorrector.textOrNull(item.get(KEY));
        String prefix = "Item '" + (key == null ? "unknown" : key) + "': ";

        // ---- schema ----
        if (key == null || key.isBlank()) {
            errors.add(prefix + "missing required field 'key'");
        }

        JsonNode q = item.get(QUANTITY_VALUE);
        if (q == null || q.isNull()) {
            errors.add(prefix + "missing required field '" + QUANTITY_VALUE + "'");
        } else if (!q.isNumber()) {
            errors.add(prefix + "field '" + QUANTITY_VALUE + "' must be a number");
        }

        JsonNode u = item.get(QUANTITY_UNIT);
        if (u == null || u.isNull()) {
            errors.add(prefix + "missing required field '" + QUANTITY_UNIT + "'");
        } else if (!u.isTextual()) {
            errors.add(prefix + "field '" + QUANTITY_UNIT + "' must be a string");
        }

        // ---- constraints（修完之後還剩下的）----
        String unit = ItemAutoCorrector.textOrNull(u);
        if (unit != null && !UnitCatalog.isAllowed(unit)) {
            errors.add(prefix + "unit '" + unit + "' is not allowed");
        }

        if (q != null && q.isNumber()) {
            double v = q.asDouble();
            if (!Double.isFinite(v) || v <= 0) {
                errors.add(prefix + "quantity must be positive, got " + v);
            } else if ("g".equals(unit) && (v < ItemAutoCorrector.SOLID_MIN_G || v > ItemAutoCorrector.SOLID_MAX_G)) {
                errors.add(prefix + String.format(Locale.ROOT, "quantity %.1fg outside bounds [%.0f, %.0f]",
                        v, ItemAutoCorrector.SOLID_MIN_G, ItemAutoCorrector.SOLID_MAX_G));
            } else if ("ml".equals(unit) && (v < ItemAutoCorrector.LIQUID_MIN_ML || v > ItemAutoCorrector.LIQUID_MAX_ML)) {
                errors.add(prefix + String.format(Locale.ROOT, "quantity %.1fml outside bounds [%.0f, %.0f]",
                        v, ItemAutoCorrector.LIQUID_MIN_ML, ItemAutoCorrector.LIQUID_MAX_ML));
            }
        }

        String state = ItemAutoCorrector.textOrNull(item.get(STATE_HINT));
        if (state != null && HintAliases.normalizeState(state) == null) {
            errors.add(prefix + "invalid stateHint '" + state + "'");
        }
        String method = ItemAutoCorrector.textOrNull(item.get(METHOD_HINT));
        if (method != null && HintAliases.normalizeMethod(method) == null) {
            errors.add(prefix + "invalid methodHint '" + method + "'");
        }
    }

    // ===== grocery query =====

    private void validateGroceryQuery(JsonNode node, List<String> errors) {
        if (!node.isObject()) {
            errors.add("Expected object, got " + typeName(node));
            return;
        }
        JsonNode normal = node.get("normalQuery");
        if (normal == null || normal.isNull()) {
            errors.add("Missing required field 'normalQuery'");
        } else if (!normal.isTextual() || normal.asText().isBlank()) {
            errors.add("Field 'normalQuery' must be a non-empty string");
        }

        JsonNode tight = node.get("tightQuery");
        if (tight != null && !tight.isNull() && !tight.isTextual()) {
            errors.add("Field 'tightQuery' must be a string");
        }

        for (String f : List.of("requiredWords", "negativeKeywords", "allowedCategories")) {
            JsonNode arr = node.get(f);
            if (arr == null || arr.isNull()) continue;
            if (!arr.isArray()) {
                errors.add("Field '" + f + "' must be an array");
                continue;
            }
            for (JsonNode e : arr) {
                if (!e.isTextual()) {
                    errors.add("Field '" + f + "' must contain only strings");
                    break;
                }
            }
        }
    }

    private static String typeName(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return "null";
        return n.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
