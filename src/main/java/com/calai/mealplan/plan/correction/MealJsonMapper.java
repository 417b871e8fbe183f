package com.calai.mealplan.plan.correction;

import com.calai.mealplan.plan.model.CookingMethod;
import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.ItemState;
import com.calai.mealplan.plan.model.Meal;
import com.calai.mealplan.plan.model.MealType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

import static com.calai.mealplan.plan.correction.ItemFields.KEY;
import static com.calai.mealplan.plan.correction.ItemFields.METHOD_HINT;
import static com.calai.mealplan.plan.correction.ItemFields.QUANTITY_UNIT;
import static com.calai.mealplan.plan.correction.ItemFields.QUANTITY_VALUE;
import static com.calai.mealplan.plan.correction.ItemFields.STATE_HINT;

/**
 * (已修正的) meals JSON → typed {@link Meal}。
 * 寬鬆：不認得的值一律變 null，交給後面的 guard / invariant 處理。
 */
public final class MealJsonMapper {

    private MealJsonMapper() {}

    public static List<Meal> toMeals(JsonNode mealsArray) {
        List<Meal> out = new ArrayList<>();
        if (mealsArray == null || !mealsArray.isArray()) return out;
        for (JsonNode m : mealsArray) {
            out.add(toMeal(m));
        }
        return out;
    }

    public static Meal toMeal(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new Meal(MealType.SNACK, MealType.SNACK.code(), null);
        }

        MealType type = MealType.fromCodeOrNull(ItemAutoCorrector.textOrNull(node.get("type")));
        if (type == null) type = MealType.SNACK;

        String name = ItemAutoCorrector.textOrNull(node.get("name"));
        if (name == null || name.isBlank()) name = type.code();

        // items 不是 array → null（structure guard 會把這餐排除）
        JsonNode itemsNode = node.get("items");
        List<Item> items = null;
        if (itemsNode != null && itemsNode.isArray()) {
            items = new ArrayList<>();
            for (JsonNode it : itemsNode) {
                if (it != null && it.isObject()) items.add(toItem(it));
            }
        }
        return new Meal(type, name, items);
    }

    public static Item toItem(JsonNode node) {
        ObjectNode n = ((ObjectNode) node).deepCopy();
        ItemFields.canonicalize(n);

        JsonNode q = n.get(QUANTITY_VALUE);
        Double qty = null;
        if (q != null && q.isNumber()) {
            qty = q.asDouble();
        } else if (q != null && q.isTextual()) {
            qty = ItemAutoCorrector.numFlexible(q.asText());
        }

        return new Item(
                ItemAutoCorrector.textOrNull(n.get(KEY)),
                qty,
                ItemAutoCorrector.textOrNull(n.get(QUANTITY_UNIT)),
                ItemState.fromCodeOrNull(HintAliases.normalizeState(ItemAutoCorrector.textOrNull(n.get(STATE_HINT)))),
                CookingMethod.fromCodeOrNull(HintAliases.normalizeMethod(ItemAutoCorrector.textOrNull(n.get(METHOD_HINT))))
        );
    }
}
