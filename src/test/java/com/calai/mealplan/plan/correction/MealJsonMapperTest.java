package com.calai.mealplan.plan.correction;

import com.calai.mealplan.plan.model.CookingMethod;
import com.calai.mealplan.plan.model.Item;
import com.calai.mealplan.plan.model.ItemState;
import com.calai.mealplan.plan.model.Meal;
import com.calai.mealplan.plan.model.MealType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MealJsonMapperTest {

    private static final ObjectMapper OM = new ObjectMapper();

    @Test
    void maps_meals_with_aliases_and_defaults() throws Exception {
        List<Meal> meals = MealJsonMapper.toMeals(OM.readTree("""
                [
                  {"type":"Dinner","name":"Stir fry","items":[
                    {"key":"chicken_breast","qty":"2","unit":"fillet","state":"uncooked","method":"pan-fried"}
                  ]},
                  {"items":[{"key":"apple","quantityValue":1,"quantityUnit":"piece"}]}
                ]
                """));

        assertThat(meals).hasSize(2);

        Meal dinner = meals.get(0);
        assertThat(dinner.type()).isEqualTo(MealType.DINNER);
        Item chicken = dinner.items().get(0);
        assertThat(chicken.quantityValue()).isEqualTo(2.0);
        assertThat(chicken.quantityUnit()).isEqualTo("fillet");
        assertThat(chicken.stateHint()).isEqualTo(ItemState.RAW);
        assertThat(chicken.methodHint()).isEqualTo(CookingMethod.FRIED);

        Meal snack = meals.get(1);
        assertThat(snack.type()).isEqualTo(MealType.SNACK);
        assertThat(snack.name()).isEqualTo("snack");
    }

    @Test
    void malformed_meals_become_empty_shells() throws Exception {
        List<Meal> meals = MealJsonMapper.toMeals(OM.readTree("""
                [ "oops", {"type":"lunch","name":"Bowl","items":"rice"} ]
                """));

        assertThat(meals).hasSize(2);
        assertThat(meals.get(0).items()).isEmpty();
        assertThat(meals.get(1).name()).isEqualTo("Bowl");
        assertThat(meals.get(1).hasItems()).isFalse();

        assertThat(MealJsonMapper.toMeals(OM.readTree("{}"))).isEmpty();
    }
}
