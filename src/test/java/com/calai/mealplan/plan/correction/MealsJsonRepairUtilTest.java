package com.calai.mealplan.plan.correction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MealsJsonRepairUtilTest {

    private static final ObjectMapper OM = new ObjectMapper();

    @Test
    void extracts_array_from_fenced_prose() {
        String text = """
                Here is your plan:
                ```json
                [{"type":"breakfast","name":"Oats","items":[{"key":"oats","quantityValue":60,"quantityUnit":"g"}]}]
                ```
                Enjoy!
                """;

        JsonNode meals = MealsJsonRepairUtil.repairOrNull(OM, text);

        assertThat(meals).isNotNull();
        assertThat(meals.isArray()).isTrue();
        assertThat(meals.get(0).get("name").asText()).isEqualTo("Oats");
    }

    @Test
    void truncated_number_dot_is_fixed_and_brackets_closed() {
        String text = "[{\"type\":\"lunch\",\"name\":\"Rice bowl\",\"items\":[{\"key\":\"rice\",\"quantityValue\":140.";

        JsonNode meals = MealsJsonRepairUtil.repairOrNull(OM, text);

        assertThat(meals).isNotNull();
        assertThat(meals.get(0).get("items").get(0).get("quantityValue").asDouble()).isEqualTo(140.0);
    }

    @Test
    void dangling_half_written_key_is_dropped() {
        String text = "[{\"type\":\"lunch\",\"name\":\"Bowl\",\"items\":[{\"key\":\"rice\",\"quantityValue\":140,\"quantityU";

        JsonNode meals = MealsJsonRepairUtil.repairOrNull(OM, text);

        assertThat(meals).isNotNull();
        JsonNode item = meals.get(0).get("items").get(0);
        assertThat(item.get("key").asText()).isEqualTo("rice");
        assertThat(item.has("quantityU")).isFalse();
    }

    @Test
    void meals_wrapper_and_trailing_commas() {
        String text = """
                {"meals":[{"type":"snack","name":"Apple","items":[{"key":"apple","quantityValue":1,"quantityUnit":"piece"},]},]}
                """;

        JsonNode meals = MealsJsonRepairUtil.repairOrNull(OM, text);

        assertThat(meals).isNotNull();
        assertThat(meals.size()).isEqualTo(1);
        assertThat(meals.get(0).get("items").size()).isEqualTo(1);
    }

    @Test
    void unrepairable_text_returns_null() {
        assertThat(MealsJsonRepairUtil.repairOrNull(OM, null)).isNull();
        assertThat(MealsJsonRepairUtil.repairOrNull(OM, "no json here")).isNull();
        assertThat(MealsJsonRepairUtil.repairOrNull(OM, "{\"foo\":1}")).isNull();
        assertThat(MealsJsonRepairUtil.repairOrNull(OM, "[{\"a\" \"b\"}]")).isNull();
    }

    @Test
    void balance_closes_open_string_first() {
        assertThat(MealsJsonRepairUtil.balanceJsonIfNeeded("[{\"name\":\"Ri"))
                .isEqualTo("[{\"name\":\"Ri\"}]");
        assertThat(MealsJsonRepairUtil.sanitizeDanglingTail("[{\"name\":"))
                .isEqualTo("[{\"name\":null");
    }
}
