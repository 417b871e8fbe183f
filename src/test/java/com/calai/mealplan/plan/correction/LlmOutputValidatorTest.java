package com.calai.mealplan.plan.correction;

import com.calai.mealplan.plan.model.Correction;
import com.calai.mealplan.plan.model.CorrectionRule;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LlmOutputValidatorTest {

    private static final ObjectMapper OM = new ObjectMapper();

    private final LlmOutputValidator validator = new LlmOutputValidator();

    private static JsonNode json(String s) throws Exception {
        return OM.readTree(s);
    }

    @Test
    void corrections_are_applied_to_a_copy() throws Exception {
        JsonNode in = json("""
                [{"type":"breakfast","name":"Eggs","items":[
                  {"key":"egg","quantityValue":2,"quantityUnit":"medium","stateHint":"uncooked"}
                ]}]
                """);

        ValidationResult r = validator.validate(in, SchemaKind.MEALS_ARRAY);

        assertThat(r.valid()).isTrue();
        assertThat(r.errors()).isEmpty();
        assertThat(r.corrections().stream().map(Correction::rule).toList())
                .containsExactly(CorrectionRule.SIZE_DESCRIPTOR_TO_GRAMS, CorrectionRule.STATE_HINT_NORMALIZATION);

        JsonNode item = r.correctedOutput().get(0).get("items").get(0);
        assertThat(item.get("quantityUnit").asText()).isEqualTo("g");
        assertThat(item.get("quantityValue").asDouble()).isEqualTo(100.0);
        assertThat(item.get("stateHint").asText()).isEqualTo("raw");

        // 原本的 node 不動
        assertThat(in.get(0).get("items").get(0).get("quantityUnit").asText()).isEqualTo("medium");
    }

    @Test
    void schema_and_constraint_errors_are_collected() throws Exception {
        JsonNode in = json("""
                [
                  {"type":"brunch","items":[{"key":"rice","quantityValue":100,"quantityUnit":"bucket"}]},
                  {"type":"dinner","name":"Stew","items":[{"key":"beef","quantityValue":-5,"quantityUnit":"g"}]},
                  {"type":"snack","name":"Nothing","items":[]}
                ]
                """);

        ValidationResult r = validator.validate(in, SchemaKind.MEALS_ARRAY);

        assertThat(r.valid()).isFalse();
        assertThat(r.errors()).contains(
                "Meal 0: invalid meal type 'brunch'",
                "Meal 0: missing required field 'name'",
                "Item 'rice': unit 'bucket' is not allowed",
                "Item 'beef': quantity must be positive, got -5.0",
                "Meal 2: 'items' must have at least 1 item");
    }

    @Test
    void missing_item_fields_are_reported() throws Exception {
        JsonNode in = json("""
                [{"type":"lunch","name":"Bowl","items":[{"quantityValue":"lots"}]}]
                """);

        ValidationResult r = validator.validate(in, SchemaKind.MEALS_ARRAY);

        assertThat(r.valid()).isFalse();
        assertThat(r.errors()).contains(
                "Item 'unknown': missing required field 'key'",
                "Item 'unknown': field 'quantityValue' must be a number",
                "Item 'unknown': missing required field 'quantityUnit'");
    }

    @Test
    void non_array_and_empty_inputs_fail() throws Exception {
        assertThat(validator.validate(json("{}"), SchemaKind.MEALS_ARRAY).errors())
                .containsExactly("Expected array, got object");
        assertThat(validator.validate(json("[]"), SchemaKind.MEALS_ARRAY).errors())
                .containsExactly("Array must have at least 1 meal");

        ValidationResult nul = validator.validate(null, SchemaKind.MEALS_ARRAY);
        assertThat(nul.valid()).isFalse();
        assertThat(nul.errors()).containsExactly("Output is null");
    }

    @Test
    void invalid_hints_are_cleared_not_rejected() throws Exception {
        JsonNode in = json("""
                {"key":"salmon","quantityValue":150,"quantityUnit":"g","stateHint":"half-baked","methodHint":"smoked"}
                """);

        ValidationResult r = validator.validate(in, SchemaKind.ITEM);

        assertThat(r.valid()).isTrue();
        assertThat(r.correctedOutput().has("stateHint")).isFalse();
        assertThat(r.correctedOutput().has("methodHint")).isFalse();
        assertThat(r.corrections().stream().map(Correction::rule).toList()).containsExactly(
                CorrectionRule.INVALID_STATE_HINT_CLEARED, CorrectionRule.INVALID_METHOD_HINT_CLEARED);
    }

    @Test
    void grocery_query_shape() throws Exception {
        ValidationResult ok = validator.validate(json("""
                {"normalQuery":"chicken breast","tightQuery":"skinless chicken breast","requiredWords":["chicken"]}
                """), SchemaKind.GROCERY_QUERY);
        assertThat(ok.valid()).isTrue();

        ValidationResult bad = validator.validate(json("""
                {"tightQuery":7,"requiredWords":["chicken",3],"allowedCategories":"meat"}
                """), SchemaKind.GROCERY_QUERY);
        assertThat(bad.errors()).containsExactlyInAnyOrder(
                "Missing required field 'normalQuery'",
                "Field 'tightQuery' must be a string",
                "Field 'requiredWords' must contain only strings",
                "Field 'allowedCategories' must be an array");
    }
}
