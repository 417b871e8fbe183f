package com.calai.mealplan.plan.transform;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class UnitConverterTest {

    @Test
    void mass_units_convert_to_grams() {
        GramsOrMl kg = UnitConverter.normalizeToGramsOrMl(0.5, "kilograms", "beef_mince");
        GramsOrMl oz = UnitConverter.normalizeToGramsOrMl(4.0, "oz", "salmon");

        assertThat(kg.valid()).isTrue();
        assertThat(kg.measure()).isEqualTo(Measure.GRAMS);
        assertThat(kg.value()).isEqualTo(500.0);
        assertThat(oz.value()).isCloseTo(113.4, within(1e-9));
    }

    @Test
    void volume_units_stay_in_ml_until_density_is_applied() {
        GramsOrMl milk = UnitConverter.normalizeToGramsOrMl(2.0, "cups", "milk");

        assertThat(milk.measure()).isEqualTo(Measure.MILLILITRES);
        assertThat(milk.value()).isEqualTo(480.0);
        assertThat(UnitConverter.toGrams(milk, "milk")).isCloseTo(494.4, within(1e-9));
    }

    @Test
    void oil_uses_oil_density() {
        GramsOrMl oil = UnitConverter.normalizeToGramsOrMl(1.0, "tbsp", "olive_oil");

        assertThat(oil.value()).isEqualTo(15.0);
        assertThat(UnitConverter.toGrams(oil, "olive_oil")).isCloseTo(13.8, within(1e-9));
        assertThat(UnitConverter.densityOf("dragonfruit")).isEqualTo(1.0);
    }

    @Test
    void count_units_use_fixed_or_per_item_weight() {
        assertThat(UnitConverter.normalizeToGramsOrMl(2.0, "cloves", "garlic").value()).isEqualTo(10.0);
        assertThat(UnitConverter.normalizeToGramsOrMl(1.0, "sachet", "oats").value()).isEqualTo(30.0);
        assertThat(UnitConverter.normalizeToGramsOrMl(3.0, "pieces", "banana").value()).isEqualTo(360.0);
        assertThat(UnitConverter.normalizeToGramsOrMl(1.0, "whole", "dragonfruit").value())
                .isEqualTo(UnitConverter.DEFAULT_UNIT_WEIGHT_G);
    }

    @Test
    void missing_unit_is_grams_and_unknown_unit_is_default_weight() {
        GramsOrMl missing = UnitConverter.normalizeToGramsOrMl(120.0, null, "rice");
        GramsOrMl unknown = UnitConverter.normalizeToGramsOrMl(2.0, "handful", "almond");

        assertThat(missing.value()).isEqualTo(120.0);
        assertThat(missing.note()).isEqualTo("UNIT_MISSING_ASSUMED_G");
        assertThat(unknown.value()).isEqualTo(300.0);
        assertThat(unknown.note()).isEqualTo("UNIT_UNKNOWN_DEFAULT_WEIGHT");
    }

    @Test
    void non_finite_or_negative_quantity_is_invalid_never_nan() {
        GramsOrMl nan = UnitConverter.normalizeToGramsOrMl(Double.NaN, "g", "rice");
        GramsOrMl nul = UnitConverter.normalizeToGramsOrMl(null, "g", "rice");
        GramsOrMl neg = UnitConverter.normalizeToGramsOrMl(-5.0, "g", "rice");

        assertThat(nan.valid()).isFalse();
        assertThat(nan.value()).isEqualTo(0.0);
        assertThat(nan.note()).isEqualTo("QUANTITY_NOT_FINITE");
        assertThat(nul.valid()).isFalse();
        assertThat(neg.note()).isEqualTo("QUANTITY_NEGATIVE");
        assertThat(UnitConverter.toGrams(neg, "rice")).isNull();
    }
}
