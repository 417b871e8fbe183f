package com.calai.mealplan.plan.transform;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class YieldTableTest {

    @Test
    void grains_use_dry_to_cooked_factor() {
        YieldFactor y = YieldTable.lookup("cooked_brown_rice");

        assertThat(y.category()).isEqualTo("rice");
        assertThat(y.factor()).isEqualTo(3.0);
        assertThat(y.type()).isEqualTo(FactorType.DRY_TO_COOKED);
        assertThat(y.mapped()).isTrue();
    }

    @Test
    void lean_beef_wins_over_fatty_beef() {
        assertThat(YieldTable.lookup("lean_beef_mince").category()).isEqualTo("beef_lean");
        assertThat(YieldTable.lookup("beef_mince").category()).isEqualTo("beef_fatty");
        assertThat(YieldTable.lookup("salmon_fillet").category()).isEqualTo("salmon");
        assertThat(YieldTable.lookup("white_fish").category()).isEqualTo("fish_white");
    }

    @Test
    void unknown_key_falls_back_to_one_to_one() {
        YieldFactor y = YieldTable.lookup("dragonfruit");

        assertThat(y).isEqualTo(YieldTable.DEFAULT);
        assertThat(y.mapped()).isFalse();
        assertThat(YieldTable.lookup(null)).isEqualTo(YieldTable.DEFAULT);
    }

    @Test
    void as_sold_and_back_returns_the_cooked_weight() {
        List<String> keys = List.of("rice", "pasta", "oats", "quinoa", "couscous", "lentils",
                "chicken", "lean_beef", "beef", "pork", "salmon", "fish", "potato", "spinach", "broccoli");
        for (String key : keys) {
            YieldFactor y = YieldTable.lookup(key);
            double cooked = 300.0;
            double asSold = cooked / y.factor();
            assertThat(YieldTable.toCooked(asSold, y)).as(key).isCloseTo(cooked, within(1e-9));
        }
    }
}
