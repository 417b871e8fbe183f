package com.calai.mealplan.plan.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineConfigTest {

    @Test
    void defaults_match_properties() {
        PipelineConfig c = PipelineConfig.defaults();

        assertThat(c.flagThresholdPct()).isEqualTo(25.0);
        assertThat(c.blockThresholdPct()).isEqualTo(50.0);
        assertThat(c.responseBlockThresholdPct()).isEqualTo(80.0);
        assertThat(c.maxLlmRetries()).isEqualTo(2);
        assertThat(c.enableConsistencyGate()).isTrue();
        assertThat(c.nutritionTimeout()).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    void overrides_create_a_new_config_and_keep_the_base() {
        PipelineConfig base = PipelineConfig.defaults();
        PipelineConfigOverrides o = new PipelineConfigOverrides(10.0, 30.0, null, false, null, 0, null, null);

        PipelineConfig c = base.withOverrides(o);

        assertThat(c.flagThresholdPct()).isEqualTo(10.0);
        assertThat(c.blockThresholdPct()).isEqualTo(30.0);
        assertThat(c.enableConsistencyGate()).isFalse();
        assertThat(c.maxLlmRetries()).isZero();
        assertThat(c.responseBlockThresholdPct()).isEqualTo(base.responseBlockThresholdPct());
        assertThat(base.flagThresholdPct()).isEqualTo(25.0);
    }

    @Test
    void null_or_empty_overrides_return_same_values() {
        PipelineConfig base = PipelineConfig.defaults();

        assertThat(base.withOverrides(null)).isSameAs(base);
        assertThat(base.withOverrides(PipelineConfigOverrides.none())).isEqualTo(base);
        assertThat(base.withOverrides(new PipelineConfigOverrides(Double.NaN, null, null, null, null, null, null, null))
                .flagThresholdPct()).isEqualTo(25.0);
    }

    @Test
    void block_below_flag_is_rejected() {
        PipelineConfig base = PipelineConfig.defaults();

        assertThatThrownBy(() -> base.withOverrides(new PipelineConfigOverrides(60.0, null, null, null, null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("CONSISTENCY_THRESHOLDS_INVALID");
        assertThatThrownBy(() -> base.withOverrides(new PipelineConfigOverrides(null, null, 120.0, null, null, null, null, null)))
                .hasMessage("RESPONSE_BLOCK_THRESHOLD_INVALID");
        assertThatThrownBy(() -> base.withOverrides(new PipelineConfigOverrides(null, null, null, null, null, -1, null, null)))
                .hasMessage("MAX_LLM_RETRIES_INVALID");
    }

    @Test
    void non_positive_timeout_falls_back_to_default() {
        PipelineProperties p = new PipelineProperties();
        p.setNutritionTimeout(Duration.ZERO);

        assertThat(p.toConfig().nutritionTimeout()).isEqualTo(Duration.ofSeconds(7));
    }
}
