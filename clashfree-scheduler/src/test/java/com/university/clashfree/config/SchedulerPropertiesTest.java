package com.university.clashfree.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulerPropertiesTest {

    @Test
    void defaultsMatchTheSolverDefaults() {
        SolverConfig config = new SchedulerProperties().toSolverConfig();

        assertThat(config.getSeed()).isEqualTo(42L);
        assertThat(config.getTimeBudget()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getMoveBudget()).isEqualTo(2_000);
        assertThat(config.getWeights()).isEqualTo(SoftWeights.defaults());
        assertThat(config.getInvigilationPolicy()).isEqualTo(InvigilationPolicy.EXCLUSION_FIRST);
        assertThat(config.isInstructorExclusionHard()).isTrue();
    }

    @Test
    void carriesOverridesIntoTheSolverConfig() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.setSeed(9);
        properties.setWeights(Map.of(SoftWeights.PREFERENCE, 5.0));
        properties.setSeatingRule(SeatingRule.NO_SAME_SECTION_BENCHMATES);
        properties.setInvigilationPolicy(InvigilationPolicy.MINIMUM_FIRST);

        SolverConfig config = properties.toSolverConfig();

        assertThat(config.getSeed()).isEqualTo(9L);
        assertThat(config.getWeights().get(SoftWeights.PREFERENCE)).isEqualTo(5.0);
        assertThat(config.getSeatingRule()).isEqualTo(SeatingRule.NO_SAME_SECTION_BENCHMATES);
        assertThat(config.isInstructorExclusionHard()).isFalse();
    }

    @Test
    void invalidSettingsFailWhenConverted() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.setMinInvigilatorsPerRoom(0);

        assertThatThrownBy(properties::toSolverConfig).isInstanceOf(IllegalArgumentException.class);
    }
}
