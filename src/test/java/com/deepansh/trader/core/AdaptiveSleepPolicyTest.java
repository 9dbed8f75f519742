package com.deepansh.trader.core;

import com.deepansh.trader.config.AgentProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AdaptiveSleepPolicyTest {

    private final AgentProperties props = new AgentProperties();
    private final AdaptiveSleepPolicy policy = new AdaptiveSleepPolicy(props);

    @Test
    void nextDelay_healthyCycle_usesConfiguredBase() {
        assertThat(policy.nextDelay(Map.of(), false, false)).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    void nextDelay_sessionParameterOverridesBase() {
        assertThat(policy.nextDelay(Map.of("cycle_time_seconds", 120), false, false))
                .isEqualTo(Duration.ofSeconds(120));
        assertThat(policy.nextDelay(Map.of("cycle_time_seconds", "90"), false, false))
                .isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void nextDelay_invalidParameter_fallsBackToConfiguredBase() {
        assertThat(policy.nextDelay(Map.of("cycle_time_seconds", -5), false, false))
                .isEqualTo(Duration.ofSeconds(300));
        assertThat(policy.nextDelay(Map.of("cycle_time_seconds", "soon"), false, false))
                .isEqualTo(Duration.ofSeconds(300));
        assertThat(policy.nextDelay(Map.of("cycle_time_seconds", "99999999999999999999"), false, false))
                .isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    void nextDelay_erroredCycle_appliesErrorFloor() {
        assertThat(policy.nextDelay(Map.of("cycle_time_seconds", 60), true, false))
                .isEqualTo(Duration.ofSeconds(600));
    }

    @Test
    void nextDelay_idleCycle_appliesIdleFloor() {
        assertThat(policy.nextDelay(Map.of("cycle_time_seconds", 60), false, true))
                .isEqualTo(Duration.ofSeconds(450));
    }

    @Test
    void nextDelay_baseAboveFloor_isKept() {
        assertThat(policy.nextDelay(Map.of("cycle_time_seconds", 900), true, true))
                .isEqualTo(Duration.ofSeconds(900));
    }

    @Test
    void nextDelay_nullParams_usesConfiguredBase() {
        assertThat(policy.nextDelay(null, false, false)).isEqualTo(Duration.ofSeconds(300));
    }
}
