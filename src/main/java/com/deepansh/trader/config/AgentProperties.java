package com.deepansh.trader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Strongly-typed configuration for the cycle orchestrator and background runner.
 * Bound from application.yml under the "agent" prefix.
 *
 * {@code dryRun} is the one top-level switch for real monetary side effects.
 * It seeds the trading mode of a freshly created state; afterwards the mode
 * only changes through an explicit "dry_run" cycle parameter.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private String stateFile = "agent_state.json";
    private boolean dryRun = true;
    private double initialBalanceSol = 0.0;
    private String aiStrategy = "discovery_and_analysis";

    /** Oracle round-trips allowed inside one cycle before it is cut off */
    private int maxIterations = 25;

    /** Action results fed back to the oracle are truncated to this many chars */
    private int maxObservationChars = 12000;

    /** Newest trade records kept in the state document */
    private int maxTransactionHistory = 200;

    private Runner runner = new Runner();
    private Cache cache = new Cache();

    @Data
    public static class Runner {
        private long cycleTimeSeconds = 300;
        private long errorFloorSeconds = 600;
        private long idleFloorSeconds = 450;
        private long cycleExceptionPauseSeconds = 60;
        private int maxConsecutiveErrors = 3;
        private long stopTimeoutSeconds = 15;
        private long sleepSliceMillis = 1000;

        public Duration getStopTimeout() {
            return Duration.ofSeconds(stopTimeoutSeconds);
        }

        public Duration getSleepSlice() {
            return Duration.ofMillis(sleepSliceMillis);
        }
    }

    @Data
    public static class Cache {
        private long sweepIntervalMs = 60000;
    }
}
