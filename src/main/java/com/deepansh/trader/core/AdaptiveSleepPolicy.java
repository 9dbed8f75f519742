package com.deepansh.trader.core;

import com.deepansh.trader.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Pause between background cycles. The base comes from the session's
 * cycle_time_seconds parameter (or configuration); a failed cycle or one where
 * the oracle invoked nothing stretches it to a higher floor.
 */
@Component
@RequiredArgsConstructor
public class AdaptiveSleepPolicy {

    public static final String CYCLE_TIME_PARAM = "cycle_time_seconds";

    private final AgentProperties props;

    public Duration nextDelay(Map<String, Object> params, boolean errored, boolean idle) {
        long base = baseSeconds(params);
        AgentProperties.Runner runner = props.getRunner();

        if (errored) return Duration.ofSeconds(Math.max(base, runner.getErrorFloorSeconds()));
        if (idle) return Duration.ofSeconds(Math.max(base, runner.getIdleFloorSeconds()));
        return Duration.ofSeconds(base);
    }

    long baseSeconds(Map<String, Object> params) {
        Object value = params != null ? params.get(CYCLE_TIME_PARAM) : null;
        Long seconds = Params.positiveLong(value);
        return seconds != null ? seconds : props.getRunner().getCycleTimeSeconds();
    }
}
