package com.deepansh.trader.observability;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Telemetry gathered while one trading cycle runs: oracle token usage and
 * every dispatched action with its latency and outcome. Flushed into a
 * {@link CycleTrace} once the cycle has its outcome.
 */
public class RunContext {

    private final long startedNanos = System.nanoTime();
    private final List<ActionRecord> actionRecords = new ArrayList<>();

    @Getter
    private int promptTokens;
    @Getter
    private int completionTokens;
    @Getter
    private int oracleCalls;

    public void addTokens(int prompt, int completion) {
        promptTokens += prompt;
        completionTokens += completion;
        oracleCalls++;
    }

    public void recordAction(String actionName, Object args, long latencyMs, boolean success, String observation) {
        actionRecords.add(new ActionRecord(actionName, args, latencyMs, success, observation));
    }

    public List<ActionRecord> getActionRecords() {
        return Collections.unmodifiableList(actionRecords);
    }

    public long failedActions() {
        return actionRecords.stream().filter(r -> !r.success()).count();
    }

    public long elapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    public record ActionRecord(String actionName, Object args, long latencyMs, boolean success, String observation) {}
}
