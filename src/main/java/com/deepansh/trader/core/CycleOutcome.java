package com.deepansh.trader.core;

import com.deepansh.trader.model.AgentState;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of one cycle. The state is always present and already persisted
 * (or carries a state_persistence_failure error); failure is a value here,
 * never an exception.
 */
@Data
@Builder
public class CycleOutcome {

    public enum Status { COMPLETED, FAILED }

    private AgentState state;
    private Status status;
    private long cycleNumber;
    private List<String> invokedActions;
    private String rationale;
    private int iterations;
    private boolean stepBudgetExhausted;
    private long latencyMs;

    /** Phase tag of the failure, null on success */
    private String errorType;
    private String error;

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /** The oracle invoked nothing this cycle */
    public boolean isIdle() {
        return invokedActions == null || invokedActions.isEmpty();
    }
}
