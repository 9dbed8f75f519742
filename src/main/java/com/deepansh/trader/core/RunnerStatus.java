package com.deepansh.trader.core;

import com.deepansh.trader.model.AgentState;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Read-only snapshot for the status consumer. Building one never touches the state. */
@Data
@Builder
public class RunnerStatus {

    private boolean running;
    private boolean workerAlive;
    private String sessionId;

    /** error, initialized, idle, trading or active */
    private String status;

    private long cyclesCompleted;
    private long sessionCycles;
    private int consecutiveErrors;
    private double walletBalanceSol;
    private int positionCount;
    private List<String> lastInvokedActions;
    private boolean stateHealthy;
    private String tradingMode;
    private String currentError;
    private Instant errorTimestamp;
    private Instant lastUpdate;
    private Instant sessionStart;

    static RunnerStatus of(AgentState state, RunnerSession session) {
        boolean running = session != null && !session.isStopRequested();
        return RunnerStatus.builder()
                .running(running)
                .workerAlive(session != null && session.isAlive())
                .sessionId(session != null ? session.getId() : state.getSessionId())
                .status(deriveStatus(state, running))
                .cyclesCompleted(state.getCyclesCompleted())
                .sessionCycles(session != null ? session.getSessionCycles() : 0)
                .consecutiveErrors(session != null ? session.getConsecutiveErrors() : 0)
                .walletBalanceSol(state.getWalletBalanceSol())
                .positionCount(state.positionCount())
                .lastInvokedActions(state.getLastInvokedActions() != null
                        ? new ArrayList<>(state.getLastInvokedActions())
                        : List.of())
                .stateHealthy(state.isStateHealthy() && !state.hasError())
                .tradingMode(state.getTradingMode() != null ? state.getTradingMode().wireName() : null)
                .currentError(state.getError())
                .errorTimestamp(state.getErrorTimestamp())
                .lastUpdate(state.getLastUpdateTimestamp())
                .sessionStart(session != null ? session.getStartedAt() : state.getSessionStartTimestamp())
                .build();
    }

    static String deriveStatus(AgentState state, boolean running) {
        if (state.hasError()) return "error";
        if (!running) return state.getCyclesCompleted() == 0 ? "initialized" : "idle";
        return state.positionCount() > 0 ? "trading" : "active";
    }
}
