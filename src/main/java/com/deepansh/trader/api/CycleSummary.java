package com.deepansh.trader.api;

import com.deepansh.trader.core.CycleOutcome;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/** What a foreground cycle returns over HTTP; the full state stays on disk. */
@Data
@Builder
public class CycleSummary {

    private String status;
    private long cycleNumber;
    private List<String> invokedActions;
    private String rationale;
    private int iterations;
    private boolean stepBudgetExhausted;
    private long latencyMs;
    private String tradingMode;
    private double walletBalanceSol;
    private int positionCount;
    private String errorType;
    private String error;

    public static CycleSummary from(CycleOutcome outcome) {
        return CycleSummary.builder()
                .status(outcome.getStatus().name())
                .cycleNumber(outcome.getCycleNumber())
                .invokedActions(outcome.getInvokedActions())
                .rationale(outcome.getRationale())
                .iterations(outcome.getIterations())
                .stepBudgetExhausted(outcome.isStepBudgetExhausted())
                .latencyMs(outcome.getLatencyMs())
                .tradingMode(outcome.getState().getTradingMode().wireName())
                .walletBalanceSol(outcome.getState().getWalletBalanceSol())
                .positionCount(outcome.getState().positionCount())
                .errorType(outcome.getErrorType())
                .error(outcome.getError())
                .build();
    }
}
