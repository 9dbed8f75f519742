package com.deepansh.trader.state;

import com.deepansh.trader.config.AgentProperties;
import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.model.PortfolioMetrics;
import com.deepansh.trader.model.TradingMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/** First-run state, seeded from configuration. */
@Component
@RequiredArgsConstructor
public class AgentStateFactory {

    private final AgentProperties props;
    private final Clock clock;

    public AgentState createInitial() {
        return AgentState.builder()
                .walletBalanceSol(props.getInitialBalanceSol())
                .portfolioMetrics(PortfolioMetrics.builder()
                        .totalPortfolioValueSol(props.getInitialBalanceSol())
                        .cashAllocationPct(props.getInitialBalanceSol() > 0 ? 100.0 : 0.0)
                        .build())
                .tradingMode(TradingMode.fromDryRunFlag(props.isDryRun()))
                .aiStrategy(props.getAiStrategy())
                .cyclesCompleted(0)
                .stateHealthy(true)
                .lastUpdateTimestamp(clock.instant())
                .build();
    }
}
