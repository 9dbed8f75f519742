package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.EmptyInput;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.model.TradeRecord;
import com.deepansh.trader.trading.PortfolioValuator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class GetPortfolioSummaryAction implements TradingAction<EmptyInput> {

    private static final int RECENT_TRADES = 10;

    private final PortfolioValuator valuator;

    @Override
    public ActionType getType() {
        return ActionType.GET_PORTFOLIO_SUMMARY;
    }

    @Override
    public String getDescription() {
        return """
                Portfolio overview from the agent state: wallet balance, open positions with
                entry/current price and P&L, portfolio metrics and the most recent trades.
                Simulated (dry-run) positions are flagged and valued separately.
                """;
    }

    @Override
    public Class<EmptyInput> getInputType() {
        return EmptyInput.class;
    }

    @Override
    public ActionResult execute(EmptyInput input, ActionContext context) {
        AgentState state = context.getState();
        // Positions may have changed since the cycle started
        valuator.recomputeMetrics(state);

        List<TradeRecord> history = state.getTransactionHistory();
        List<TradeRecord> recent = history.subList(Math.max(0, history.size() - RECENT_TRADES), history.size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("wallet_balance_sol", state.getWalletBalanceSol());
        payload.put("trading_mode", context.getTradingMode().wireName());
        payload.put("position_count", state.positionCount());
        payload.put("positions", List.copyOf(state.getActivePositions()));
        payload.put("portfolio_metrics", state.getPortfolioMetrics());
        payload.put("recent_trades", List.copyOf(recent));
        payload.put("cycles_completed", state.getCyclesCompleted());
        return ActionResult.ok(payload);
    }
}
