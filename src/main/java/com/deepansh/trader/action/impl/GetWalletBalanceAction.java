package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.EmptyInput;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.model.TradingMode;
import com.deepansh.trader.solana.SolanaWallet;
import com.deepansh.trader.trading.PortfolioValuator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * On-chain SOL balance of the configured wallet.
 * In live mode the fresh balance also replaces the one in the state.
 */
@Component
@RequiredArgsConstructor
public class GetWalletBalanceAction implements TradingAction<EmptyInput> {

    private final PortfolioValuator valuator;
    private final SolanaWallet wallet;

    @Override
    public ActionType getType() {
        return ActionType.GET_WALLET_BALANCE;
    }

    @Override
    public String getDescription() {
        return """
                Current SOL balance of the trading wallet, read from the Solana RPC.
                Without a configured wallet, returns the balance tracked in the agent state.
                """;
    }

    @Override
    public Class<EmptyInput> getInputType() {
        return EmptyInput.class;
    }

    @Override
    public ActionResult execute(EmptyInput input, ActionContext context) {
        AgentState state = context.getState();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("trading_mode", context.getTradingMode().wireName());

        if (!wallet.isConfigured()) {
            payload.put("wallet_configured", false);
            payload.put("balance_sol", state.getWalletBalanceSol());
            payload.put("source", "state");
            return ActionResult.ok(payload);
        }

        Optional<Double> balance = context.getTradingMode() == TradingMode.LIVE
                ? valuator.refreshWalletBalance(state)
                : valuator.fetchWalletBalance();
        if (balance.isEmpty()) {
            return ActionResult.failure("Could not read the wallet balance from the RPC endpoint");
        }

        payload.put("wallet_configured", true);
        payload.put("wallet_address", wallet.getPublicKey().orElse(null));
        payload.put("balance_sol", balance.get());
        payload.put("state_balance_sol", state.getWalletBalanceSol());
        payload.put("source", "rpc");
        return ActionResult.ok(payload);
    }
}
