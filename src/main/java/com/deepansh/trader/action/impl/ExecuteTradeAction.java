package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.ExecuteTradeInput;
import com.deepansh.trader.exception.DataSourceException;
import com.deepansh.trader.market.DexScreenerClient;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.model.Position;
import com.deepansh.trader.model.TradeDirection;
import com.deepansh.trader.model.TradeRecord;
import com.deepansh.trader.solana.SubmissionResult;
import com.deepansh.trader.trading.LiveTradeExecutor;
import com.deepansh.trader.trading.PositionLedger;
import com.deepansh.trader.trading.TradeRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The only action that can move funds.
 *
 * Gate, in order:
 * 1. dryRun absent or true → simulate: no network mutation, a simulated position is recorded
 * 2. dryRun false while the agent is in dry_run mode → refused
 * 3. dryRun false without quoteData → refused
 * 4. otherwise → Jupiter swap, sign, submit, record
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ExecuteTradeAction implements TradingAction<ExecuteTradeInput> {

    public static final String SIMULATED_TRANSACTION_ID = "dry_run_simulation";
    public static final String SIMULATED_STATUS = "simulated_success";

    private final PositionLedger ledger;
    private final LiveTradeExecutor liveExecutor;
    private final DexScreenerClient dexScreener;

    @Override
    public ActionType getType() {
        return ActionType.EXECUTE_TRADE;
    }

    @Override
    public String getDescription() {
        return """
                Execute a buy or sell. Get a quote with get_swap_quote first and pass it as quoteData.
                dryRun defaults to true and simulates the trade without touching funds.
                dryRun=false submits a real transaction and is refused while the agent is in dry_run mode.
                """;
    }

    @Override
    public Class<ExecuteTradeInput> getInputType() {
        return ExecuteTradeInput.class;
    }

    @Override
    public ActionResult execute(ExecuteTradeInput input, ActionContext context) {
        if (input.effectiveDryRun()) {
            return simulate(input, context.getState());
        }

        if (context.getTradingMode().isDryRun()) {
            log.warn("Live trade refused in dry_run mode [token={}, type={}]",
                    input.tokenAddress(), input.tradeType().wireName());
            return ActionResult.failure("Live execution refused: the agent is running in dry_run mode. "
                    + "Call execute_trade with dryRun=true");
        }

        if (!input.hasQuote()) {
            return ActionResult.failure("No quote data provided: call get_swap_quote and pass its quote as quoteData");
        }

        return executeLive(input, context.getState());
    }

    private ActionResult simulate(ExecuteTradeInput input, AgentState state) {
        TradeRequest request = toRequest(input, true);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("dry_run", true);
        payload.put("simulated", true);
        payload.put("message", String.format("Dry run: %s %s SOL of %s",
                input.tradeType().wireName(), plain(input.amountSol()), label(input)));
        payload.put("trade_type", input.tradeType().wireName());
        payload.put("token_address", input.tokenAddress());
        payload.put("amount_sol", input.amountSol());
        payload.put("reasoning", input.reasoning());
        payload.put("quote", input.quoteData());
        payload.put("simulated_result", Map.of(
                "transaction_id", SIMULATED_TRANSACTION_ID,
                "status", SIMULATED_STATUS));

        if (input.tradeType() == TradeDirection.BUY) {
            Position position = ledger.recordBuy(state, request, currentPrice(input.tokenAddress()), null, SIMULATED_STATUS);
            payload.put("position", position);
        } else {
            TradeRecord record = ledger.recordSell(state, request, null, SIMULATED_STATUS);
            payload.put("realized_pnl_sol", record.getRealizedPnlSol());
        }

        log.info("Simulated {} of {} SOL [token={}]", input.tradeType().wireName(), input.amountSol(), label(input));
        return ActionResult.ok(payload);
    }

    private ActionResult executeLive(ExecuteTradeInput input, AgentState state) {
        log.warn("LIVE {} of {} SOL [token={}]", input.tradeType().wireName(), input.amountSol(), label(input));

        SubmissionResult result = liveExecutor.execute(input.quoteData());
        if (!result.isSuccess()) {
            log.error("Live trade failed [token={}, attempts={}]: {}",
                    input.tokenAddress(), result.getAttempts(), result.getError());
            return ActionResult.failure(result.getError());
        }

        TradeRequest request = toRequest(input, false);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("dry_run", false);
        payload.put("simulated", false);
        payload.put("trade_type", input.tradeType().wireName());
        payload.put("token_address", input.tokenAddress());
        payload.put("amount_sol", input.amountSol());
        payload.put("signature", result.getSignature());
        payload.put("confirmation_status", result.getConfirmationStatus());
        payload.put("attempts", result.getAttempts());
        payload.put("endpoint", result.getEndpoint());
        if (result.getWarning() != null) {
            payload.put("warning", result.getWarning());
        }
        payload.put("reasoning", input.reasoning());

        if (input.tradeType() == TradeDirection.BUY) {
            payload.put("position", ledger.recordBuy(state, request, currentPrice(input.tokenAddress()),
                    result.getSignature(), result.getConfirmationStatus()));
        } else {
            TradeRecord record = ledger.recordSell(state, request, result.getSignature(), result.getConfirmationStatus());
            payload.put("realized_pnl_sol", record.getRealizedPnlSol());
        }
        return ActionResult.ok(payload);
    }

    private Double currentPrice(String tokenAddress) {
        try {
            return dexScreener.getPriceUsd(tokenAddress).orElse(null);
        } catch (DataSourceException e) {
            log.warn("Entry price unavailable [token={}]: {}", tokenAddress, e.getMessage());
            return null;
        }
    }

    private static TradeRequest toRequest(ExecuteTradeInput input, boolean simulated) {
        return new TradeRequest(input.tokenAddress(), input.tokenSymbol(), input.amountSol(), simulated, input.reasoning());
    }

    private static String label(ExecuteTradeInput input) {
        return input.tokenSymbol() != null && !input.tokenSymbol().isBlank() ? input.tokenSymbol() : input.tokenAddress();
    }

    private static String plain(double amount) {
        return BigDecimal.valueOf(amount).stripTrailingZeros().toPlainString();
    }
}
