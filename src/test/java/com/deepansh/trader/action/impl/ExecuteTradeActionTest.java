package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.input.ExecuteTradeInput;
import com.deepansh.trader.config.AgentProperties;
import com.deepansh.trader.exception.DataSourceException;
import com.deepansh.trader.market.DexScreenerClient;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.model.Position;
import com.deepansh.trader.model.TradeDirection;
import com.deepansh.trader.model.TradingMode;
import com.deepansh.trader.solana.SubmissionResult;
import com.deepansh.trader.trading.LiveTradeExecutor;
import com.deepansh.trader.trading.PositionLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecuteTradeActionTest {

    private static final Map<String, Object> QUOTE = Map.of("inAmount", "100000000", "outAmount", "5000");

    @Mock LiveTradeExecutor liveExecutor;
    @Mock DexScreenerClient dexScreener;

    private ExecuteTradeAction action;
    private AgentState state;

    @BeforeEach
    void setUp() {
        action = new ExecuteTradeAction(new PositionLedger(new AgentProperties(), Clock.systemUTC()),
                liveExecutor, dexScreener);
        state = AgentState.builder().walletBalanceSol(1.0).tradingMode(TradingMode.DRY_RUN).build();
    }

    private ActionContext context() {
        return ActionContext.builder().state(state).sessionId("s").cycleNumber(1).build();
    }

    private static ExecuteTradeInput buy(Boolean dryRun, Map<String, Object> quote) {
        return new ExecuteTradeInput(TradeDirection.BUY, "Mint111", "BONK", 0.1, quote, dryRun, "strong momentum");
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_dryRunBuy_recordsSimulatedPositionWithoutTouchingBalance() {
        when(dexScreener.getPriceUsd("Mint111")).thenReturn(Optional.of(0.00002));

        ActionResult result = action.execute(buy(true, QUOTE), context());

        assertThat(result.isSuccess()).isTrue();
        Map<String, Object> payload = (Map<String, Object>) result.getPayload();
        assertThat(payload).containsEntry("dry_run", true).containsEntry("simulated", true);
        assertThat(payload.get("message")).isEqualTo("Dry run: buy 0.1 SOL of BONK");
        assertThat((Map<String, Object>) payload.get("simulated_result"))
                .containsEntry("transaction_id", ExecuteTradeAction.SIMULATED_TRANSACTION_ID)
                .containsEntry("status", ExecuteTradeAction.SIMULATED_STATUS);

        assertThat(state.getWalletBalanceSol()).isEqualTo(1.0);
        assertThat(state.getActivePositions()).singleElement().satisfies(p -> {
            assertThat(p.isSimulated()).isTrue();
            assertThat(p.getEntryPriceUsd()).isEqualTo(0.00002);
        });
        verify(liveExecutor, never()).execute(anyMap());
    }

    @Test
    void execute_dryRunOmitted_defaultsToSimulation() {
        when(dexScreener.getPriceUsd("Mint111")).thenThrow(new DataSourceException("dexscreener", "down"));

        ActionResult result = action.execute(buy(null, null), context());

        assertThat(result.isSuccess()).isTrue();
        assertThat(state.getActivePositions()).singleElement()
                .satisfies(p -> assertThat(p.getEntryPriceUsd()).isZero());
        verify(liveExecutor, never()).execute(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_dryRunSell_closesSimulatedPosition() {
        when(dexScreener.getPriceUsd("Mint111")).thenReturn(Optional.empty());
        action.execute(buy(true, null), context());

        ActionResult result = action.execute(
                new ExecuteTradeInput(TradeDirection.SELL, "Mint111", "BONK", 0.1, null, true, "exit"), context());

        assertThat(result.isSuccess()).isTrue();
        assertThat((Map<String, Object>) result.getPayload()).containsKey("realized_pnl_sol");
        assertThat(state.getActivePositions()).isEmpty();
        assertThat(state.getWalletBalanceSol()).isEqualTo(1.0);
    }

    @Test
    void execute_liveRequestInDryRunMode_isRefused() {
        ActionResult result = action.execute(buy(false, QUOTE), context());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("dry_run mode");
        assertThat(state.getActivePositions()).isEmpty();
        verify(liveExecutor, never()).execute(any());
    }

    @Test
    void execute_liveModeWithoutQuote_isRefused() {
        state.setTradingMode(TradingMode.LIVE);

        ActionResult result = action.execute(buy(false, null), context());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("No quote data provided");
        verify(liveExecutor, never()).execute(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_liveModeSuccess_recordsRealPositionAndDebitsBalance() {
        state.setTradingMode(TradingMode.LIVE);
        when(liveExecutor.execute(QUOTE)).thenReturn(SubmissionResult.builder()
                .success(true).signature("5sig").attempts(1).endpoint("https://rpc")
                .confirmationStatus(SubmissionResult.CONFIRMED).build());
        when(dexScreener.getPriceUsd("Mint111")).thenReturn(Optional.of(0.5));

        ActionResult result = action.execute(buy(false, QUOTE), context());

        assertThat(result.isSuccess()).isTrue();
        assertThat((Map<String, Object>) result.getPayload())
                .containsEntry("signature", "5sig")
                .containsEntry("confirmation_status", "confirmed");
        Position position = state.getActivePositions().get(0);
        assertThat(position.isSimulated()).isFalse();
        assertThat(position.getEntrySignature()).isEqualTo("5sig");
        assertThat(state.getWalletBalanceSol()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void execute_liveSubmissionFails_returnsErrorAndRecordsNothing() {
        state.setTradingMode(TradingMode.LIVE);
        when(liveExecutor.execute(QUOTE)).thenReturn(SubmissionResult.failure("Failed after 3 attempts: timeout", 3, "https://rpc"));

        ActionResult result = action.execute(buy(false, QUOTE), context());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("Failed after 3 attempts");
        assertThat(state.getActivePositions()).isEmpty();
        assertThat(state.getTransactionHistory()).isEmpty();
    }
}
