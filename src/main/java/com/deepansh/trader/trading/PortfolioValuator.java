package com.deepansh.trader.trading;

import com.deepansh.trader.exception.DataSourceException;
import com.deepansh.trader.market.DexScreenerClient;
import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.model.PortfolioMetrics;
import com.deepansh.trader.model.Position;
import com.deepansh.trader.model.TokenSnapshot;
import com.deepansh.trader.model.TradingMode;
import com.deepansh.trader.solana.RpcException;
import com.deepansh.trader.solana.SolanaRpcClient;
import com.deepansh.trader.solana.SolanaWallet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Mark-to-market of open positions and recomputation of the derived metrics.
 *
 * Prices come from DexScreener in one batch call; a position whose price cannot
 * be fetched keeps its last value. The wallet balance is re-read on-chain only
 * in live mode; a dry-run state keeps its configured balance.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PortfolioValuator {

    private static final double LAMPORTS_PER_SOL = 1_000_000_000d;

    private final DexScreenerClient dexScreener;
    private final SolanaRpcClient rpcClient;
    private final SolanaWallet wallet;
    private final Clock clock;

    public void revalue(AgentState state) {
        if (state.getTradingMode() == TradingMode.LIVE) {
            refreshWalletBalance(state);
        }
        refreshPrices(state.getActivePositions());
        recomputeMetrics(state);
    }

    /** Reads the on-chain balance and writes it into the state. Empty if no wallet or the RPC failed. */
    public Optional<Double> refreshWalletBalance(AgentState state) {
        Optional<Double> balance = fetchWalletBalance();
        balance.ifPresent(state::setWalletBalanceSol);
        return balance;
    }

    public Optional<Double> fetchWalletBalance() {
        Optional<String> publicKey = wallet.getPublicKey();
        if (publicKey.isEmpty()) return Optional.empty();
        try {
            return Optional.of(rpcClient.getBalanceLamports(publicKey.get()) / LAMPORTS_PER_SOL);
        } catch (RpcException e) {
            log.warn("Wallet balance refresh failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public void recomputeMetrics(AgentState state) {
        PortfolioMetrics metrics = state.getPortfolioMetrics() != null
                ? state.getPortfolioMetrics()
                : new PortfolioMetrics();

        double realValue = 0, simulatedValue = 0, unrealized = 0;
        for (Position p : state.getActivePositions()) {
            if (p.isSimulated()) {
                simulatedValue += p.getCurrentValueSol();
            } else {
                realValue += p.getCurrentValueSol();
                unrealized += p.getUnrealizedPnlSol();
            }
        }

        double total = state.getWalletBalanceSol() + realValue;
        metrics.setTotalPositionValueSol(realValue);
        metrics.setSimulatedPositionValueSol(simulatedValue);
        metrics.setTotalPortfolioValueSol(total);
        metrics.setUnrealizedProfitSol(unrealized);
        metrics.setCashAllocationPct(total > 0 ? state.getWalletBalanceSol() / total * 100.0 : 0.0);
        metrics.setUpdatedAt(clock.instant());
        state.setPortfolioMetrics(metrics);
    }

    private void refreshPrices(List<Position> positions) {
        if (positions.isEmpty()) return;

        List<String> addresses = positions.stream().map(Position::getTokenAddress).distinct().toList();
        Map<String, TokenSnapshot> snapshots;
        try {
            snapshots = dexScreener.getTokenSnapshots(addresses).stream()
                    .collect(Collectors.toMap(TokenSnapshot::getTokenAddress, Function.identity(), (a, b) -> a));
        } catch (DataSourceException e) {
            log.warn("Price refresh failed, keeping last marks: {}", e.getMessage());
            return;
        }

        for (Position p : positions) {
            TokenSnapshot snapshot = snapshots.get(p.getTokenAddress());
            if (snapshot == null || snapshot.getPriceUsd() == null) continue;
            mark(p, snapshot.getPriceUsd());
        }
    }

    static void mark(Position p, double priceUsd) {
        p.setCurrentPriceUsd(priceUsd);
        if (p.getEntryPriceUsd() <= 0) {
            // Entry price unknown: adopt the first observed price as the baseline
            p.setEntryPriceUsd(priceUsd);
        }
        double ratio = priceUsd / p.getEntryPriceUsd();
        p.setCurrentValueSol(p.getAmountSol() * ratio);
        p.setUnrealizedPnlSol(p.getCurrentValueSol() - p.getAmountSol());
        p.setCurrentProfitPercentage((ratio - 1) * 100.0);
    }
}
