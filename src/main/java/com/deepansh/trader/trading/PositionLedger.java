package com.deepansh.trader.trading;

import com.deepansh.trader.config.AgentProperties;
import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.model.PortfolioMetrics;
import com.deepansh.trader.model.Position;
import com.deepansh.trader.model.TradeDirection;
import com.deepansh.trader.model.TradeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The only writer of positions and trade history.
 *
 * Real and simulated holdings of the same token are separate positions. Simulated
 * trades never move the wallet balance; live ones adjust it locally until the next
 * on-chain balance refresh overwrites it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PositionLedger {

    private final AgentProperties props;
    private final Clock clock;

    /**
     * Opens a position, or adds to an existing one of the same kind with the
     * entry price averaged by SOL committed.
     */
    public Position recordBuy(AgentState state, TradeRequest request, Double priceUsd,
                              String signature, String status) {
        Instant now = clock.instant();
        double price = priceUsd != null ? priceUsd : 0.0;

        Position position = find(state, request.tokenAddress(), request.simulated()).orElse(null);
        if (position == null) {
            position = Position.builder()
                    .tokenAddress(request.tokenAddress())
                    .tokenSymbol(request.tokenSymbol())
                    .entryPriceUsd(price)
                    .currentPriceUsd(price)
                    .amountSol(request.amountSol())
                    .currentValueSol(request.amountSol())
                    .openedAt(now)
                    .reason(request.reasoning())
                    .simulated(request.simulated())
                    .entrySignature(signature)
                    .build();
            state.getActivePositions().add(position);
        } else {
            double total = position.getAmountSol() + request.amountSol();
            if (price > 0 && position.getEntryPriceUsd() > 0) {
                position.setEntryPriceUsd((position.getEntryPriceUsd() * position.getAmountSol()
                        + price * request.amountSol()) / total);
            }
            position.setAmountSol(total);
            position.setCurrentValueSol(position.getCurrentValueSol() + request.amountSol());
        }

        if (!request.simulated()) {
            state.setWalletBalanceSol(Math.max(0.0, state.getWalletBalanceSol() - request.amountSol()));
        }

        appendHistory(state, TradeRecord.builder()
                .tradeType(TradeDirection.BUY)
                .tokenAddress(request.tokenAddress())
                .tokenSymbol(request.tokenSymbol())
                .amountSol(request.amountSol())
                .simulated(request.simulated())
                .signature(signature)
                .status(status)
                .reasoning(request.reasoning())
                .timestamp(now)
                .build());

        log.info("Position opened/increased [token={}, amountSol={}, simulated={}]",
                request.tokenSymbol() != null ? request.tokenSymbol() : request.tokenAddress(),
                position.getAmountSol(), request.simulated());
        return position;
    }

    /**
     * Reduces the matching position by the sold SOL amount; a sale covering the
     * whole size closes it and books realized P&L into the metrics.
     * Without a matching position the trade is still recorded.
     */
    public TradeRecord recordSell(AgentState state, TradeRequest request, String signature, String status) {
        Instant now = clock.instant();
        Double realized = null;

        Optional<Position> match = find(state, request.tokenAddress(), request.simulated());
        if (match.isPresent()) {
            Position position = match.get();
            double fraction = position.getAmountSol() > 0
                    ? Math.min(request.amountSol() / position.getAmountSol(), 1.0)
                    : 1.0;
            double proceeds = position.getCurrentValueSol() * fraction;
            realized = position.getUnrealizedPnlSol() * fraction;

            if (fraction >= 1.0) {
                state.getActivePositions().remove(position);
                bookClosedTrade(state, realized);
                log.info("Position closed [token={}, realizedPnlSol={}, simulated={}]",
                        position.getTokenSymbol(), realized, request.simulated());
            } else {
                position.setAmountSol(position.getAmountSol() * (1 - fraction));
                position.setCurrentValueSol(position.getCurrentValueSol() * (1 - fraction));
                position.setUnrealizedPnlSol(position.getUnrealizedPnlSol() * (1 - fraction));
                addRealized(state, realized);
                log.info("Position reduced [token={}, remainingSol={}, simulated={}]",
                        position.getTokenSymbol(), position.getAmountSol(), request.simulated());
            }

            if (!request.simulated()) {
                state.setWalletBalanceSol(state.getWalletBalanceSol() + proceeds);
            }
        } else {
            log.warn("Sell recorded without a matching position [token={}, simulated={}]",
                    request.tokenAddress(), request.simulated());
        }

        TradeRecord record = TradeRecord.builder()
                .tradeType(TradeDirection.SELL)
                .tokenAddress(request.tokenAddress())
                .tokenSymbol(request.tokenSymbol())
                .amountSol(request.amountSol())
                .simulated(request.simulated())
                .signature(signature)
                .status(status)
                .realizedPnlSol(realized)
                .reasoning(request.reasoning())
                .timestamp(now)
                .build();
        appendHistory(state, record);
        return record;
    }

    public Optional<Position> find(AgentState state, String tokenAddress, boolean simulated) {
        return state.getActivePositions().stream()
                .filter(p -> p.getTokenAddress().equals(tokenAddress) && p.isSimulated() == simulated)
                .findFirst();
    }

    private void bookClosedTrade(AgentState state, double realized) {
        PortfolioMetrics metrics = metricsOf(state);
        metrics.setTotalTrades(metrics.getTotalTrades() + 1);
        if (realized > 0) metrics.setWinningTrades(metrics.getWinningTrades() + 1);
        metrics.setWinRate(metrics.getWinningTrades() * 100.0 / metrics.getTotalTrades());
        addRealized(state, realized);
    }

    private void addRealized(AgentState state, double realized) {
        PortfolioMetrics metrics = metricsOf(state);
        metrics.setRealizedProfitSol(metrics.getRealizedProfitSol() + realized);
    }

    private PortfolioMetrics metricsOf(AgentState state) {
        if (state.getPortfolioMetrics() == null) {
            state.setPortfolioMetrics(new PortfolioMetrics());
        }
        return state.getPortfolioMetrics();
    }

    private void appendHistory(AgentState state, TradeRecord record) {
        List<TradeRecord> history = state.getTransactionHistory();
        history.add(record);
        int overflow = history.size() - props.getMaxTransactionHistory();
        if (overflow > 0) {
            history.subList(0, overflow).clear();
        }
    }
}
