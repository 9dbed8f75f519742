package com.deepansh.trader.market;

import com.deepansh.trader.action.input.FilterTokensInput;
import com.deepansh.trader.model.TokenSnapshot;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Mechanical filtering and sorting over token snapshots. No judgment lives here.
 *
 * A token missing the metric an active bound checks is dropped: unknown liquidity
 * cannot satisfy "liquidity >= X". When sorting, tokens missing the metric go last
 * in either direction.
 */
public final class TokenFilters {

    private static final Map<String, Function<TokenSnapshot, Double>> METRICS = Map.ofEntries(
            Map.entry("liquidityUsd", TokenSnapshot::getLiquidityUsd),
            Map.entry("volume24h", TokenSnapshot::getVolume24h),
            Map.entry("marketCap", TokenSnapshot::effectiveMarketCap),
            Map.entry("fdv", TokenSnapshot::getFdv),
            Map.entry("priceUsd", TokenSnapshot::getPriceUsd),
            Map.entry("priceChange1h", TokenSnapshot::getPriceChange1h),
            Map.entry("priceChange24h", TokenSnapshot::getPriceChange24h),
            Map.entry("pairCreatedAt", t -> t.getPairCreatedAt() != null ? t.getPairCreatedAt().doubleValue() : null),
            Map.entry("boostAmount", TokenSnapshot::getBoostAmount),
            Map.entry("buys24h", t -> t.getBuys24h() != null ? t.getBuys24h().doubleValue() : null),
            Map.entry("sells24h", t -> t.getSells24h() != null ? t.getSells24h().doubleValue() : null)
    );

    private TokenFilters() {}

    public static List<TokenSnapshot> filter(List<TokenSnapshot> tokens, FilterTokensInput criteria, Instant now) {
        return tokens.stream()
                .filter(t -> atMost(t.ageHours(now), criteria.maxAgeHours()))
                .filter(t -> atLeast(t.getLiquidityUsd(), criteria.minLiquidityUsd()))
                .filter(t -> atMost(t.getLiquidityUsd(), criteria.maxLiquidityUsd()))
                .filter(t -> atLeast(t.getVolume24h(), criteria.minVolume24h()))
                .filter(t -> atLeast(t.effectiveMarketCap(), criteria.minMarketCap()))
                .filter(t -> atMost(t.effectiveMarketCap(), criteria.maxMarketCap()))
                .filter(t -> atLeast(t.getPriceChange24h(), criteria.minPriceChange24h()))
                .filter(t -> atMost(t.getPriceChange24h(), criteria.maxPriceChange24h()))
                .collect(Collectors.toList());
    }

    /**
     * @throws IllegalArgumentException if the metric is not one of {@link #sortableMetrics()}
     */
    public static List<TokenSnapshot> sort(List<TokenSnapshot> tokens, String metric, boolean descending) {
        Function<TokenSnapshot, Double> extractor = METRICS.get(metric);
        if (extractor == null) {
            throw new IllegalArgumentException("Unknown sort metric '" + metric
                    + "'. Supported: " + sortableMetrics());
        }

        Comparator<Double> order = descending ? Comparator.reverseOrder() : Comparator.naturalOrder();
        return tokens.stream()
                .sorted(Comparator.comparing(extractor, Comparator.nullsLast(order)))
                .collect(Collectors.toList());
    }

    public static List<String> sortableMetrics() {
        return METRICS.keySet().stream().sorted().toList();
    }

    private static boolean atLeast(Double value, Double bound) {
        if (bound == null) return true;
        return value != null && value >= bound;
    }

    private static boolean atMost(Double value, Double bound) {
        if (bound == null) return true;
        return value != null && value <= bound;
    }
}
