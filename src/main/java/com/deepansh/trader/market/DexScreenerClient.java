package com.deepansh.trader.market;

import com.deepansh.trader.cache.EphemeralCache;
import com.deepansh.trader.config.DataSourceProperties;
import com.deepansh.trader.exception.DataSourceException;
import com.deepansh.trader.model.TokenSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * DexScreener public API: boosted tokens, token profiles, search and pair data.
 *
 * Listing endpoints (boosts, profiles) only return addresses, so discovery is two
 * calls: the listing, then one batch lookup of up to 30 addresses via /tokens/v1.
 * Each token is reduced to its most liquid pair.
 *
 * Every response goes through the ephemeral cache with a per-endpoint TTL and
 * through {@link MarketDataGuard}: the "marketData" retry inside a per-source circuit breaker.
 */
@Component
@Slf4j
public class DexScreenerClient {

    public static final String SOURCE = "dexscreener";

    private final RestClient restClient;
    private final DataSourceProperties props;
    private final EphemeralCache cache;
    private final MarketDataGuard guard;
    private final Clock clock;
    private final SourceHealth health = new SourceHealth(SOURCE);

    public DexScreenerClient(RestClient.Builder restClientBuilder,
                             DataSourceProperties props,
                             EphemeralCache cache,
                             MarketDataGuard guard,
                             Clock clock) {
        this.props = props;
        this.cache = cache;
        this.clock = clock;
        this.guard = guard;
        this.restClient = restClientBuilder.clone()
                .baseUrl(props.getDexscreener().getBaseUrl())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    public List<TokenSnapshot> getBoostedTokensLatest() {
        return discoverFromListing("/token-boosts/latest/v1", "boosted_latest",
                props.getDexscreener().getBoostedTtl());
    }

    public List<TokenSnapshot> getBoostedTokensTop() {
        return discoverFromListing("/token-boosts/top/v1", "boosted_top",
                props.getDexscreener().getBoostedTtl());
    }

    public List<TokenSnapshot> getLatestTokenProfiles() {
        return discoverFromListing("/token-profiles/latest/v1", "profiles_latest",
                props.getDexscreener().getProfilesTtl());
    }

    public List<TokenSnapshot> searchTokens(String query, int limit) {
        JsonNode root = fetchJson("dexscreener:search:" + query.toLowerCase(),
                props.getDexscreener().getSearchTtl(),
                "/latest/dex/search?q={q}", query);

        List<JsonNode> pairs = new ArrayList<>();
        root.path("pairs").forEach(pairs::add);

        List<TokenSnapshot> tokens = bestPairPerToken(pairs).stream().limit(limit).toList();
        tokens.forEach(t -> t.setSource("custom_search:" + query));
        return tokens;
    }

    /** Batch lookup; addresses without a pair on the configured chain are simply absent */
    public List<TokenSnapshot> getTokenSnapshots(List<String> addresses) {
        if (addresses.isEmpty()) return List.of();

        int batchSize = props.getDexscreener().getMaxBatchSize();
        List<JsonNode> pairs = new ArrayList<>();
        for (int i = 0; i < addresses.size(); i += batchSize) {
            String joined = String.join(",", addresses.subList(i, Math.min(i + batchSize, addresses.size())));
            JsonNode batch = fetchJson("dexscreener:tokens:" + joined,
                    props.getDexscreener().getPairsTtl(),
                    "/tokens/v1/{chain}/{addresses}", props.getChainId(), joined);
            batch.forEach(pairs::add);
        }
        return bestPairPerToken(pairs);
    }

    public Optional<TokenSnapshot> getTokenSnapshot(String address) {
        return getTokenSnapshots(List.of(address)).stream().findFirst();
    }

    /**
     * Raw pair data for one token, for enrichment. Never throws.
     * Payload: {pairs: [...raw pairs], best_pair: snapshot, socials: [...], websites: [...]}.
     */
    public SourceData getTokenMarketData(String address) {
        try {
            JsonNode pairsNode = fetchJson("dexscreener:pairs:" + address,
                    props.getDexscreener().getPairsTtl(),
                    "/token-pairs/v1/{chain}/{address}", props.getChainId(), address);

            List<JsonNode> pairs = new ArrayList<>();
            pairsNode.forEach(pairs::add);
            if (pairs.isEmpty()) {
                return SourceData.unavailable(SOURCE, "No trading pairs found for " + address, clock.instant());
            }

            JsonNode best = pairs.stream()
                    .max(Comparator.comparingDouble(p -> nullToZero(JsonValues.doubleOrNull(p.path("liquidity").path("usd")))))
                    .orElseThrow();

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("best_pair", toSnapshot(best));
            payload.put("pair_count", pairs.size());
            payload.put("pairs", pairsNode);
            payload.put("socials", best.path("info").path("socials"));
            payload.put("websites", best.path("info").path("websites"));
            return SourceData.available(SOURCE, payload, clock.instant());

        } catch (DataSourceException e) {
            return SourceData.unavailable(SOURCE, e.getMessage(), clock.instant());
        }
    }

    public Optional<Double> getPriceUsd(String address) {
        try {
            return getTokenSnapshot(address).map(TokenSnapshot::getPriceUsd);
        } catch (DataSourceException e) {
            log.debug("Price lookup failed for {}: {}", address, e.getMessage());
            return Optional.empty();
        }
    }

    public SourceHealth getHealth() {
        return health;
    }

    // ─── Internals ──────────────────────────────────────────────────────────

    private List<TokenSnapshot> discoverFromListing(String path, String strategy, Duration ttl) {
        JsonNode listing = fetchJson("dexscreener:listing:" + path, ttl, path);

        Map<String, Double> boostByAddress = new LinkedHashMap<>();
        for (JsonNode entry : listing) {
            if (!props.getChainId().equals(entry.path("chainId").asText())) continue;
            String address = JsonValues.textOrNull(entry.path("tokenAddress"));
            if (address == null) continue;
            Double boost = JsonValues.doubleOrNull(entry.has("totalAmount") ? entry.path("totalAmount") : entry.path("amount"));
            boostByAddress.merge(address, nullToZero(boost), Double::sum);
        }

        List<String> addresses = boostByAddress.keySet().stream()
                .limit(props.getDexscreener().getMaxBatchSize())
                .toList();
        log.info("DexScreener {} listed {} {} tokens", strategy, addresses.size(), props.getChainId());

        List<TokenSnapshot> snapshots = getTokenSnapshots(addresses);
        snapshots.forEach(t -> {
            t.setSource(strategy);
            Double boost = boostByAddress.get(t.getTokenAddress());
            t.setBoostAmount(boost != null && boost > 0 ? boost : null);
        });

        // Keep listing order
        Map<String, Integer> rank = new LinkedHashMap<>();
        for (int i = 0; i < addresses.size(); i++) rank.put(addresses.get(i), i);
        return snapshots.stream()
                .sorted(Comparator.comparingInt(t -> rank.getOrDefault(t.getTokenAddress(), Integer.MAX_VALUE)))
                .collect(Collectors.toList());
    }

    private List<TokenSnapshot> bestPairPerToken(List<JsonNode> pairs) {
        Map<String, JsonNode> best = new LinkedHashMap<>();
        for (JsonNode pair : pairs) {
            if (!props.getChainId().equals(pair.path("chainId").asText())) continue;
            String address = JsonValues.textOrNull(pair.path("baseToken").path("address"));
            if (address == null) continue;
            best.merge(address, pair, (a, b) ->
                    liquidityOf(b) > liquidityOf(a) ? b : a);
        }
        return best.values().stream().map(this::toSnapshot).collect(Collectors.toList());
    }

    private TokenSnapshot toSnapshot(JsonNode pair) {
        return TokenSnapshot.builder()
                .tokenAddress(JsonValues.textOrNull(pair.path("baseToken").path("address")))
                .symbol(JsonValues.textOrNull(pair.path("baseToken").path("symbol")))
                .name(JsonValues.textOrNull(pair.path("baseToken").path("name")))
                .pairAddress(JsonValues.textOrNull(pair.path("pairAddress")))
                .dexId(JsonValues.textOrNull(pair.path("dexId")))
                .url(JsonValues.textOrNull(pair.path("url")))
                .priceUsd(JsonValues.doubleOrNull(pair.path("priceUsd")))
                .liquidityUsd(JsonValues.doubleOrNull(pair.path("liquidity").path("usd")))
                .volume24h(JsonValues.doubleOrNull(pair.path("volume").path("h24")))
                .priceChange1h(JsonValues.doubleOrNull(pair.path("priceChange").path("h1")))
                .priceChange24h(JsonValues.doubleOrNull(pair.path("priceChange").path("h24")))
                .marketCap(JsonValues.doubleOrNull(pair.path("marketCap")))
                .fdv(JsonValues.doubleOrNull(pair.path("fdv")))
                .buys24h(JsonValues.intOrNull(pair.path("txns").path("h24").path("buys")))
                .sells24h(JsonValues.intOrNull(pair.path("txns").path("h24").path("sells")))
                .pairCreatedAt(JsonValues.longOrNull(pair.path("pairCreatedAt")))
                .build();
    }

    private double liquidityOf(JsonNode pair) {
        return nullToZero(JsonValues.doubleOrNull(pair.path("liquidity").path("usd")));
    }

    private JsonNode fetchJson(String cacheKey, Duration ttl, String uriTemplate, Object... uriVariables) {
        JsonNode node = cache.getOrLoad(cacheKey, JsonNode.class, ttl, () -> {
            try {
                JsonNode body = guard.call(SOURCE, () -> restClient.get()
                        .uri(uriTemplate, uriVariables)
                        .retrieve()
                        .body(JsonNode.class));
                health.recordSuccess(clock.instant());
                return body;
            } catch (RestClientException | CallNotPermittedException e) {
                health.recordFailure(e.getMessage(), clock.instant());
                log.warn("DexScreener request failed [{}]: {}", uriTemplate, e.getMessage());
                throw new DataSourceException(SOURCE, "request to " + uriTemplate + " failed: " + e.getMessage(), e);
            }
        });
        return node != null ? node : MissingNode.getInstance();
    }

    private static double nullToZero(Double d) {
        return d != null ? d : 0.0;
    }
}
