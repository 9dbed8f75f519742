package com.deepansh.trader.market;

import com.deepansh.trader.cache.EphemeralCache;
import com.deepansh.trader.config.DataSourceProperties;
import com.deepansh.trader.model.TokenSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw social signal for a token: TweetScout account and tweet search by symbol,
 * plus the socials/websites DexScreener lists for the token's best pair.
 *
 * TweetScout is optional. Without an API key the TweetScout part is reported as
 * not configured and the DexScreener part is still returned.
 */
@Component
@Slf4j
public class SocialDataClient {

    public static final String SOURCE = "tweetscout";

    private final RestClient restClient;
    private final DataSourceProperties props;
    private final DexScreenerClient dexScreener;
    private final EphemeralCache cache;
    private final MarketDataGuard guard;
    private final Clock clock;
    private final SourceHealth health = new SourceHealth(SOURCE);

    public SocialDataClient(RestClient.Builder restClientBuilder,
                            DataSourceProperties props,
                            DexScreenerClient dexScreener,
                            EphemeralCache cache,
                            MarketDataGuard guard,
                            Clock clock) {
        this.props = props;
        this.dexScreener = dexScreener;
        this.cache = cache;
        this.clock = clock;
        this.guard = guard;
        this.restClient = restClientBuilder.clone()
                .baseUrl(props.getTweetscout().getBaseUrl())
                .defaultHeader("Accept", "application/json")
                .defaultHeader("ApiKey", props.getTweetscout().getApiKey())
                .build();
    }

    /**
     * Never throws. The symbol is resolved from DexScreener when not given.
     * Available if at least one of TweetScout or DexScreener socials answered.
     */
    public SourceData getSocialData(String tokenAddress, String tokenSymbol) {
        String cacheKey = "social:" + tokenAddress + ":" + tokenSymbol;
        var cached = cache.get(cacheKey, SourceData.class);
        if (cached.isPresent()) return cached.get();

        SourceData market = dexScreener.getTokenMarketData(tokenAddress);
        String symbol = tokenSymbol != null && !tokenSymbol.isBlank() ? tokenSymbol : symbolFrom(market);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("token_address", tokenAddress);
        payload.put("token_symbol", symbol);

        List<String> errors = new ArrayList<>();
        boolean anySource = false;

        if (market.available()) {
            @SuppressWarnings("unchecked")
            Map<String, Object> marketPayload = (Map<String, Object>) market.payload();
            Map<String, Object> dexSocial = new LinkedHashMap<>();
            dexSocial.put("socials", marketPayload.get("socials"));
            dexSocial.put("websites", marketPayload.get("websites"));
            payload.put("dexscreener_social", dexSocial);
            anySource = true;
        } else {
            errors.add("dexscreener: " + market.error());
        }

        if (!props.getTweetscout().isConfigured()) {
            payload.put("tweetscout", Map.of("configured", false));
        } else if (symbol == null) {
            errors.add("tweetscout: token symbol unknown");
        } else {
            try {
                payload.put("tweetscout_accounts", searchAccounts(symbol));
                payload.put("tweetscout_tweets", searchTweets(symbol));
                health.recordSuccess(clock.instant());
                anySource = true;
            } catch (RestClientException | CallNotPermittedException e) {
                health.recordFailure(e.getMessage(), clock.instant());
                log.warn("TweetScout request failed [symbol={}]: {}", symbol, e.getMessage());
                errors.add("tweetscout: " + e.getMessage());
            }
        }
        payload.put("errors", errors);

        if (!anySource) {
            return SourceData.unavailable(SOURCE, String.join("; ", errors), clock.instant());
        }

        SourceData data = SourceData.available(SOURCE, payload, clock.instant());
        cache.put(cacheKey, data, props.getTweetscout().getSocialTtl());
        return data;
    }

    public SourceHealth getHealth() {
        return health;
    }

    private JsonNode searchAccounts(String symbol) {
        return guard.call(SOURCE, () -> restClient.get()
                .uri(uri -> uri.path("/account/search")
                        .queryParam("query", "$" + symbol)
                        .queryParam("limit", props.getTweetscout().getSearchLimit())
                        .build())
                .retrieve()
                .body(JsonNode.class));
    }

    private JsonNode searchTweets(String symbol) {
        return guard.call(SOURCE, () -> restClient.get()
                .uri(uri -> uri.path("/tweets/search")
                        .queryParam("query", "$" + symbol)
                        .queryParam("limit", 50)
                        .queryParam("days", 1)
                        .build())
                .retrieve()
                .body(JsonNode.class));
    }

    @SuppressWarnings("unchecked")
    private static String symbolFrom(SourceData market) {
        if (!market.available()) return null;
        Object best = ((Map<String, Object>) market.payload()).get("best_pair");
        return best instanceof TokenSnapshot t ? t.getSymbol() : null;
    }
}
