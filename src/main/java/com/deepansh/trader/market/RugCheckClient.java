package com.deepansh.trader.market;

import com.deepansh.trader.cache.EphemeralCache;
import com.deepansh.trader.config.DataSourceProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RugCheck token safety reports (/tokens/{mint}/report).
 *
 * The report is passed through raw. A handful of fields (score, authorities, holders,
 * liquidity, risks) are lifted to the top level so the oracle does not have to dig,
 * but nothing is scored or judged here.
 */
@Component
@Slf4j
public class RugCheckClient {

    public static final String SOURCE = "rugcheck";

    private final RestClient restClient;
    private final DataSourceProperties props;
    private final EphemeralCache cache;
    private final MarketDataGuard guard;
    private final Clock clock;
    private final SourceHealth health = new SourceHealth(SOURCE);

    public RugCheckClient(RestClient.Builder restClientBuilder,
                          DataSourceProperties props,
                          EphemeralCache cache,
                          MarketDataGuard guard,
                          Clock clock) {
        this.props = props;
        this.cache = cache;
        this.clock = clock;
        this.guard = guard;

        RestClient.Builder builder = restClientBuilder.clone()
                .baseUrl(props.getRugcheck().getBaseUrl())
                .defaultHeader("Accept", "application/json");
        String apiKey = props.getRugcheck().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + apiKey);
        }
        this.restClient = builder.build();
    }

    /** Never throws: a missing token or a transport failure is an unavailable result */
    public SourceData getSafetyReport(String tokenAddress) {
        String cacheKey = "rugcheck:report:" + tokenAddress;
        var cached = cache.get(cacheKey, SourceData.class);
        if (cached.isPresent()) return cached.get();

        try {
            JsonNode report = guard.call(SOURCE, () -> restClient.get()
                    .uri("/tokens/{mint}/report", tokenAddress)
                    .retrieve()
                    .body(JsonNode.class));
            health.recordSuccess(clock.instant());

            if (report == null || report.isEmpty()) {
                return SourceData.unavailable(SOURCE, "Empty RugCheck report", clock.instant());
            }

            SourceData data = SourceData.available(SOURCE, summarize(tokenAddress, report), clock.instant());
            cache.put(cacheKey, data, props.getRugcheck().getReportTtl());
            log.info("RugCheck report fetched [token={}, score={}]", tokenAddress, report.path("score").asText("n/a"));
            return data;

        } catch (HttpClientErrorException.NotFound e) {
            // The API answered; the token is just unknown to it
            health.recordSuccess(clock.instant());
            log.warn("Token {} not found in RugCheck database", tokenAddress);
            return SourceData.unavailable(SOURCE, "Token not found in RugCheck database", clock.instant());
        } catch (RestClientException | CallNotPermittedException e) {
            health.recordFailure(e.getMessage(), clock.instant());
            log.warn("RugCheck request failed [token={}]: {}", tokenAddress, e.getMessage());
            return SourceData.unavailable(SOURCE, e.getMessage(), clock.instant());
        }
    }

    public SourceHealth getHealth() {
        return health;
    }

    private Map<String, Object> summarize(String tokenAddress, JsonNode report) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("token_address", tokenAddress);
        m.put("score", JsonValues.doubleOrNull(report.path("score")));
        m.put("score_normalised", JsonValues.doubleOrNull(report.path("score_normalised")));
        m.put("rugged", report.path("rugged").asBoolean(false));
        m.put("mint_authority", JsonValues.textOrNull(report.path("mintAuthority")));
        m.put("freeze_authority", JsonValues.textOrNull(report.path("freezeAuthority")));
        m.put("total_holders", JsonValues.longOrNull(report.path("totalHolders")));
        m.put("total_market_liquidity", JsonValues.doubleOrNull(report.path("totalMarketLiquidity")));
        m.put("total_lp_providers", JsonValues.longOrNull(report.path("totalLPProviders")));
        m.put("risks", report.path("risks"));
        m.put("top_holders", report.path("topHolders"));
        m.put("token_meta", report.path("tokenMeta"));
        m.put("raw_report", report);
        return m;
    }
}
