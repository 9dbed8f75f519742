package com.deepansh.trader.market;

import com.deepansh.trader.cache.EphemeralCache;
import com.deepansh.trader.config.DataSourceProperties;
import com.deepansh.trader.model.TokenSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Joins the three collaborators into one view of a token. A source that fails is
 * carried as unavailable; the others are still returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenEnrichmentService {

    private final DexScreenerClient dexScreener;
    private final RugCheckClient rugCheck;
    private final SocialDataClient socialData;
    private final EphemeralCache cache;
    private final DataSourceProperties props;
    private final Clock clock;

    public ComprehensiveTokenData enrich(String tokenAddress, String tokenSymbol) {
        String cacheKey = "enrichment:" + tokenAddress;
        var cached = cache.get(cacheKey, ComprehensiveTokenData.class);
        if (cached.isPresent()) return cached.get();

        SourceData market = dexScreener.getTokenMarketData(tokenAddress);
        String symbol = tokenSymbol != null ? tokenSymbol : symbolFrom(market);
        SourceData safety = rugCheck.getSafetyReport(tokenAddress);
        SourceData social = socialData.getSocialData(tokenAddress, symbol);

        List<String> available = new ArrayList<>();
        if (market.available()) available.add(DexScreenerClient.SOURCE);
        if (safety.available()) available.add(RugCheckClient.SOURCE);
        if (social.available()) available.add(SocialDataClient.SOURCE);

        ComprehensiveTokenData data = new ComprehensiveTokenData(
                tokenAddress, symbol, market, safety, social, List.copyOf(available), clock.instant());

        log.info("Token enriched [token={}, symbol={}, sources={}]", tokenAddress, symbol, available);

        // Only cache complete views so a transient outage is retried next cycle
        if (available.size() == 3) {
            cache.put(cacheKey, data, props.getEnrichment().getUnifiedTtl());
        }
        return data;
    }

    @SuppressWarnings("unchecked")
    private static String symbolFrom(SourceData market) {
        if (!market.available()) return null;
        Object best = ((Map<String, Object>) market.payload()).get("best_pair");
        return best instanceof TokenSnapshot t ? t.getSymbol() : null;
    }
}
