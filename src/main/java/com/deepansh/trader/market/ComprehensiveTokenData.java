package com.deepansh.trader.market;

import java.time.Instant;
import java.util.List;

/**
 * Market, safety and social data for one token. Each part carries its own
 * availability marker; {@link #sourcesAvailable()} lists the ones that answered.
 */
public record ComprehensiveTokenData(
        String tokenAddress,
        String tokenSymbol,
        SourceData market,
        SourceData safety,
        SourceData social,
        List<String> sourcesAvailable,
        Instant collectedAt
) {

    public boolean hasAnyData() {
        return !sourcesAvailable.isEmpty();
    }
}
