package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.DiscoveryStrategy;
import com.deepansh.trader.action.input.EmptyInput;
import com.deepansh.trader.cache.EphemeralCache;
import com.deepansh.trader.exception.DataSourceException;
import com.deepansh.trader.market.DexScreenerClient;
import com.deepansh.trader.market.TokenFilters;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.model.WireEnum;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class GetMarketOverviewAction implements TradingAction<EmptyInput> {

    private final DexScreenerClient dexScreener;
    private final EphemeralCache cache;

    @Override
    public ActionType getType() {
        return ActionType.GET_MARKET_OVERVIEW;
    }

    @Override
    public String getDescription() {
        return """
                What discovery can offer right now: available strategies, sortable metrics,
                how many boosted tokens are currently listed, and cache statistics.
                A cheap first call before deciding how to discover tokens.
                """;
    }

    @Override
    public Class<EmptyInput> getInputType() {
        return EmptyInput.class;
    }

    @Override
    public ActionResult execute(EmptyInput input, ActionContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("discovery_strategies", Arrays.stream(DiscoveryStrategy.values()).map(WireEnum::wireName).toList());
        payload.put("sortable_metrics", TokenFilters.sortableMetrics());

        Map<String, Object> boosted = new LinkedHashMap<>();
        try {
            boosted.put("latest_count", dexScreener.getBoostedTokensLatest().size());
            boosted.put("top_count", dexScreener.getBoostedTokensTop().size());
        } catch (DataSourceException e) {
            log.warn("Boosted listings unavailable for overview: {}", e.getMessage());
            boosted.put("error", e.getMessage());
        }
        payload.put("boosted_tokens", boosted);
        payload.put("dexscreener_status", dexScreener.getHealth().status());
        payload.put("cache", cache.stats());
        return ActionResult.ok(payload);
    }
}
