package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.TokenLookupInput;
import com.deepansh.trader.market.ComprehensiveTokenData;
import com.deepansh.trader.market.SourceData;
import com.deepansh.trader.market.TokenEnrichmentService;
import com.deepansh.trader.model.ActionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Market, safety and social data in one call. Partial data is a successful
 * result: each section carries its own success flag.
 */
@Component
@RequiredArgsConstructor
public class GetComprehensiveTokenDataAction implements TradingAction<TokenLookupInput> {

    private final TokenEnrichmentService enrichmentService;

    @Override
    public ActionType getType() {
        return ActionType.GET_COMPREHENSIVE_TOKEN_DATA;
    }

    @Override
    public String getDescription() {
        return """
                Everything known about one token: DexScreener market data (pairs, liquidity,
                volume, socials), RugCheck safety report (score, authorities, holders, risks)
                and social data (TweetScout accounts and tweets). Sources fail independently;
                check each section's success flag and decide with what is available.
                """;
    }

    @Override
    public Class<TokenLookupInput> getInputType() {
        return TokenLookupInput.class;
    }

    @Override
    public ActionResult execute(TokenLookupInput input, ActionContext context) {
        ComprehensiveTokenData data = enrichmentService.enrich(input.tokenAddress(), input.tokenSymbol());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("token_address", data.tokenAddress());
        payload.put("token_symbol", data.tokenSymbol());
        payload.put("data_available", data.hasAnyData());
        payload.put("sources_available", data.sourcesAvailable());
        payload.put("market_data", section(data.market()));
        payload.put("safety_data", section(data.safety()));
        payload.put("social_data", section(data.social()));
        payload.put("collected_at", data.collectedAt());
        return ActionResult.ok(payload);
    }

    static Map<String, Object> section(SourceData source) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("source", source.source());
        section.put("success", source.available());
        if (source.available()) {
            section.put("data", source.payload());
        } else {
            section.put("error", source.error());
        }
        return section;
    }
}
