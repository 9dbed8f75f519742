package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.DiscoverTokensInput;
import com.deepansh.trader.exception.DataSourceException;
import com.deepansh.trader.market.DexScreenerClient;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.model.TokenSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidate tokens from DexScreener by strategy. No ranking or judgment:
 * tokens come back in listing order, capped at the requested limit.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DiscoverTokensAction implements TradingAction<DiscoverTokensInput> {

    private final DexScreenerClient dexScreener;

    @Override
    public ActionType getType() {
        return ActionType.DISCOVER_TOKENS;
    }

    @Override
    public String getDescription() {
        return """
                Discover candidate Solana tokens. Returns token snapshots (price, liquidity,
                24h volume, market cap, price changes, pair age, boosts) ready to be passed
                to filter_tokens and sort_tokens.
                """;
    }

    @Override
    public Class<DiscoverTokensInput> getInputType() {
        return DiscoverTokensInput.class;
    }

    @Override
    public ActionResult execute(DiscoverTokensInput input, ActionContext context) {
        int limit = input.effectiveLimit();
        List<TokenSnapshot> tokens;

        try {
            tokens = switch (input.strategy()) {
                case BOOSTED_LATEST -> dexScreener.getBoostedTokensLatest();
                case BOOSTED_TOP -> dexScreener.getBoostedTokensTop();
                case PROFILES_LATEST -> dexScreener.getLatestTokenProfiles();
                case CUSTOM_SEARCH -> {
                    if (input.searchTerms() == null || input.searchTerms().isEmpty()) {
                        yield null;
                    }
                    yield search(input.searchTerms(), limit);
                }
            };
        } catch (DataSourceException e) {
            return ActionResult.failure("Token discovery failed: " + e.getMessage());
        }

        if (tokens == null) {
            return ActionResult.failure("custom_search requires at least one entry in searchTerms");
        }

        List<TokenSnapshot> capped = tokens.stream().limit(limit).toList();
        log.info("Discovered {} tokens [strategy={}]", capped.size(), input.strategy().wireName());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("strategy", input.strategy().wireName());
        payload.put("count", capped.size());
        payload.put("tokens", capped);
        return ActionResult.ok(payload);
    }

    /** One search per term, de-duplicated by token address in first-seen order */
    private List<TokenSnapshot> search(List<String> terms, int limit) {
        Map<String, TokenSnapshot> merged = new LinkedHashMap<>();
        for (String term : terms) {
            if (term == null || term.isBlank()) continue;
            for (TokenSnapshot token : dexScreener.searchTokens(term.trim(), limit)) {
                merged.putIfAbsent(token.getTokenAddress(), token);
            }
        }
        return List.copyOf(merged.values());
    }
}
