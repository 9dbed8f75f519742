package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.FilterTokensInput;
import com.deepansh.trader.market.TokenFilters;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.model.TokenSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class FilterTokensAction implements TradingAction<FilterTokensInput> {

    private final Clock clock;

    @Override
    public ActionType getType() {
        return ActionType.FILTER_TOKENS;
    }

    @Override
    public String getDescription() {
        return """
                Mechanically filter a token list by numeric bounds (age, liquidity, volume,
                market cap, 24h price change). Only the bounds you pass are applied; a token
                missing a value for an applied bound is dropped. Makes no quality judgment.
                """;
    }

    @Override
    public Class<FilterTokensInput> getInputType() {
        return FilterTokensInput.class;
    }

    @Override
    public ActionResult execute(FilterTokensInput input, ActionContext context) {
        List<TokenSnapshot> kept = TokenFilters.filter(input.tokens(), input, clock.instant());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("input_count", input.tokens().size());
        payload.put("output_count", kept.size());
        payload.put("tokens", kept);
        return ActionResult.ok(payload);
    }
}
