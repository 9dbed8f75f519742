package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.SortTokensInput;
import com.deepansh.trader.market.TokenFilters;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.model.TokenSnapshot;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class SortTokensAction implements TradingAction<SortTokensInput> {

    @Override
    public ActionType getType() {
        return ActionType.SORT_TOKENS;
    }

    @Override
    public String getDescription() {
        return """
                Sort a token list by one metric. Tokens without a value for the metric go last.
                Pure ordering, no scoring.
                """;
    }

    @Override
    public Class<SortTokensInput> getInputType() {
        return SortTokensInput.class;
    }

    @Override
    public ActionResult execute(SortTokensInput input, ActionContext context) {
        List<TokenSnapshot> sorted;
        try {
            sorted = TokenFilters.sort(input.tokens(), input.sortBy(), input.effectiveDescending());
        } catch (IllegalArgumentException e) {
            return ActionResult.failure(e.getMessage());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sort_by", input.sortBy());
        payload.put("descending", input.effectiveDescending());
        payload.put("count", sorted.size());
        payload.put("tokens", sorted);
        return ActionResult.ok(payload);
    }
}
