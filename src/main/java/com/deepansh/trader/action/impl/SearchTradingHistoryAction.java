package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.SearchHistoryInput;
import com.deepansh.trader.memory.ExperienceMatch;
import com.deepansh.trader.memory.ExperienceMemory;
import com.deepansh.trader.model.ActionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class SearchTradingHistoryAction implements TradingAction<SearchHistoryInput> {

    private final ExperienceMemory memory;

    @Override
    public ActionType getType() {
        return ActionType.SEARCH_TRADING_HISTORY;
    }

    @Override
    public String getDescription() {
        return """
                Search past trading experiences by meaning, not just keywords. Describe the
                current situation in plain language; results are ranked by similarity and
                carry their outcome (profit %, hold time).
                """;
    }

    @Override
    public Class<SearchHistoryInput> getInputType() {
        return SearchHistoryInput.class;
    }

    @Override
    public ActionResult execute(SearchHistoryInput input, ActionContext context) {
        List<ExperienceMatch> matches;
        try {
            matches = memory.search(input.query(),
                    input.filters() != null ? input.filters() : Map.of(),
                    input.effectiveLimit());
        } catch (RuntimeException e) {
            log.error("Trading history search failed [query='{}']", input.query(), e);
            return ActionResult.failure("Trading history search failed: " + e.getMessage());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", input.query());
        payload.put("count", matches.size());
        payload.put("experiences", matches.stream().map(ExperienceViews::of).toList());
        return ActionResult.ok(payload);
    }
}
