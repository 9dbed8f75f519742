package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.SimilarTokensInput;
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
public class FindSimilarTokensAction implements TradingAction<SimilarTokensInput> {

    private final ExperienceMemory memory;

    @Override
    public ActionType getType() {
        return ActionType.FIND_SIMILAR_TOKENS;
    }

    @Override
    public String getDescription() {
        return """
                Find previously traded or analysed tokens that resemble the given characteristics,
                with how those trades turned out.
                """;
    }

    @Override
    public Class<SimilarTokensInput> getInputType() {
        return SimilarTokensInput.class;
    }

    @Override
    public ActionResult execute(SimilarTokensInput input, ActionContext context) {
        List<ExperienceMatch> matches;
        try {
            matches = memory.findSimilarTokens(input.tokenCharacteristics(), input.effectiveLimit());
        } catch (RuntimeException e) {
            log.error("Similar token search failed", e);
            return ActionResult.failure("Similar token search failed: " + e.getMessage());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("count", matches.size());
        payload.put("similar_tokens", matches.stream().map(ExperienceViews::of).toList());
        return ActionResult.ok(payload);
    }
}
