package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.PatternType;
import com.deepansh.trader.action.input.TradingPatternsInput;
import com.deepansh.trader.memory.ExperienceMemory;
import com.deepansh.trader.memory.TradingExperience;
import com.deepansh.trader.model.ActionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

@Component
@Slf4j
@RequiredArgsConstructor
public class GetTradingPatternsAction implements TradingAction<TradingPatternsInput> {

    private static final int MAX_RESULTS = 20;

    private final ExperienceMemory memory;

    @Override
    public ActionType getType() {
        return ActionType.GET_TRADING_PATTERNS;
    }

    @Override
    public String getDescription() {
        return """
                Past trades grouped by outcome: profitable, losing, high_profit (20%+),
                quick_trades (held 2h or less) or all. Newest first, with the average profit
                of the group.
                """;
    }

    @Override
    public Class<TradingPatternsInput> getInputType() {
        return TradingPatternsInput.class;
    }

    @Override
    public ActionResult execute(TradingPatternsInput input, ActionContext context) {
        PatternType type = input.effectivePatternType();
        List<TradingExperience> experiences;
        try {
            experiences = memory.findPatterns(type, MAX_RESULTS);
        } catch (RuntimeException e) {
            log.error("Pattern lookup failed [type={}]", type.wireName(), e);
            return ActionResult.failure("Pattern lookup failed: " + e.getMessage());
        }

        OptionalDouble avgProfit = experiences.stream()
                .map(TradingExperience::getProfitPercentage)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pattern_type", type.wireName());
        payload.put("count", experiences.size());
        payload.put("average_profit_percentage", avgProfit.isPresent() ? avgProfit.getAsDouble() : null);
        payload.put("experiences", experiences.stream().map(ExperienceViews::of).toList());
        return ActionResult.ok(payload);
    }
}
