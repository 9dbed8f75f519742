package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.SaveExperienceInput;
import com.deepansh.trader.memory.ExperienceMemory;
import com.deepansh.trader.model.ActionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class SaveTradingExperienceAction implements TradingAction<SaveExperienceInput> {

    private final ExperienceMemory memory;

    @Override
    public ActionType getType() {
        return ActionType.SAVE_TRADING_EXPERIENCE;
    }

    @Override
    public String getDescription() {
        return """
                Store a trading experience (an analysis, an entry or an exit) so future cycles
                can recall it with search_trading_history. Include profitPercentage and
                holdTimeHours in tradingData once a trade is closed.
                """;
    }

    @Override
    public Class<SaveExperienceInput> getInputType() {
        return SaveExperienceInput.class;
    }

    @Override
    public ActionResult execute(SaveExperienceInput input, ActionContext context) {
        try {
            String id = memory.store(input.tokenAddress(), input.tradingData(),
                    input.aiReasoning(), context.getSessionId());
            return ActionResult.ok(Map.of("experience_id", id, "stored", true));
        } catch (RuntimeException e) {
            log.error("Saving trading experience failed [token={}]", input.tokenAddress(), e);
            return ActionResult.failure("Saving trading experience failed: " + e.getMessage());
        }
    }
}
