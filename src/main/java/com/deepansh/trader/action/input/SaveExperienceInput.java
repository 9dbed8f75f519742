package com.deepansh.trader.action.input;

import com.deepansh.trader.action.ActionParam;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.Map;

public record SaveExperienceInput(
        @NotBlank
        @ActionParam("Token mint address")
        String tokenAddress,

        @NotEmpty
        @ActionParam("What was observed and done: entry/exit prices, profitPercentage, holdTimeHours, "
                + "outcome, liquidity, social signals. Free-form object")
        Map<String, Object> tradingData,

        @ActionParam("The reasoning behind the decision, for future recall")
        String aiReasoning
) {
}
