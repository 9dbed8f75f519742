package com.deepansh.trader.action.input;

import com.deepansh.trader.action.ActionParam;
import com.deepansh.trader.model.TradeDirection;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.Map;

public record ExecuteTradeInput(
        @NotNull
        @ActionParam("buy or sell")
        TradeDirection tradeType,

        @NotBlank
        @ActionParam("Token mint address")
        String tokenAddress,

        @ActionParam("Token symbol, recorded on the position")
        String tokenSymbol,

        @NotNull @Positive
        @ActionParam("Trade size in SOL")
        Double amountSol,

        @ActionParam("The full quote object returned by get_swap_quote. Required when dryRun is false")
        Map<String, Object> quoteData,

        @ActionParam("Simulate instead of submitting a real transaction. Default: true")
        Boolean dryRun,

        @ActionParam("Why this trade, in one or two sentences")
        String reasoning
) {

    /** Absent means simulate */
    public boolean effectiveDryRun() {
        return dryRun == null || dryRun;
    }

    public boolean hasQuote() {
        return quoteData != null && !quoteData.isEmpty();
    }
}
