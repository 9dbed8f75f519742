package com.deepansh.trader.action.input;

import com.deepansh.trader.action.ActionParam;

public record TradingPatternsInput(
        @ActionParam("Which past trades to return: profitable, losing, high_profit, quick_trades, all. Default: all")
        PatternType patternType
) {

    public PatternType effectivePatternType() {
        return patternType != null ? patternType : PatternType.ALL;
    }
}
