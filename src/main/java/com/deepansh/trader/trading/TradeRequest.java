package com.deepansh.trader.trading;

/** What the ledger needs to know about an executed (or simulated) trade. */
public record TradeRequest(
        String tokenAddress,
        String tokenSymbol,
        double amountSol,
        boolean simulated,
        String reasoning
) {
}
