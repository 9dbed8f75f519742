package com.deepansh.trader.action.input;

import com.deepansh.trader.action.ActionParam;
import com.deepansh.trader.model.TokenSnapshot;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record SortTokensInput(
        @NotNull
        @ActionParam("Tokens exactly as returned by discover_tokens or filter_tokens")
        List<TokenSnapshot> tokens,

        @NotBlank
        @ActionParam("Metric: liquidityUsd, volume24h, marketCap, fdv, priceUsd, priceChange1h, "
                + "priceChange24h, pairCreatedAt, boostAmount, buys24h, sells24h")
        String sortBy,

        @ActionParam("Sort descending. Default: true")
        Boolean descending
) {

    public boolean effectiveDescending() {
        return descending == null || descending;
    }
}
