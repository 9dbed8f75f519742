package com.deepansh.trader.action.input;

import com.deepansh.trader.action.ActionParam;
import com.deepansh.trader.model.TokenSnapshot;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/** Every bound is optional; an absent bound does not filter */
public record FilterTokensInput(
        @NotNull
        @ActionParam("Tokens exactly as returned by discover_tokens")
        List<TokenSnapshot> tokens,

        @ActionParam("Keep pairs created at most this many hours ago")
        Double maxAgeHours,

        @ActionParam("Minimum pool liquidity in USD")
        Double minLiquidityUsd,

        @ActionParam("Maximum pool liquidity in USD")
        Double maxLiquidityUsd,

        @ActionParam("Minimum 24h volume in USD")
        Double minVolume24h,

        @ActionParam("Minimum market cap in USD (falls back to FDV when market cap is unknown)")
        Double minMarketCap,

        @ActionParam("Maximum market cap in USD (falls back to FDV when market cap is unknown)")
        Double maxMarketCap,

        @ActionParam("Minimum 24h price change in percent")
        Double minPriceChange24h,

        @ActionParam("Maximum 24h price change in percent")
        Double maxPriceChange24h
) {
}
