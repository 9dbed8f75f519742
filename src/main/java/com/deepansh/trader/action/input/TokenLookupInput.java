package com.deepansh.trader.action.input;

import com.deepansh.trader.action.ActionParam;
import jakarta.validation.constraints.NotBlank;

public record TokenLookupInput(
        @NotBlank
        @ActionParam("Token mint address")
        String tokenAddress,

        @ActionParam("Token symbol if known; looked up from market data otherwise")
        String tokenSymbol
) {
}
