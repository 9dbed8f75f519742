package com.deepansh.trader.action.input;

import com.deepansh.trader.action.ActionParam;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

import java.util.Map;

public record SimilarTokensInput(
        @NotEmpty
        @ActionParam("Characteristics of the token under analysis, e.g. liquidity, age, market cap, social score")
        Map<String, Object> tokenCharacteristics,

        @Min(1) @Max(50)
        @ActionParam("Maximum results. Default: 5")
        Integer limit
) {

    public int effectiveLimit() {
        return limit != null ? limit : 5;
    }
}
