package com.deepansh.trader.action.input;

import com.deepansh.trader.action.ActionParam;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record SearchHistoryInput(
        @NotBlank
        @ActionParam("Free-text description of the situation to look up. E.g: 'low liquidity dog coin pumped 300% in 2h'")
        String query,

        @ActionParam("Exact-match metadata filters, e.g. {\"outcome\": \"profit\"}")
        Map<String, Object> filters,

        @Min(1) @Max(50)
        @ActionParam("Maximum results. Default: 10")
        Integer limit
) {

    public int effectiveLimit() {
        return limit != null ? limit : 10;
    }
}
