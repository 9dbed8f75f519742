package com.deepansh.trader.action.input;

import com.deepansh.trader.action.ActionParam;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record DiscoverTokensInput(
        @NotNull
        @ActionParam("Discovery strategy: boosted_latest (newly boosted), boosted_top (most boosted), "
                + "profiles_latest (new token profiles), custom_search (search by searchTerms)")
        DiscoveryStrategy strategy,

        @ActionParam("Search terms, only used by custom_search. E.g: [\"dog\", \"ai agent\"]")
        List<String> searchTerms,

        @Min(1) @Max(100)
        @ActionParam("Maximum number of tokens to return. Default: 20")
        Integer limit
) {

    public int effectiveLimit() {
        return limit != null ? limit : 20;
    }
}
