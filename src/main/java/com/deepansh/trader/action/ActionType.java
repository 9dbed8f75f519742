package com.deepansh.trader.action;

import com.deepansh.trader.model.WireEnum;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed capability catalog. Every constant must be backed by exactly
 * one {@link TradingAction} bean; {@link ActionCatalog} refuses to start otherwise.
 * The wire name is the stable contract the oracle calls actions by.
 */
public enum ActionType implements WireEnum {

    GET_WALLET_BALANCE("get_wallet_balance", ActionCategory.TELEMETRY),
    GET_PORTFOLIO_SUMMARY("get_portfolio_summary", ActionCategory.TELEMETRY),
    CHECK_SYSTEM_STATUS("check_system_status", ActionCategory.TELEMETRY),
    GET_MARKET_OVERVIEW("get_market_overview", ActionCategory.TELEMETRY),

    DISCOVER_TOKENS("discover_tokens", ActionCategory.DISCOVERY),

    FILTER_TOKENS("filter_tokens", ActionCategory.FILTER),
    SORT_TOKENS("sort_tokens", ActionCategory.FILTER),

    GET_COMPREHENSIVE_TOKEN_DATA("get_comprehensive_token_data", ActionCategory.ENRICHMENT),
    GET_SAFETY_DATA("get_safety_data", ActionCategory.ENRICHMENT),
    GET_SOCIAL_DATA("get_social_data", ActionCategory.ENRICHMENT),

    SEARCH_TRADING_HISTORY("search_trading_history", ActionCategory.MEMORY),
    FIND_SIMILAR_TOKENS("find_similar_tokens", ActionCategory.MEMORY),
    GET_TRADING_PATTERNS("get_trading_patterns", ActionCategory.MEMORY),
    SAVE_TRADING_EXPERIENCE("save_trading_experience", ActionCategory.MEMORY),

    GET_SWAP_QUOTE("get_swap_quote", ActionCategory.EXECUTION),
    EXECUTE_TRADE("execute_trade", ActionCategory.EXECUTION);

    private final String wireName;
    private final ActionCategory category;

    ActionType(String wireName, ActionCategory category) {
        this.wireName = wireName;
        this.category = category;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    public ActionCategory category() {
        return category;
    }

    public static Optional<ActionType> fromWireName(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(name))
                .findFirst();
    }
}
