package com.deepansh.trader.action.impl;

import com.deepansh.trader.memory.ExperienceMatch;
import com.deepansh.trader.memory.TradingExperience;

import java.util.LinkedHashMap;
import java.util.Map;

/** Compact form of a stored experience as shown to the oracle. */
final class ExperienceViews {

    private ExperienceViews() {
    }

    static Map<String, Object> of(ExperienceMatch match) {
        Map<String, Object> view = of(match.experience());
        if (match.similarity() != null) {
            view.put("similarity", Math.round(match.similarity() * 1000) / 1000.0);
        }
        return view;
    }

    static Map<String, Object> of(TradingExperience e) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", e.getId());
        view.put("token_address", e.getTokenAddress());
        view.put("token_symbol", e.getTokenSymbol());
        view.put("trade_type", e.getTradeType());
        view.put("content", e.getContent());
        view.put("profit_percentage", e.getProfitPercentage());
        view.put("was_profitable", e.getWasProfitable());
        view.put("hold_time_hours", e.getHoldTimeHours());
        view.put("created_at", e.getCreatedAt());
        return view;
    }
}
