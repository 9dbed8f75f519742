package com.deepansh.trader.memory;

/**
 * @param similarity cosine similarity to the query, null for keyword or filter matches
 */
public record ExperienceMatch(TradingExperience experience, Double similarity) {
}
