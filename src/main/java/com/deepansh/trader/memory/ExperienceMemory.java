package com.deepansh.trader.memory;

import com.deepansh.trader.action.input.PatternType;

import java.util.List;
import java.util.Map;

/**
 * Long-term trading memory: store experiences, recall them by similarity.
 */
public interface ExperienceMemory {

    /** @return id of the stored experience */
    String store(String tokenAddress, Map<String, Object> tradingData, String aiReasoning, String sessionId);

    /**
     * Free-text similarity search. {@code filters} are exact matches on the
     * experience's metadata fields and may be empty.
     */
    List<ExperienceMatch> search(String query, Map<String, Object> filters, int limit);

    List<ExperienceMatch> findSimilarTokens(Map<String, Object> characteristics, int limit);

    List<TradingExperience> findPatterns(PatternType type, int limit);

    Map<String, Object> stats();
}
