package com.deepansh.trader.memory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One remembered trade or analysis.
 *
 * Collection: trading_experiences
 *
 * {@code content} is the text that gets embedded: a readable summary of the
 * trading data plus the reasoning. {@code metadata} holds the scalar trading
 * fields so they can be matched exactly with metadata.&lt;key&gt; filters.
 */
@Document(collection = "trading_experiences")
@CompoundIndex(name = "idx_profit_date", def = "{'wasProfitable': 1, 'createdAt': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingExperience {

    @Id
    private String id;

    @Indexed
    private String tokenAddress;

    private String tokenSymbol;
    private String tradeType;
    private String content;
    private String aiReasoning;
    private String sessionId;

    private Map<String, Object> tradingData;
    private Map<String, Object> metadata;

    private Double profitPercentage;
    private Boolean wasProfitable;
    private Double holdTimeHours;

    /** 1536 floats for text-embedding-3-small; absent until the async embed finishes */
    @JsonIgnore
    private List<Double> embedding;

    @CreatedDate
    private Instant createdAt;
}
