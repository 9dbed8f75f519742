package com.deepansh.trader.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Flattened view of a token's most liquid trading pair, as handed to the oracle
 * by discovery and accepted back by the filter/sort actions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenSnapshot {

    private String tokenAddress;
    private String symbol;
    private String name;
    private String pairAddress;
    private String dexId;
    private String url;

    private Double priceUsd;
    private Double liquidityUsd;
    private Double volume24h;
    private Double priceChange1h;
    private Double priceChange24h;
    private Double marketCap;
    private Double fdv;

    private Integer buys24h;
    private Integer sells24h;

    /** Epoch millis of pair creation, as reported by DexScreener */
    private Long pairCreatedAt;

    private Double boostAmount;

    /** Discovery strategy that surfaced this token */
    private String source;

    /** Market cap if reported, otherwise fully diluted valuation */
    @JsonIgnore
    public Double effectiveMarketCap() {
        return marketCap != null ? marketCap : fdv;
    }

    @JsonIgnore
    public Double ageHours(Instant now) {
        if (pairCreatedAt == null) return null;
        return Duration.between(Instant.ofEpochMilli(pairCreatedAt), now).toMinutes() / 60.0;
    }
}
