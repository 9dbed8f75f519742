package com.deepansh.trader.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Derived figures, recomputed at the start of every cycle.
 * Real and simulated holdings are kept in separate buckets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PortfolioMetrics {

    private double totalPositionValueSol;
    private double totalPortfolioValueSol;
    private double simulatedPositionValueSol;
    private double unrealizedProfitSol;
    private double realizedProfitSol;
    private double cashAllocationPct;

    private int totalTrades;
    private int winningTrades;
    private double winRate;

    private Instant updatedAt;
}
