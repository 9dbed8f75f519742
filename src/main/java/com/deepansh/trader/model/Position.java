package com.deepansh.trader.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * An open holding. Opened by an execution action recording a buy, reduced or
 * removed by one recording a sell.
 *
 * Simulated positions come from dry-run executions. They are tracked so a
 * dry-run session behaves like a live one, but never count toward the wallet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Position {

    private String tokenAddress;
    private String tokenSymbol;

    private double entryPriceUsd;
    private double currentPriceUsd;

    /** SOL committed at entry */
    private double amountSol;
    private double currentValueSol;
    private double unrealizedPnlSol;
    private double currentProfitPercentage;

    private Double stopLossPct;
    private Double takeProfitPct;

    private Instant openedAt;
    private String reason;
    private boolean simulated;
    private String entrySignature;

    public double holdTimeHours(Instant now) {
        if (openedAt == null) return 0.0;
        return Duration.between(openedAt, now).toMinutes() / 60.0;
    }
}
