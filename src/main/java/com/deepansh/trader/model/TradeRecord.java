package com.deepansh.trader.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TradeRecord {

    private TradeDirection tradeType;
    private String tokenAddress;
    private String tokenSymbol;
    private double amountSol;
    private boolean simulated;

    /** Null for simulated trades */
    private String signature;

    /** simulated_success, confirmed, unconfirmed */
    private String status;

    private Double realizedPnlSol;
    private String reasoning;
    private Instant timestamp;
}
