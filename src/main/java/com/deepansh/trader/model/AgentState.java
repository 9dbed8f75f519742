package com.deepansh.trader.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The persisted world-state document, one per agent.
 *
 * Serialized as snake_case JSON and always written whole. Fields this class
 * does not know about are captured in {@link #getExtensions()} and written
 * back untouched, so an older binary never strips a newer document.
 *
 * Invariants:
 * - cyclesCompleted never decreases between saves
 * - tradingMode is the only switch that lets real funds move
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentState {

    private double walletBalanceSol;

    @Builder.Default
    private List<Position> activePositions = new ArrayList<>();

    @Builder.Default
    private PortfolioMetrics portfolioMetrics = new PortfolioMetrics();

    @Builder.Default
    private Map<String, Object> agentParameters = new LinkedHashMap<>();

    @Builder.Default
    private TradingMode tradingMode = TradingMode.DRY_RUN;

    private String aiStrategy;

    private long cyclesCompleted;

    @Builder.Default
    private List<String> lastInvokedActions = new ArrayList<>();

    /** Oracle's final rationale from the last cycle */
    private String agentReasoning;

    private Instant lastUpdateTimestamp;
    private Instant lastCycleTimestamp;

    // ─── Error tracking ─────────────────────────────────────────────────────

    private String error;
    private Instant errorTimestamp;
    private String errorType;

    @Builder.Default
    private List<ErrorRecord> previousErrors = new ArrayList<>();

    private boolean stateHealthy;

    // ─── Session ────────────────────────────────────────────────────────────

    private boolean sessionActive;
    private String sessionId;
    private Instant sessionStartTimestamp;
    private Instant sessionEndTimestamp;

    /** Stop markers inspected by the background runner after each cycle */
    private boolean shouldStop;
    private boolean fatalError;

    @Builder.Default
    private List<TradeRecord> transactionHistory = new ArrayList<>();

    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> extensions = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtensions() {
        return extensions;
    }

    @JsonAnySetter
    public void putExtension(String name, Object value) {
        extensions.put(name, value);
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    public int positionCount() {
        return activePositions == null ? 0 : activePositions.size();
    }
}
