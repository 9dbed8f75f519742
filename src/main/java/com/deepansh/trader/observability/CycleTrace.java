package com.deepansh.trader.observability;

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

/**
 * Full trace of one cycle.
 *
 * Collection: cycle_traces
 *
 * Action records are embedded in execution order, so a single document answers
 * "what did the oracle do in cycle N and how long did each step take".
 */
@Document(collection = "cycle_traces")
@CompoundIndex(name = "idx_session_cycle", def = "{'sessionId': 1, 'cycleNumber': -1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleTrace {

    public enum Status { COMPLETED, STEP_BUDGET_EXHAUSTED, FAILED }

    @Id
    private String id;

    private String sessionId;
    private long cycleNumber;

    @Indexed
    private Status status;

    private String tradingMode;
    private int iterationsUsed;
    private long totalLatencyMs;

    private int promptTokens;
    private int completionTokens;
    private int totalTokens;

    private List<ActionTraceEntry> actions;

    private String rationale;
    private String errorType;
    private String errorMessage;

    @Indexed
    @CreatedDate
    private Instant createdAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ActionTraceEntry {
        private String actionName;
        private long latencyMs;
        private boolean success;
        private String resultPreview;
    }
}
