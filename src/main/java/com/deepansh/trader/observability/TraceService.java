package com.deepansh.trader.observability;

import com.deepansh.trader.core.CycleOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists cycle traces and exposes analytics.
 *
 * Trace persistence is @Async: it never delays the next cycle, and a Mongo
 * outage only costs the trace.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private static final int PREVIEW_CHARS = 200;

    private final CycleTraceRepository traceRepository;
    private final Clock clock;

    @Async("memoryTaskExecutor")
    public void persistTrace(String sessionId, long cycleNumber, String tradingMode,
                             CycleOutcome outcome, RunContext runCtx) {
        try {
            CycleTrace trace = toTrace(sessionId, cycleNumber, tradingMode, outcome, runCtx);
            traceRepository.save(trace);

            log.info("Trace persisted [session={}, cycle={}, status={}, latency={}ms, tokens={}]",
                    sessionId, cycleNumber, trace.getStatus(), trace.getTotalLatencyMs(), trace.getTotalTokens());

        } catch (Exception e) {
            log.error("Failed to persist cycle trace [session={}, cycle={}]", sessionId, cycleNumber, e);
        }
    }

    CycleTrace toTrace(String sessionId, long cycleNumber, String tradingMode,
                       CycleOutcome outcome, RunContext runCtx) {
        CycleTrace.Status status;
        if (outcome.isFailed()) {
            status = CycleTrace.Status.FAILED;
        } else if (outcome.isStepBudgetExhausted()) {
            status = CycleTrace.Status.STEP_BUDGET_EXHAUSTED;
        } else {
            status = CycleTrace.Status.COMPLETED;
        }

        List<CycleTrace.ActionTraceEntry> actions = runCtx.getActionRecords().stream()
                .map(r -> CycleTrace.ActionTraceEntry.builder()
                        .actionName(r.actionName())
                        .latencyMs(r.latencyMs())
                        .success(r.success())
                        .resultPreview(truncate(r.observation(), PREVIEW_CHARS))
                        .build())
                .toList();

        return CycleTrace.builder()
                .sessionId(sessionId)
                .cycleNumber(cycleNumber)
                .status(status)
                .tradingMode(tradingMode)
                .iterationsUsed(outcome.getIterations())
                .totalLatencyMs(runCtx.elapsedMs())
                .promptTokens(runCtx.getPromptTokens())
                .completionTokens(runCtx.getCompletionTokens())
                .totalTokens(runCtx.totalTokens())
                .actions(actions)
                .rationale(truncate(outcome.getRationale(), 8000))
                .errorType(outcome.getErrorType())
                .errorMessage(outcome.getError())
                .build();
    }

    public List<CycleTrace> recent() {
        return traceRepository.findTop50ByOrderByCreatedAtDesc();
    }

    public List<CycleTrace> forSession(String sessionId) {
        return traceRepository.findBySessionIdOrderByCycleNumberDesc(sessionId);
    }

    /**
     * Last 24h: average cycle latency, tokens spent, status breakdown.
     */
    public Map<String, Object> getAnalytics() {
        Instant since24h = clock.instant().minus(24, ChronoUnit.HOURS);

        Double avgLatency = traceRepository.avgLatencySince(since24h);
        Long tokens = traceRepository.totalTokensSince(since24h);
        Map<String, Long> statusBreakdown = traceRepository.statusBreakdownSince(since24h).stream()
                .filter(row -> row.id() != null)
                .collect(Collectors.toMap(CycleTraceRepository.StatusCount::id,
                        CycleTraceRepository.StatusCount::count));

        Map<String, Object> analytics = new LinkedHashMap<>();
        analytics.put("since", since24h.toString());
        analytics.put("avgLatencyMs", avgLatency != null ? Math.round(avgLatency) : 0L);
        analytics.put("totalTokensLast24h", tokens != null ? tokens : 0L);
        analytics.put("statusBreakdown", statusBreakdown);
        return analytics;
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
