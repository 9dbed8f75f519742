package com.deepansh.trader.core;

import com.deepansh.trader.action.ActionCatalog;
import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionDefinition;
import com.deepansh.trader.config.AgentProperties;
import com.deepansh.trader.exception.OracleConfigurationException;
import com.deepansh.trader.exception.StateStoreException;
import com.deepansh.trader.model.ActionInvocation;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.model.ErrorRecord;
import com.deepansh.trader.model.Message;
import com.deepansh.trader.model.OracleTurn;
import com.deepansh.trader.model.TradingMode;
import com.deepansh.trader.observability.RunContext;
import com.deepansh.trader.observability.TraceService;
import com.deepansh.trader.oracle.OracleClient;
import com.deepansh.trader.state.AgentStateFactory;
import com.deepansh.trader.state.StateStore;
import com.deepansh.trader.trading.PortfolioValuator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One full pass of the trading loop (Reason → Act → Observe, bounded).
 *
 * Per-cycle flow:
 * 1. Merge parameter overrides, archive the previous cycle's error
 * 2. Mark positions to market and recompute portfolio metrics
 * 3. Build the context document
 * 4. Oracle loop: oracle turn → dispatch every requested action → feed results back → repeat
 *    until the oracle answers without invocations or the step budget runs out
 * 5. Advance the cycle counter and persist, whatever happened above
 * 6. Async: persist the cycle trace
 *
 * Nothing escapes {@link #runCycle}: a fault in any phase is written into the
 * state's error fields and the cycle is still counted and saved.
 */
@Service
@Slf4j
public class CycleOrchestrator {

    public static final String CONTEXT_BUILD_FAILURE = "context_build_failure";
    public static final String ORACLE_INVOCATION_FAILURE = "oracle_invocation_failure";
    public static final String ACTION_EXECUTION_FAILURE = "action_execution_failure";
    public static final String STATE_PERSISTENCE_FAILURE = "state_persistence_failure";

    public static final String DRY_RUN_PARAM = "dry_run";
    public static final String SHOULD_STOP_PARAM = "should_stop";

    static final int MAX_ERROR_HISTORY = 50;

    private final OracleClient oracleClient;
    private final ActionCatalog actionCatalog;
    private final StateStore stateStore;
    private final AgentStateFactory stateFactory;
    private final PortfolioValuator valuator;
    private final CyclePromptBuilder promptBuilder;
    private final TraceService traceService;
    private final AgentProperties props;
    private final ObjectMapper observationMapper;
    private final Clock clock;

    public CycleOrchestrator(OracleClient oracleClient,
                             ActionCatalog actionCatalog,
                             StateStore stateStore,
                             AgentStateFactory stateFactory,
                             PortfolioValuator valuator,
                             CyclePromptBuilder promptBuilder,
                             TraceService traceService,
                             AgentProperties props,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.oracleClient = oracleClient;
        this.actionCatalog = actionCatalog;
        this.stateStore = stateStore;
        this.stateFactory = stateFactory;
        this.valuator = valuator;
        this.promptBuilder = promptBuilder;
        this.traceService = traceService;
        this.props = props;
        this.observationMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }

    /** Foreground entry point: loads the persisted state (or creates it) and runs one cycle on it. */
    public CycleOutcome runSingleCycle(Map<String, Object> overrides) {
        AgentState state = stateStore.load().orElseGet(() -> {
            log.info("No persisted state found, starting from defaults");
            return stateFactory.createInitial();
        });
        return runCycle(state, overrides);
    }

    public CycleOutcome runCycle(AgentState state, Map<String, Object> overrides) {
        if (state.getTradingMode() == null) {
            log.warn("State has no trading mode, falling back to dry_run");
            state.setTradingMode(TradingMode.DRY_RUN);
        }
        long cycleNumber = state.getCyclesCompleted() + 1;
        String sessionId = state.getSessionId() != null ? state.getSessionId() : "foreground";

        log.info("Cycle started [session={}, cycle={}, mode={}]",
                sessionId, cycleNumber, state.getTradingMode().wireName());

        RunContext runCtx = new RunContext();
        CycleContext context = CycleContext.builder()
                .sessionId(sessionId)
                .cycleNumber(cycleNumber)
                .messages(new ArrayList<>())
                .invokedActions(new ArrayList<>())
                .currentIteration(0)
                .build();

        String phase = CONTEXT_BUILD_FAILURE;
        String rationale = null;
        boolean budgetExhausted = false;
        String error = null;
        String errorType = null;

        try {
            prepare(state, overrides);
            valuator.revalue(state);
            context.getMessages().addAll(promptBuilder.openingMessages(state, cycleNumber));

            List<ActionDefinition> definitions = actionCatalog.getAllDefinitions();
            ActionContext actionContext = ActionContext.builder()
                    .state(state)
                    .sessionId(sessionId)
                    .cycleNumber(cycleNumber)
                    .build();

            for (int i = 0; i < props.getMaxIterations(); i++) {
                context.setCurrentIteration(i + 1);
                log.debug("Oracle turn {}/{} [session={}, cycle={}]",
                        i + 1, props.getMaxIterations(), sessionId, cycleNumber);

                phase = ORACLE_INVOCATION_FAILURE;
                OracleTurn turn = oracleClient.chat(context.getMessages(), definitions);
                runCtx.addTokens(turn.getPromptTokens(), turn.getCompletionTokens());

                if (!turn.hasInvocations()) {
                    context.getMessages().add(Message.builder()
                            .role(Message.Role.assistant)
                            .content(turn.getContent())
                            .build());
                    rationale = turn.getContent() != null ? turn.getContent() : "";
                    break;
                }

                phase = ACTION_EXECUTION_FAILURE;
                executeTurn(turn, context, actionContext, runCtx);
            }

            if (rationale == null) {
                budgetExhausted = true;
                rationale = "Step budget exhausted after " + props.getMaxIterations() + " oracle turns";
                log.warn("Oracle hit the step budget ({}) [session={}, cycle={}]",
                        props.getMaxIterations(), sessionId, cycleNumber);
            }

            state.setAgentReasoning(rationale);
            state.setStateHealthy(true);

        } catch (Exception e) {
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            errorType = phase;
            log.error("Cycle failed [session={}, cycle={}, phase={}]", sessionId, cycleNumber, phase, e);
            recordError(state, error, errorType);
            if (e instanceof OracleConfigurationException) {
                log.error("Oracle configuration fault, marking state as fatal [session={}]", sessionId);
                state.setFatalError(true);
            }
        }

        Instant now = clock.instant();
        state.setCyclesCompleted(cycleNumber);
        state.setLastCycleTimestamp(now);
        state.setLastUpdateTimestamp(now);
        state.setLastInvokedActions(new ArrayList<>(context.getInvokedActions()));

        try {
            stateStore.save(state);
        } catch (StateStoreException e) {
            log.error("State could not be persisted [session={}, cycle={}]", sessionId, cycleNumber, e);
            error = e.getMessage();
            errorType = STATE_PERSISTENCE_FAILURE;
            recordError(state, error, errorType);
        }

        CycleOutcome outcome = CycleOutcome.builder()
                .state(state)
                .status(errorType == null ? CycleOutcome.Status.COMPLETED : CycleOutcome.Status.FAILED)
                .cycleNumber(cycleNumber)
                .invokedActions(state.getLastInvokedActions())
                .rationale(rationale)
                .iterations(context.getCurrentIteration())
                .stepBudgetExhausted(budgetExhausted)
                .latencyMs(runCtx.elapsedMs())
                .errorType(errorType)
                .error(error)
                .build();

        if (outcome.isIdle() && !outcome.isFailed()) {
            log.warn("Oracle invoked no actions this cycle [session={}, cycle={}]", sessionId, cycleNumber);
        }

        traceService.persistTrace(sessionId, cycleNumber, state.getTradingMode().wireName(), outcome, runCtx);

        log.info("Cycle complete [session={}, cycle={}, status={}, actions={}, failedActions={}, oracleCalls={}, latency={}ms, tokens={}]",
                sessionId, cycleNumber, outcome.getStatus(), outcome.getInvokedActions().size(),
                runCtx.failedActions(), runCtx.getOracleCalls(), outcome.getLatencyMs(), runCtx.totalTokens());

        return outcome;
    }

    private void executeTurn(OracleTurn turn, CycleContext context,
                             ActionContext actionContext, RunContext runCtx) {
        List<ActionInvocation> invocations = new ArrayList<>();
        for (ActionInvocation inv : turn.getInvocations()) {
            if (inv.getId() == null || inv.getId().isBlank()) {
                inv.setId("call_" + UUID.randomUUID().toString().substring(0, 8));
            }
            invocations.add(inv);
        }

        // The assistant message must carry the invocations so the provider can
        // pair each tool message below with the call that produced it
        context.getMessages().add(Message.builder()
                .role(Message.Role.assistant)
                .content(turn.getContent())
                .invocations(invocations)
                .build());

        for (ActionInvocation inv : invocations) {
            context.getInvokedActions().add(inv.getActionName());
            log.info("Oracle requested action: [{}] [session={}, cycle={}]",
                    inv.getActionName(), context.getSessionId(), context.getCycleNumber());

            long start = System.currentTimeMillis();
            ActionResult result = actionCatalog.dispatch(inv, actionContext);
            long latency = System.currentTimeMillis() - start;

            String observation = render(result);
            runCtx.recordAction(inv.getActionName(), inv.getArguments(), latency, result.isSuccess(), observation);

            context.getMessages().add(Message.builder()
                    .role(Message.Role.tool)
                    .toolCallId(inv.getId())
                    .name(inv.getActionName())
                    .content(observation)
                    .build());
        }
    }

    /** Parameter merge, trading-mode switch and error archival. */
    void prepare(AgentState state, Map<String, Object> overrides) {
        if (overrides != null && !overrides.isEmpty()) {
            state.getAgentParameters().putAll(overrides);

            if (overrides.containsKey(DRY_RUN_PARAM)) {
                TradingMode mode = TradingMode.fromDryRunFlag(asBoolean(overrides.get(DRY_RUN_PARAM), true));
                if (mode != state.getTradingMode()) {
                    log.warn("Trading mode changed [{} -> {}]", state.getTradingMode().wireName(), mode.wireName());
                }
                state.setTradingMode(mode);
            }
            if (overrides.containsKey(SHOULD_STOP_PARAM)) {
                state.setShouldStop(asBoolean(overrides.get(SHOULD_STOP_PARAM), false));
            }
        }

        if (state.hasError()) {
            List<ErrorRecord> history = state.getPreviousErrors();
            history.add(ErrorRecord.builder()
                    .error(state.getError())
                    .errorType(state.getErrorType())
                    .timestamp(state.getErrorTimestamp())
                    .resolved(true)
                    .build());
            while (history.size() > MAX_ERROR_HISTORY) {
                history.remove(0);
            }
        }
        state.setError(null);
        state.setErrorType(null);
        state.setErrorTimestamp(null);
    }

    private void recordError(AgentState state, String error, String errorType) {
        state.setError(error);
        state.setErrorType(errorType);
        state.setErrorTimestamp(clock.instant());
        state.setStateHealthy(false);
    }

    private String render(ActionResult result) {
        String json;
        try {
            json = observationMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("Action result could not be serialized: {}", e.getMessage());
            json = result.isSuccess()
                    ? "{\"success\":true,\"payload\":\"" + String.valueOf(result.getPayload()).replace("\"", "'") + "\"}"
                    : "{\"success\":false,\"error\":\"" + String.valueOf(result.getError()).replace("\"", "'") + "\"}";
        }
        int max = props.getMaxObservationChars();
        return json.length() <= max ? json : json.substring(0, max) + "...[truncated]";
    }

    static boolean asBoolean(Object value, boolean defaultValue) {
        if (value instanceof Boolean b) return b;
        if (value instanceof String s && !s.isBlank()) return Boolean.parseBoolean(s.trim());
        if (value instanceof Number n) return n.intValue() != 0;
        return defaultValue;
    }
}
