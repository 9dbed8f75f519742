package com.deepansh.trader.core;

import com.deepansh.trader.action.ActionCatalog;
import com.deepansh.trader.config.AgentProperties;
import com.deepansh.trader.exception.OracleConfigurationException;
import com.deepansh.trader.exception.StateStoreException;
import com.deepansh.trader.model.ActionInvocation;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.model.Message;
import com.deepansh.trader.model.OracleTurn;
import com.deepansh.trader.model.TradingMode;
import com.deepansh.trader.observability.TraceService;
import com.deepansh.trader.oracle.OracleClient;
import com.deepansh.trader.state.AgentStateFactory;
import com.deepansh.trader.state.StateStore;
import com.deepansh.trader.trading.PortfolioValuator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CycleOrchestratorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock OracleClient oracleClient;
    @Mock ActionCatalog actionCatalog;
    @Mock StateStore stateStore;
    @Mock PortfolioValuator valuator;
    @Mock TraceService traceService;

    private AgentProperties props;
    private AgentStateFactory stateFactory;
    private CycleOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        props = new AgentProperties();
        props.setMaxIterations(5);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        stateFactory = new AgentStateFactory(props, clock);
        orchestrator = new CycleOrchestrator(oracleClient, actionCatalog, stateStore, stateFactory, valuator,
                new CyclePromptBuilder(mapper), traceService, props, mapper, clock);
    }

    private static OracleTurn invoke(String... actions) {
        List<ActionInvocation> invocations = new ArrayList<>();
        for (String action : actions) {
            invocations.add(ActionInvocation.builder().actionName(action).arguments(Map.of()).build());
        }
        return OracleTurn.builder().invocations(invocations).promptTokens(10).completionTokens(5).build();
    }

    private static OracleTurn answer(String text) {
        return OracleTurn.builder().content(text).build();
    }

    @Test
    void runCycle_noInvocations_advancesCounterAndPersists() {
        AgentState state = stateFactory.createInitial();
        state.setCyclesCompleted(41);
        when(oracleClient.chat(anyList(), anyList())).thenReturn(answer("Market is quiet, holding."));

        CycleOutcome outcome = orchestrator.runCycle(state, Map.of());

        assertThat(outcome.isFailed()).isFalse();
        assertThat(outcome.isIdle()).isTrue();
        assertThat(outcome.getCycleNumber()).isEqualTo(42);
        assertThat(state.getCyclesCompleted()).isEqualTo(42);
        assertThat(state.getAgentReasoning()).isEqualTo("Market is quiet, holding.");
        assertThat(state.getLastCycleTimestamp()).isEqualTo(NOW);
        assertThat(state.isStateHealthy()).isTrue();
        verify(stateStore).save(state);
        verify(traceService).persistTrace(eq("foreground"), eq(42L), eq("dry_run"), eq(outcome), any());
    }

    @Test
    void runCycle_stateWithoutTradingMode_runsInDryRun() {
        AgentState state = stateFactory.createInitial();
        state.setTradingMode(null);
        state.setCyclesCompleted(4);
        when(oracleClient.chat(anyList(), anyList())).thenReturn(answer("Holding."));

        CycleOutcome outcome = orchestrator.runCycle(state, Map.of());

        assertThat(outcome.isFailed()).isFalse();
        assertThat(state.getTradingMode()).isEqualTo(TradingMode.DRY_RUN);
        assertThat(state.getCyclesCompleted()).isEqualTo(5);
        verify(stateStore).save(state);
    }

    @Test
    void runCycle_discoverEnrichTrade_dispatchesInOrderAndPairsObservations() {
        AgentState state = stateFactory.createInitial();
        List<List<Message>> conversations = new ArrayList<>();
        when(oracleClient.chat(anyList(), anyList())).thenAnswer(inv -> {
            List<Message> messages = inv.getArgument(0);
            conversations.add(new ArrayList<>(messages));
            return switch (conversations.size()) {
                case 1 -> invoke("discover_tokens");
                case 2 -> invoke("get_comprehensive_token_data", "get_swap_quote");
                case 3 -> invoke("execute_trade");
                default -> answer("Bought a small dry-run position.");
            };
        });
        when(actionCatalog.dispatch(any(), any())).thenReturn(ActionResult.ok(Map.of("ok", true)));

        CycleOutcome outcome = orchestrator.runCycle(state, Map.of());

        assertThat(outcome.getInvokedActions()).containsExactly(
                "discover_tokens", "get_comprehensive_token_data", "get_swap_quote", "execute_trade");
        assertThat(state.getLastInvokedActions()).isEqualTo(outcome.getInvokedActions());
        assertThat(outcome.getIterations()).isEqualTo(4);
        assertThat(state.getCyclesCompleted()).isEqualTo(1);
        verify(actionCatalog, times(4)).dispatch(any(), any());

        List<Message> secondRequest = conversations.get(1);
        Message assistant = secondRequest.get(2);
        Message tool = secondRequest.get(3);
        assertThat(assistant.getRole()).isEqualTo(Message.Role.assistant);
        assertThat(assistant.getInvocations()).singleElement()
                .satisfies(i -> assertThat(i.getId()).startsWith("call_"));
        assertThat(tool.getRole()).isEqualTo(Message.Role.tool);
        assertThat(tool.getToolCallId()).isEqualTo(assistant.getInvocations().get(0).getId());
        assertThat(tool.getContent()).contains("\"success\":true");
    }

    @Test
    void runCycle_stepBudgetExhausted_isCompletedWithBudgetRationale() {
        AgentState state = stateFactory.createInitial();
        when(oracleClient.chat(anyList(), anyList())).thenAnswer(inv -> invoke("get_portfolio_summary"));
        when(actionCatalog.dispatch(any(), any())).thenReturn(ActionResult.ok(Map.of()));

        CycleOutcome outcome = orchestrator.runCycle(state, Map.of());

        assertThat(outcome.isStepBudgetExhausted()).isTrue();
        assertThat(outcome.isFailed()).isFalse();
        assertThat(outcome.getInvokedActions()).hasSize(5);
        assertThat(state.getAgentReasoning()).contains("Step budget exhausted");
    }

    @Test
    void runCycle_oracleFailure_recordsErrorAndStillPersists() {
        AgentState state = stateFactory.createInitial();
        when(oracleClient.chat(anyList(), anyList())).thenThrow(new RuntimeException("provider down"));

        CycleOutcome outcome = orchestrator.runCycle(state, Map.of());

        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.getErrorType()).isEqualTo(CycleOrchestrator.ORACLE_INVOCATION_FAILURE);
        assertThat(state.getError()).isEqualTo("provider down");
        assertThat(state.getErrorType()).isEqualTo("oracle_invocation_failure");
        assertThat(state.getErrorTimestamp()).isEqualTo(NOW);
        assertThat(state.isStateHealthy()).isFalse();
        assertThat(state.isFatalError()).isFalse();
        assertThat(state.getCyclesCompleted()).isEqualTo(1);
        verify(stateStore).save(state);
    }

    @Test
    void runCycle_oracleConfigurationFault_marksStateFatal() {
        AgentState state = stateFactory.createInitial();
        when(oracleClient.chat(anyList(), anyList()))
                .thenThrow(new OracleConfigurationException("API key is invalid"));

        orchestrator.runCycle(state, Map.of());

        assertThat(state.isFatalError()).isTrue();
        assertThat(state.getErrorType()).isEqualTo(CycleOrchestrator.ORACLE_INVOCATION_FAILURE);
    }

    @Test
    void runCycle_dispatchThrows_isActionExecutionFailure() {
        AgentState state = stateFactory.createInitial();
        when(oracleClient.chat(anyList(), anyList())).thenReturn(invoke("discover_tokens"));
        when(actionCatalog.dispatch(any(), any())).thenThrow(new IllegalStateException("boom"));

        CycleOutcome outcome = orchestrator.runCycle(state, Map.of());

        assertThat(outcome.getErrorType()).isEqualTo(CycleOrchestrator.ACTION_EXECUTION_FAILURE);
        assertThat(state.getLastInvokedActions()).containsExactly("discover_tokens");
    }

    @Test
    void runCycle_revaluationThrows_isContextBuildFailure() {
        AgentState state = stateFactory.createInitial();
        doThrow(new IllegalStateException("price feed")).when(valuator).revalue(state);

        CycleOutcome outcome = orchestrator.runCycle(state, Map.of());

        assertThat(outcome.getErrorType()).isEqualTo(CycleOrchestrator.CONTEXT_BUILD_FAILURE);
        verify(oracleClient, never()).chat(anyList(), anyList());
        verify(stateStore).save(state);
    }

    @Test
    void runCycle_saveFails_reportsPersistenceFailure() {
        AgentState state = stateFactory.createInitial();
        when(oracleClient.chat(anyList(), anyList())).thenReturn(answer("done"));
        doThrow(new StateStoreException("disk full", new IOException("disk full"))).when(stateStore).save(state);

        CycleOutcome outcome = orchestrator.runCycle(state, Map.of());

        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.getErrorType()).isEqualTo(CycleOrchestrator.STATE_PERSISTENCE_FAILURE);
        assertThat(state.getCyclesCompleted()).isEqualTo(1);
    }

    @Test
    void runCycle_previousError_isArchivedAndCleared() {
        AgentState state = stateFactory.createInitial();
        state.setError("old failure");
        state.setErrorType("oracle_invocation_failure");
        state.setErrorTimestamp(NOW.minusSeconds(600));
        when(oracleClient.chat(anyList(), anyList())).thenReturn(answer("recovered"));

        orchestrator.runCycle(state, Map.of());

        assertThat(state.getError()).isNull();
        assertThat(state.getErrorType()).isNull();
        assertThat(state.getPreviousErrors()).singleElement().satisfies(record -> {
            assertThat(record.getError()).isEqualTo("old failure");
            assertThat(record.isResolved()).isTrue();
        });
    }

    @Test
    void prepare_errorHistory_isBounded() {
        AgentState state = stateFactory.createInitial();
        for (int i = 0; i < CycleOrchestrator.MAX_ERROR_HISTORY + 5; i++) {
            state.setError("e" + i);
            orchestrator.prepare(state, Map.of());
        }

        assertThat(state.getPreviousErrors()).hasSize(CycleOrchestrator.MAX_ERROR_HISTORY);
        assertThat(state.getPreviousErrors().get(0).getError()).isEqualTo("e5");
    }

    @Test
    void prepare_overrides_mergeParametersAndSwitchMode() {
        AgentState state = stateFactory.createInitial();

        orchestrator.prepare(state, Map.of("dry_run", "false", "should_stop", true, "cycle_time_seconds", 60));

        assertThat(state.getTradingMode()).isEqualTo(TradingMode.LIVE);
        assertThat(state.isShouldStop()).isTrue();
        assertThat(state.getAgentParameters()).containsEntry("cycle_time_seconds", 60);
    }

    @Test
    void runSingleCycle_noPersistedState_startsFromDefaults() {
        when(stateStore.load()).thenReturn(Optional.empty());
        when(oracleClient.chat(anyList(), anyList())).thenReturn(answer("ok"));

        CycleOutcome outcome = orchestrator.runSingleCycle(null);

        assertThat(outcome.getCycleNumber()).isEqualTo(1);
        assertThat(outcome.getState().getTradingMode()).isEqualTo(TradingMode.DRY_RUN);
        verify(traceService).persistTrace(anyString(), anyLong(), anyString(), any(), any());
    }

    @Test
    void asBoolean_acceptsCommonEncodings() {
        assertThat(CycleOrchestrator.asBoolean("true", false)).isTrue();
        assertThat(CycleOrchestrator.asBoolean(0, true)).isFalse();
        assertThat(CycleOrchestrator.asBoolean(null, true)).isTrue();
    }
}
