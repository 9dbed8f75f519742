package com.deepansh.trader.core;

import com.deepansh.trader.config.AgentProperties;
import com.deepansh.trader.config.AsyncConfig;
import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.state.AgentStateFactory;
import com.deepansh.trader.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackgroundRunnerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock CycleOrchestrator orchestrator;
    @Mock StateStore stateStore;

    private AgentProperties props;
    private AgentStateFactory stateFactory;
    private final List<Duration> sleeps = new ArrayList<>();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        props = new AgentProperties();
        props.getRunner().setStopTimeoutSeconds(5);
        stateFactory = new AgentStateFactory(props, clock);
    }

    private BackgroundRunner runner(TaskExecutor executor) {
        return new BackgroundRunner(orchestrator, stateStore, stateFactory, new AdaptiveSleepPolicy(props),
                props, executor, sleeps::add, clock);
    }

    private static CycleOutcome outcome(AgentState state, boolean failed) {
        return CycleOutcome.builder()
                .state(state)
                .status(failed ? CycleOutcome.Status.FAILED : CycleOutcome.Status.COMPLETED)
                .cycleNumber(state.getCyclesCompleted())
                .invokedActions(List.of("get_portfolio_summary"))
                .errorType(failed ? CycleOrchestrator.ORACLE_INVOCATION_FAILURE : null)
                .build();
    }

    @Test
    void stop_noActiveSession_returnsTrue() {
        assertThat(runner(new SyncTaskExecutor()).stop()).isTrue();
    }

    @Test
    void start_threeFailedCyclesInARow_endsSession() {
        when(stateStore.load()).thenReturn(Optional.empty());
        when(orchestrator.runCycle(any(), anyMap())).thenAnswer(inv -> outcome(inv.getArgument(0), true));
        BackgroundRunner runner = runner(new SyncTaskExecutor());

        assertThat(runner.start(Map.of())).isTrue();

        verify(orchestrator, times(3)).runCycle(any(), anyMap());
        assertThat(runner.isRunning()).isFalse();
        // errored cycles pause for at least the error floor between attempts
        assertThat(sleeps.stream().mapToLong(Duration::toSeconds).sum()).isEqualTo(2 * 600);
    }

    @Test
    void start_cycleThrows_countsTowardBreaker() {
        when(stateStore.load()).thenReturn(Optional.empty());
        when(orchestrator.runCycle(any(), anyMap())).thenThrow(new IllegalStateException("unexpected"));
        BackgroundRunner runner = runner(new SyncTaskExecutor());

        runner.start(Map.of());

        verify(orchestrator, times(3)).runCycle(any(), anyMap());
        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    void start_successAfterFailure_resetsBreaker() {
        when(stateStore.load()).thenReturn(Optional.empty());
        when(orchestrator.runCycle(any(), anyMap()))
                .thenAnswer(inv -> outcome(inv.getArgument(0), true))
                .thenAnswer(inv -> outcome(inv.getArgument(0), true))
                .thenAnswer(inv -> outcome(inv.getArgument(0), false))
                .thenAnswer(inv -> outcome(inv.getArgument(0), true))
                .thenAnswer(inv -> outcome(inv.getArgument(0), true))
                .thenAnswer(inv -> outcome(inv.getArgument(0), true));

        runner(new SyncTaskExecutor()).start(Map.of());

        verify(orchestrator, times(6)).runCycle(any(), anyMap());
    }

    @Test
    void start_maxCycles_endsAfterThatManyCycles() {
        when(stateStore.load()).thenReturn(Optional.empty());
        when(orchestrator.runCycle(any(), anyMap())).thenAnswer(inv -> outcome(inv.getArgument(0), false));

        runner(new SyncTaskExecutor()).start(Map.of("max_cycles", "2"));

        verify(orchestrator, times(2)).runCycle(any(), anyMap());
        assertThat(sleeps.stream().mapToLong(Duration::toSeconds).sum()).isEqualTo(300);
    }

    @SuppressWarnings("unchecked")
    @Test
    void start_parametersApplyToFirstCycleOnly() {
        when(stateStore.load()).thenReturn(Optional.empty());
        when(orchestrator.runCycle(any(), anyMap())).thenAnswer(inv -> outcome(inv.getArgument(0), false));

        runner(new SyncTaskExecutor()).start(Map.of("max_cycles", 2));

        ArgumentCaptor<Map<String, Object>> overrides = ArgumentCaptor.forClass(Map.class);
        verify(orchestrator, times(2)).runCycle(any(), overrides.capture());
        assertThat(overrides.getAllValues().get(0)).containsEntry("max_cycles", 2);
        assertThat(overrides.getAllValues().get(1)).isEmpty();
    }

    @Test
    void start_shouldStopMarker_endsAfterCycle() {
        when(stateStore.load()).thenReturn(Optional.empty());
        when(orchestrator.runCycle(any(), anyMap())).thenAnswer(inv -> {
            AgentState state = inv.getArgument(0);
            state.setShouldStop(true);
            return outcome(state, false);
        });

        runner(new SyncTaskExecutor()).start(Map.of());

        verify(orchestrator, times(1)).runCycle(any(), anyMap());
        assertThat(sleeps).isEmpty();
    }

    @Test
    void start_fatalErrorMarker_endsAfterCycle() {
        when(stateStore.load()).thenReturn(Optional.empty());
        when(orchestrator.runCycle(any(), anyMap())).thenAnswer(inv -> {
            AgentState state = inv.getArgument(0);
            state.setFatalError(true);
            return outcome(state, true);
        });

        runner(new SyncTaskExecutor()).start(Map.of());

        verify(orchestrator, times(1)).runCycle(any(), anyMap());
    }

    @Test
    void start_sessionEnd_isPersistedAsInactive() {
        when(stateStore.load()).thenReturn(Optional.empty());
        when(orchestrator.runCycle(any(), anyMap())).thenAnswer(inv -> outcome(inv.getArgument(0), false));

        runner(new SyncTaskExecutor()).start(Map.of("max_cycles", 1));

        ArgumentCaptor<AgentState> saved = ArgumentCaptor.forClass(AgentState.class);
        verify(stateStore, atLeastOnce()).save(saved.capture());
        AgentState last = saved.getValue();
        assertThat(last.isSessionActive()).isFalse();
        assertThat(last.getSessionEndTimestamp()).isEqualTo(NOW);
        assertThat(last.getSessionId()).isEqualTo("trading_session_20250301_120000");
    }

    @Test
    void start_executorRejects_releasesSlot() {
        when(stateStore.load()).thenReturn(Optional.empty());
        BackgroundRunner runner = runner(task -> {
            throw new TaskRejectedException("busy");
        });

        assertThat(runner.start(Map.of())).isFalse();
        assertThat(runner.isRunning()).isFalse();
        verify(orchestrator, never()).runCycle(any(), anyMap());
    }

    @Test
    void start_whileSessionActive_isRejected_andStopJoinsWorker() throws Exception {
        CountDownLatch inCycle = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(stateStore.load()).thenReturn(Optional.empty());
        when(orchestrator.runCycle(any(), anyMap())).thenAnswer(inv -> {
            inCycle.countDown();
            release.await(5, TimeUnit.SECONDS);
            return outcome(inv.getArgument(0), false);
        });
        BackgroundRunner runner = runner(task -> new Thread(task, "cycle-runner-test").start());

        assertThat(runner.start(Map.of())).isTrue();
        assertThat(inCycle.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(runner.start(Map.of())).isFalse();
        assertThat(runner.isRunning()).isTrue();
        assertThat(runner.status().isRunning()).isTrue();

        release.countDown();
        assertThat(runner.stop()).isTrue();
        assertThat(runner.isRunning()).isFalse();
        assertThat(runner.status().isRunning()).isFalse();
    }

    @Test
    void start_oversizedMaxCycles_isIgnoredAndSlotIsReleased() {
        when(stateStore.load()).thenReturn(Optional.empty());
        when(orchestrator.runCycle(any(), anyMap())).thenAnswer(inv -> outcome(inv.getArgument(0), true));
        BackgroundRunner runner = runner(new SyncTaskExecutor());

        assertThat(runner.start(Map.of("max_cycles", "99999999999999999999"))).isTrue();

        // the breaker, not a parse failure, ended the session
        verify(orchestrator, times(3)).runCycle(any(), anyMap());
        assertThat(runner.isRunning()).isFalse();
        assertThat(runner.stop()).isTrue();
        assertThat(runner.start(Map.of("max_cycles", 1))).isTrue();
    }

    @Test
    void stopThenStart_onCycleRunnerExecutor_isNeverRejected() {
        when(stateStore.load()).thenReturn(Optional.empty());
        when(orchestrator.runCycle(any(), anyMap())).thenAnswer(inv -> outcome(inv.getArgument(0), false));
        ThreadPoolTaskExecutor executor = new AsyncConfig().cycleRunnerExecutor();
        BackgroundRunner runner = new BackgroundRunner(orchestrator, stateStore, stateFactory,
                new AdaptiveSleepPolicy(props), props, executor, d -> Thread.sleep(1), clock);

        try {
            for (int i = 0; i < 100; i++) {
                assertThat(runner.start(Map.of())).as("start #%d", i).isTrue();
                assertThat(runner.stop()).as("stop #%d", i).isTrue();
            }
        } finally {
            executor.shutdown();
        }
    }
}
