package com.deepansh.trader.core;

import com.deepansh.trader.config.AgentProperties;
import com.deepansh.trader.exception.StateStoreException;
import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.state.AgentStateFactory;
import com.deepansh.trader.state.StateStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loops the cycle orchestrator on a dedicated worker until told to stop.
 *
 * At most one session per process: {@link #start} claims the single session
 * slot with a compare-and-set, and the worker releases it on exit. The state
 * returned by each cycle is fed into the next one.
 *
 * The worker ends on a stop request, a should_stop or fatal_error marker in
 * the state, the optional max_cycles parameter, or after
 * {@code agent.runner.max-consecutive-errors} failed cycles in a row.
 * Cancellation is cooperative: it is observed between cycles and between
 * sleep slices, never inside an oracle call or a submission.
 */
@Service
@Slf4j
public class BackgroundRunner {

    public static final String MAX_CYCLES_PARAM = "max_cycles";

    private static final DateTimeFormatter SESSION_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final AtomicReference<RunnerSession> slot = new AtomicReference<>();

    private final CycleOrchestrator orchestrator;
    private final StateStore stateStore;
    private final AgentStateFactory stateFactory;
    private final AdaptiveSleepPolicy sleepPolicy;
    private final AgentProperties props;
    private final TaskExecutor executor;
    private final Sleeper sleeper;
    private final Clock clock;

    public BackgroundRunner(CycleOrchestrator orchestrator,
                            StateStore stateStore,
                            AgentStateFactory stateFactory,
                            AdaptiveSleepPolicy sleepPolicy,
                            AgentProperties props,
                            @Qualifier("cycleRunnerExecutor") TaskExecutor executor,
                            Sleeper sleeper,
                            Clock clock) {
        this.orchestrator = orchestrator;
        this.stateStore = stateStore;
        this.stateFactory = stateFactory;
        this.sleepPolicy = sleepPolicy;
        this.props = props;
        this.executor = executor;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Starts a session. False if one is already active or the worker could not be launched.
     * The parameters are applied to the first cycle only; they persist through the state.
     */
    public boolean start(Map<String, Object> params) {
        RunnerSession session = new RunnerSession(
                "trading_session_" + SESSION_ID_FORMAT.format(clock.instant()), clock.instant());

        if (!slot.compareAndSet(null, session)) {
            log.warn("Start rejected, session already active [session={}]", slot.get() != null ? slot.get().getId() : "?");
            return false;
        }

        try {
            AgentState state = stateStore.load().orElseGet(stateFactory::createInitial);
            state.setSessionActive(true);
            state.setSessionId(session.getId());
            state.setSessionStartTimestamp(session.getStartedAt());
            state.setSessionEndTimestamp(null);
            state.setShouldStop(false);
            state.setFatalError(false);
            stateStore.save(state);
            session.setLastState(state);

            Map<String, Object> firstCycleParams = params != null ? new LinkedHashMap<>(params) : Map.of();
            executor.execute(() -> runSession(session, state, firstCycleParams));

        } catch (TaskRejectedException | StateStoreException e) {
            log.error("Could not start background session [session={}]: {}", session.getId(), e.getMessage(), e);
            slot.compareAndSet(session, null);
            session.markFinished();
            return false;
        }

        log.info("Background session started [session={}, params={}]", session.getId(), params);
        return true;
    }

    /**
     * Requests a stop and waits up to {@code agent.runner.stop-timeout-seconds} for the worker.
     * True when no session was active or the worker exited in time.
     */
    public boolean stop() {
        RunnerSession session = slot.get();
        if (session == null) {
            log.info("Stop requested with no active session");
            return true;
        }

        log.info("Stop requested [session={}]", session.getId());
        session.requestStop();

        Duration timeout = props.getRunner().getStopTimeout();
        boolean exited = session.awaitFinished(timeout);
        if (!exited) {
            log.warn("Worker did not stop gracefully within {}s [session={}]", timeout.toSeconds(), session.getId());
        }
        return exited;
    }

    public RunnerStatus status() {
        RunnerSession session = slot.get();
        AgentState state = session != null && session.getLastState() != null
                ? session.getLastState()
                : stateStore.load().orElseGet(stateFactory::createInitial);
        return RunnerStatus.of(state, session);
    }

    public boolean isRunning() {
        return slot.get() != null;
    }

    RunnerSession currentSession() {
        return slot.get();
    }

    @PreDestroy
    void shutdown() {
        if (slot.get() != null) {
            log.info("Application shutting down, stopping background session");
            stop();
        }
    }

    // ─── Worker ─────────────────────────────────────────────────────────────

    void runSession(RunnerSession session, AgentState initialState, Map<String, Object> firstCycleParams) {
        AgentState state = initialState;
        Map<String, Object> overrides = firstCycleParams;
        int maxErrors = props.getRunner().getMaxConsecutiveErrors();

        try {
            Long maxCycles = Params.positiveLong(firstCycleParams.get(MAX_CYCLES_PARAM));
            log.info("Worker running [session={}, maxCycles={}]", session.getId(), maxCycles);

            while (!session.isStopRequested()) {
                boolean errored;
                boolean idle;

                try {
                    CycleOutcome outcome = orchestrator.runCycle(state, overrides);
                    state = outcome.getState();
                    session.setLastState(state);
                    long done = session.recordCycle();
                    errored = outcome.isFailed();
                    idle = outcome.isIdle();

                    if (errored) {
                        int errors = session.recordError();
                        log.warn("Cycle errored [session={}, cycle={}, consecutiveErrors={}/{}, type={}]: {}",
                                session.getId(), outcome.getCycleNumber(), errors, maxErrors,
                                outcome.getErrorType(), outcome.getError());
                    } else {
                        session.resetErrors();
                    }
                    log.debug("Session progress [session={}, sessionCycles={}]", session.getId(), done);

                } catch (Exception e) {
                    int errors = session.recordError();
                    log.error("Cycle threw out of the orchestrator [session={}, consecutiveErrors={}/{}]",
                            session.getId(), errors, maxErrors, e);
                    overrides = Map.of();
                    if (errors >= maxErrors) {
                        log.error("Circuit breaker open, ending session [session={}]", session.getId());
                        break;
                    }
                    pause(session, Duration.ofSeconds(props.getRunner().getCycleExceptionPauseSeconds()));
                    continue;
                }
                overrides = Map.of();

                if (session.getConsecutiveErrors() >= maxErrors) {
                    log.error("Circuit breaker open after {} consecutive errors, ending session [session={}]",
                            session.getConsecutiveErrors(), session.getId());
                    break;
                }
                if (state.isShouldStop()) {
                    log.info("Stop marker found in state, ending session [session={}]", session.getId());
                    break;
                }
                if (state.isFatalError()) {
                    log.error("Fatal error marker found in state, ending session [session={}]", session.getId());
                    break;
                }
                if (maxCycles != null && session.getSessionCycles() >= maxCycles) {
                    log.info("Reached max_cycles={}, ending session [session={}]", maxCycles, session.getId());
                    break;
                }

                Duration delay = sleepPolicy.nextDelay(state.getAgentParameters(), errored, idle);
                log.info("Next cycle in {}s [session={}, errored={}, idle={}]",
                        delay.toSeconds(), session.getId(), errored, idle);
                pause(session, delay);
            }
        } finally {
            finish(session, state);
        }
    }

    /** Sleeps in slices so a stop request is seen within one slice. */
    private void pause(RunnerSession session, Duration total) {
        Duration slice = props.getRunner().getSleepSlice();
        Duration remaining = total;
        try {
            while (!remaining.isZero() && !remaining.isNegative() && !session.isStopRequested()) {
                Duration step = remaining.compareTo(slice) < 0 ? remaining : slice;
                sleeper.sleep(step);
                remaining = remaining.minus(step);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted while sleeping [session={}]", session.getId());
            session.requestStop();
        }
    }

    private void finish(RunnerSession session, AgentState state) {
        try {
            AgentState latest = session.getLastState() != null ? session.getLastState() : state;
            latest.setSessionActive(false);
            latest.setSessionEndTimestamp(clock.instant());
            stateStore.save(latest);
        } catch (StateStoreException e) {
            log.error("Could not persist session end [session={}]", session.getId(), e);
        } finally {
            // Free the slot before releasing waiters so a start() right after stop() succeeds
            slot.compareAndSet(session, null);
            session.markFinished();
            log.info("Background session ended [session={}, sessionCycles={}]",
                    session.getId(), session.getSessionCycles());
        }
    }
}
