package com.deepansh.trader.core;

import com.deepansh.trader.model.AgentState;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Handle of one background session: its identity, its cancellation token and
 * its join point. Owned by the runner's single session slot.
 */
public class RunnerSession {

    private final String id;
    private final Instant startedAt;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicInteger consecutiveErrors = new AtomicInteger();
    private final AtomicLong sessionCycles = new AtomicLong();

    /** Newest state the worker holds; read by status snapshots */
    private volatile AgentState lastState;

    public RunnerSession(String id, Instant startedAt) {
        this.id = id;
        this.startedAt = startedAt;
    }

    public String getId() {
        return id;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /** Waits for the worker to exit. False if it is still running after the timeout. */
    public boolean awaitFinished(Duration timeout) {
        try {
            return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isAlive() {
        return finished.getCount() > 0;
    }

    void markFinished() {
        finished.countDown();
    }

    int recordError() {
        return consecutiveErrors.incrementAndGet();
    }

    void resetErrors() {
        consecutiveErrors.set(0);
    }

    public int getConsecutiveErrors() {
        return consecutiveErrors.get();
    }

    long recordCycle() {
        return sessionCycles.incrementAndGet();
    }

    public long getSessionCycles() {
        return sessionCycles.get();
    }

    public AgentState getLastState() {
        return lastState;
    }

    void setLastState(AgentState lastState) {
        this.lastState = lastState;
    }
}
