package com.deepansh.trader.core;

import java.time.Duration;

/** Blocking wait, swappable in tests so backoff and inter-cycle pauses run without real delays. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
