package com.deepansh.trader.market;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Passive health record of one source, fed by its real traffic.
 * check_system_status reports it without spending rate-limited calls on probes.
 */
public class SourceHealth {

    private final String source;
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile Instant lastSuccess;
    private volatile Instant lastFailure;
    private volatile String lastError;

    public SourceHealth(String source) {
        this.source = source;
    }

    public void recordSuccess(Instant at) {
        successes.incrementAndGet();
        lastSuccess = at;
    }

    public void recordFailure(String error, Instant at) {
        failures.incrementAndGet();
        lastFailure = at;
        lastError = error;
    }

    /** unknown until the first call, then healthy or degraded by whichever outcome came last */
    public String status() {
        if (lastSuccess == null && lastFailure == null) return "unknown";
        if (lastFailure == null) return "healthy";
        if (lastSuccess == null) return "degraded";
        return lastSuccess.isAfter(lastFailure) ? "healthy" : "degraded";
    }

    public Map<String, Object> snapshot(boolean configured) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("source", source);
        m.put("configured", configured);
        m.put("status", configured ? status() : "not_configured");
        m.put("successes", successes.get());
        m.put("failures", failures.get());
        m.put("last_success", lastSuccess != null ? lastSuccess.toString() : null);
        m.put("last_error", lastError);
        return m;
    }
}
