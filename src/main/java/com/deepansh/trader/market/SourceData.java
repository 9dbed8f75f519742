package com.deepansh.trader.market;

import java.time.Instant;

/**
 * Best-effort payload from one external source plus an explicit availability marker.
 * An unavailable source is a normal value, not an exception: callers combine
 * whatever subset of sources answered.
 */
public record SourceData(String source, boolean available, Object payload, String error, Instant fetchedAt) {

    public static SourceData available(String source, Object payload, Instant fetchedAt) {
        return new SourceData(source, true, payload, null, fetchedAt);
    }

    public static SourceData unavailable(String source, String error, Instant fetchedAt) {
        return new SourceData(source, false, null, error, fetchedAt);
    }
}
