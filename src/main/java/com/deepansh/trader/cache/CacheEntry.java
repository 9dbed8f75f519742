package com.deepansh.trader.cache;

import java.time.Instant;

/**
 * One cached payload. Visible iff {@code now < expiresAt}.
 */
public record CacheEntry(String key, Object payload, Instant createdAt, Instant expiresAt) {

    public boolean isVisibleAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
