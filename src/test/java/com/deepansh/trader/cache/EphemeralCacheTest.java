package com.deepansh.trader.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class EphemeralCacheTest {

    private MutableClock clock;
    private EphemeralCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T00:00:00Z"));
        cache = new EphemeralCache(clock);
    }

    @Test
    void get_beforeExpiry_returnsValue() {
        cache.put("k", "v", Duration.ofSeconds(30));
        clock.advance(Duration.ofSeconds(29));

        assertThat(cache.get("k")).contains("v");
    }

    @Test
    void get_atExactExpiry_isAbsentAndCountsEviction() {
        cache.put("k", "v", Duration.ofSeconds(30));
        clock.advance(Duration.ofSeconds(30));

        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.stats().evictions()).isEqualTo(1);
        assertThat(cache.stats().entries()).isZero();
    }

    @Test
    void typedGet_wrongType_isAbsent() {
        cache.put("k", 42, Duration.ofMinutes(1));

        assertThat(cache.get("k", String.class)).isEmpty();
        assertThat(cache.get("k", Integer.class)).contains(42);
    }

    @Test
    void getOrLoad_secondCallServedFromCache() {
        AtomicInteger loads = new AtomicInteger();

        String first = cache.getOrLoad("k", String.class, Duration.ofMinutes(1), () -> "v" + loads.incrementAndGet());
        String second = cache.getOrLoad("k", String.class, Duration.ofMinutes(1), () -> "v" + loads.incrementAndGet());

        assertThat(first).isEqualTo("v1");
        assertThat(second).isEqualTo("v1");
        assertThat(loads).hasValue(1);
    }

    @Test
    void getOrLoad_nullFromLoader_isNotCached() {
        AtomicInteger loads = new AtomicInteger();

        cache.getOrLoad("k", String.class, Duration.ofMinutes(1), () -> { loads.incrementAndGet(); return null; });
        cache.getOrLoad("k", String.class, Duration.ofMinutes(1), () -> { loads.incrementAndGet(); return null; });

        assertThat(loads).hasValue(2);
        assertThat(cache.stats().puts()).isZero();
    }

    @Test
    void sweepExpired_removesOnlyExpiredEntries() {
        cache.put("short", "a", Duration.ofSeconds(10));
        cache.put("long", "b", Duration.ofMinutes(10));
        clock.advance(Duration.ofSeconds(11));

        assertThat(cache.sweepExpired()).isEqualTo(1);
        assertThat(cache.stats().entries()).isEqualTo(1);
        assertThat(cache.get("long")).contains("b");
    }

    @Test
    void stats_tracksHitsAndMisses() {
        cache.put("k", "v", Duration.ofMinutes(1));
        cache.get("k");
        cache.get("missing");

        CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
    }

    @Test
    void clear_removesSingleKey() {
        cache.put("a", "1", Duration.ofMinutes(1));
        cache.put("b", "2", Duration.ofMinutes(1));

        assertThat(cache.clear("a")).isTrue();
        assertThat(cache.clear("a")).isFalse();
        assertThat(cache.get("b")).contains("2");
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
