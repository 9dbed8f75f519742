package com.deepansh.trader.market;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Resilience wrapper shared by the market data clients.
 *
 * Each source gets its own circuit breaker built from the "marketData" config, so a
 * RugCheck outage does not short-circuit DexScreener. Retries run inside the breaker:
 * one exhausted retry sequence counts as a single failed call.
 * An open breaker throws {@link io.github.resilience4j.circuitbreaker.CallNotPermittedException}.
 */
@Component
public class MarketDataGuard {

    static final String CONFIG = "marketData";

    private final Retry retry;
    private final CircuitBreakerRegistry breakers;

    public MarketDataGuard(RetryRegistry retryRegistry, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.retry = retryRegistry.retry(CONFIG);
        this.breakers = circuitBreakerRegistry;
    }

    public <T> T call(String source, Supplier<T> request) {
        return CircuitBreaker.decorateSupplier(breaker(source), Retry.decorateSupplier(retry, request)).get();
    }

    public CircuitBreaker.State state(String source) {
        return breaker(source).getState();
    }

    private CircuitBreaker breaker(String source) {
        return breakers.getConfiguration(CONFIG)
                .map(config -> breakers.circuitBreaker(source, config))
                .orElseGet(() -> breakers.circuitBreaker(source));
    }
}
