package com.deepansh.trader.resilience;

import com.deepansh.trader.action.ActionDefinition;
import com.deepansh.trader.exception.AgentException;
import com.deepansh.trader.model.Message;
import com.deepansh.trader.model.OracleTurn;
import com.deepansh.trader.oracle.OracleClient;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the raw oracle client that adds retry and circuit breaker.
 *
 * Retry config (application.yml, instance "oracle"):
 * - 3 attempts, exponential backoff 2s then 4s
 * - AgentException (bad request, bad key, decommissioned model) is not retried
 *
 * Circuit breaker config:
 * - Opens at 50% failures over a window of 10 calls, probes again after 60s
 *
 * The fallback does not invent an answer. It rethrows as AgentException so the
 * orchestrator records a failed cycle and the runner's error counter sees it.
 */
@Component
@Primary
@Slf4j
public class ResilientOracleClient implements OracleClient {

    private final OracleClient delegate;

    public ResilientOracleClient(@Qualifier("rawOracleClient") OracleClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "oracle", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "oracle")
    public OracleTurn chat(List<Message> messages, List<ActionDefinition> actions) {
        return delegate.chat(messages, actions);
    }

    /** All attempts exhausted, the call was not retryable, or the circuit is open. */
    public OracleTurn retryFallback(List<Message> messages, List<ActionDefinition> actions, Exception ex) {
        if (ex instanceof AgentException agentException) {
            log.error("Oracle call rejected: {}", ex.getMessage());
            throw agentException;
        }
        log.error("Oracle call failed after all retries: {}", ex.getMessage());
        throw new AgentException("Reasoning oracle unavailable: " + ex.getMessage(), ex);
    }
}
