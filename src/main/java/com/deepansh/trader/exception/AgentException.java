package com.deepansh.trader.exception;

/**
 * Root unchecked exception for the trading agent.
 *
 * Thrown for faults that should not be retried: bad configuration,
 * malformed responses, precondition violations inside collaborators.
 * Transient transport faults stay as plain RuntimeExceptions so the
 * resilience4j retry/circuit-breaker policies can act on them.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
