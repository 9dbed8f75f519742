package com.deepansh.trader.exception;

/**
 * The reasoning oracle rejected the request because of how it is configured
 * (invalid API key, decommissioned model). Retrying cannot help, so the
 * orchestrator marks the state as fatally errored and the runner ends the session.
 */
public class OracleConfigurationException extends AgentException {

    public OracleConfigurationException(String message) {
        super(message);
    }
}
