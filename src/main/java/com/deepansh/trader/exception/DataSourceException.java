package com.deepansh.trader.exception;

/**
 * A market/safety/social collaborator could not be reached or returned garbage.
 */
public class DataSourceException extends AgentException {

    private final String source;

    public DataSourceException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public DataSourceException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
