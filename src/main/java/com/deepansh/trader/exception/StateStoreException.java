package com.deepansh.trader.exception;

public class StateStoreException extends AgentException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
