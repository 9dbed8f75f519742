package com.deepansh.trader.solana;

import com.deepansh.trader.exception.AgentException;

/** JSON-RPC error object or transport failure talking to a Solana node. */
public class RpcException extends AgentException {

    private final Integer code;

    public RpcException(String message) {
        this(message, (Integer) null);
    }

    public RpcException(String message, Integer code) {
        super(message);
        this.code = code;
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
        this.code = null;
    }

    public Integer getCode() {
        return code;
    }
}
