package com.deepansh.trader.action;

public enum ActionCategory {

    /** Read-only views of wallet, portfolio and system health */
    TELEMETRY,
    DISCOVERY,
    /** Pure mechanical filter/sort over candidate lists */
    FILTER,
    ENRICHMENT,
    MEMORY,
    /** Quotes and the safety-gated trade itself */
    EXECUTION
}
