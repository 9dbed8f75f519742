package com.deepansh.trader.action.input;

/** Input of the telemetry actions, which take no arguments */
public record EmptyInput() {
}
