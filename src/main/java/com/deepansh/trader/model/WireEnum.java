package com.deepansh.trader.model;

/**
 * Enum whose JSON form is a stable snake_case name rather than the constant name.
 * The action schema generator lists these names as the allowed values.
 */
public interface WireEnum {

    String wireName();
}
