package com.deepansh.trader.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TradeDirection implements WireEnum {

    BUY("buy"),
    SELL("sell");

    private final String wireName;

    TradeDirection(String wireName) {
        this.wireName = wireName;
    }

    @Override
    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TradeDirection fromWireName(String value) {
        for (TradeDirection d : values()) {
            if (d.wireName.equalsIgnoreCase(value)) return d;
        }
        throw new IllegalArgumentException("Unknown trade type: " + value + " (expected buy or sell)");
    }
}
