package com.deepansh.trader.action.input;

import com.deepansh.trader.model.WireEnum;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PatternType implements WireEnum {

    PROFITABLE("profitable"),
    LOSING("losing"),
    HIGH_PROFIT("high_profit"),
    QUICK_TRADES("quick_trades"),
    ALL("all");

    private final String wireName;

    PatternType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static PatternType fromWireName(String value) {
        for (PatternType p : values()) {
            if (p.wireName.equalsIgnoreCase(value)) return p;
        }
        throw new IllegalArgumentException("Invalid pattern type: " + value);
    }
}
