package com.deepansh.trader.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum TradingMode implements WireEnum {

    DRY_RUN("dry_run"),
    LIVE("live");

    private final String wireName;

    TradingMode(String wireName) {
        this.wireName = wireName;
    }

    @Override
    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isDryRun() {
        return this == DRY_RUN;
    }

    public static TradingMode fromDryRunFlag(boolean dryRun) {
        return dryRun ? DRY_RUN : LIVE;
    }

    @JsonCreator
    public static TradingMode fromWireName(String value) {
        return Arrays.stream(values())
                .filter(m -> m.wireName.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown trading mode: " + value));
    }
}
