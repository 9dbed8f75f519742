package com.deepansh.trader.action.input;

import com.deepansh.trader.model.WireEnum;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DiscoveryStrategy implements WireEnum {

    BOOSTED_LATEST("boosted_latest"),
    BOOSTED_TOP("boosted_top"),
    PROFILES_LATEST("profiles_latest"),
    CUSTOM_SEARCH("custom_search");

    private final String wireName;

    DiscoveryStrategy(String wireName) {
        this.wireName = wireName;
    }

    @Override
    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static DiscoveryStrategy fromWireName(String value) {
        for (DiscoveryStrategy s : values()) {
            if (s.wireName.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Invalid discovery strategy: " + value);
    }
}
