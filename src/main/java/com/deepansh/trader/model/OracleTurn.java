package com.deepansh.trader.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One oracle reply: zero or more action invocations, plus whatever text came with them.
 * A turn without invocations is the oracle's final rationale for the cycle.
 */
@Data
@Builder
public class OracleTurn {

    private String content;

    @Builder.Default
    private List<ActionInvocation> invocations = new ArrayList<>();

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public boolean hasInvocations() {
        return invocations != null && !invocations.isEmpty();
    }
}
