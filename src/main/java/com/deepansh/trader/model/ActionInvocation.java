package com.deepansh.trader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionInvocation {

    /** ID assigned by the oracle, echoed back in the matching tool message */
    private String id;

    private String actionName;

    private Map<String, Object> arguments;
}
