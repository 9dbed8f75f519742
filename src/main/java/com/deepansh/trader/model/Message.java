package com.deepansh.trader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;
    private String content;

    /** Present when role = tool: links back to the assistant's tool_call id */
    private String toolCallId;

    /** Present when role = tool: the action that produced this result */
    private String name;

    /**
     * Present when role = assistant and the oracle requested actions.
     * Must be echoed back verbatim on the next request or the provider
     * cannot correlate the tool results with its own calls.
     */
    private List<ActionInvocation> invocations;
}
