package com.deepansh.trader.core;

import com.deepansh.trader.model.Message;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/** Conversation and bookkeeping of the cycle in progress. */
@Data
@Builder
public class CycleContext {

    private String sessionId;
    private long cycleNumber;
    private List<Message> messages;
    private List<String> invokedActions;
    private int currentIteration;
}
