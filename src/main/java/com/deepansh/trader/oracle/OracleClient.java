package com.deepansh.trader.oracle;

import com.deepansh.trader.action.ActionDefinition;
import com.deepansh.trader.model.Message;
import com.deepansh.trader.model.OracleTurn;

import java.util.List;

public interface OracleClient {

    /**
     * Send the cycle conversation so far and the capability catalog to the oracle.
     *
     * @param messages system prompt, cycle context, then assistant/tool exchanges
     * @param actions  the catalog the oracle may invoke
     * @return invocations to execute, or a final rationale when there are none
     */
    OracleTurn chat(List<Message> messages, List<ActionDefinition> actions);
}
