package com.deepansh.trader.action;

import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.model.TradingMode;
import lombok.Builder;
import lombok.Data;

/**
 * What an action may see of the running cycle.
 *
 * The state is the live cycle state, not a copy: only execution actions
 * (through the position ledger) and live wallet reads write to it.
 */
@Data
@Builder
public class ActionContext {

    private AgentState state;
    private String sessionId;
    private long cycleNumber;

    public TradingMode getTradingMode() {
        return state != null && state.getTradingMode() != null
                ? state.getTradingMode()
                : TradingMode.DRY_RUN;
    }
}
