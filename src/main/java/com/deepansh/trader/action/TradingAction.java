package com.deepansh.trader.action;

import com.deepansh.trader.model.ActionResult;

/**
 * Contract every catalog action implements.
 *
 * The input type is a record. Its components, {@link ActionParam} texts and
 * Bean Validation constraints are turned into the JSON schema the oracle sees,
 * and the oracle's arguments are bound and validated against it before
 * {@link #execute} is called.
 *
 * Actions should not throw: return {@link ActionResult#failure(String)} instead.
 * The catalog still catches anything that escapes.
 */
public interface TradingAction<I> {

    ActionType getType();

    /**
     * Primary signal the oracle uses to decide when to call this action.
     * Be specific about what comes back.
     */
    String getDescription();

    Class<I> getInputType();

    ActionResult execute(I input, ActionContext context);

    default String getName() {
        return getType().wireName();
    }
}
