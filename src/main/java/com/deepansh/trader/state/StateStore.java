package com.deepansh.trader.state;

import com.deepansh.trader.exception.StateStoreException;
import com.deepansh.trader.model.AgentState;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Whole-document persistence of the agent state. There is no partial update:
 * every save replaces the stored document.
 */
public interface StateStore {

    /** Never throws. Empty means "create the default state". */
    Optional<AgentState> load();

    void save(AgentState state) throws StateStoreException;

    /** True if every required top-level field is present */
    boolean validate(ObjectNode document);

    /** Backfills missing top-level fields from defaults; unknown fields are kept */
    ObjectNode migrate(ObjectNode document);
}
