package com.workstream.engine.contract;

import com.workstream.core.model.ContractChangeEvent;

/**
 * Receives contract change events from a {@link ContractRegistry}.
 * Called on the thread that performed the mutation, after the change is visible.
 */
@FunctionalInterface
public interface ContractEventListener {

    void onContractChange(ContractChangeEvent event);
}
