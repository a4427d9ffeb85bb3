package com.workstream.core.model;

/**
 * Reference to one version of a contract, as recorded in run state.
 */
public record ContractRef(String name, String version) {

    public static ContractRef of(Contract contract) {
        return new ContractRef(contract.name(), contract.version().toString());
    }

    @Override
    public String toString() {
        return name + "@" + version;
    }
}
