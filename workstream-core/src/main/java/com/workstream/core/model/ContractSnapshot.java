package com.workstream.core.model;

/**
 * Row of the contract table persisted with a checkpoint.
 * Carries the specification hash, not the specification itself.
 */
public record ContractSnapshot(
    String name,
    String version,
    ContractStatus status,
    String specHash,
    String ownerId
) {
    public static ContractSnapshot of(Contract contract) {
        return new ContractSnapshot(
            contract.name(),
            contract.version().toString(),
            contract.status(),
            contract.specHash(),
            contract.ownerId()
        );
    }
}
