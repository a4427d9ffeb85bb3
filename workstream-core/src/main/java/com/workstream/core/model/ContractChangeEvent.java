package com.workstream.core.model;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Notification emitted by the contract registry on every successful mutation.
 * consumers lists who should be told about the change.
 */
public record ContractChangeEvent(
    UUID eventId,
    ContractEventType type,
    String contractName,
    String version,
    ContractStatus status,
    String ownerId,
    Set<String> consumers,
    String detail,
    Instant timestamp
) {
    public static ContractChangeEvent create(ContractEventType type, Contract contract, String detail) {
        return new ContractChangeEvent(
            UUID.randomUUID(),
            type,
            contract.name(),
            contract.version().toString(),
            contract.status(),
            contract.ownerId(),
            contract.consumers(),
            detail,
            Instant.now()
        );
    }
}
