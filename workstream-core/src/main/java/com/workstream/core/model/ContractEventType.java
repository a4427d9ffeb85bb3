package com.workstream.core.model;

/**
 * Kinds of contract change published by the registry.
 */
public enum ContractEventType {
    CREATED,
    EVOLVED,
    BREAKING_CHANGE,
    REVISED,
    ACTIVATED,
    SUPERSEDED,
    LOCKED,
    DEPRECATED,
    MIGRATION_ACKNOWLEDGED
}
