package com.workstream.core.model;

/**
 * Lifecycle states for one version of a contract.
 */
public enum ContractStatus {
    /**
     * Published by its producer, specification may still be revised.
     * Transitions: -> ACTIVE, DEPRECATED
     */
    DRAFT,

    /**
     * The version consumers should build against. At most one per name.
     * Transitions: -> LOCKED, SUPERSEDED, DEPRECATED
     */
    ACTIVE,

    /**
     * Specification frozen; only a new version may change it.
     * Transitions: -> SUPERSEDED, DEPRECATED
     */
    LOCKED,

    /**
     * Replaced by a newer active version after all consumers migrated.
     * Transitions: -> DEPRECATED
     */
    SUPERSEDED,

    /**
     * Retired. Terminal state.
     */
    DEPRECATED;

    /**
     * Check if the specification of a version in this status may be changed in place.
     */
    public boolean allowsRevision() {
        return this == DRAFT || this == ACTIVE;
    }

    /**
     * Check if consumers currently bind to a version in this status.
     */
    public boolean isLive() {
        return this == ACTIVE || this == LOCKED;
    }

    public boolean canTransitionTo(ContractStatus target) {
        return switch (this) {
            case DRAFT -> target == ACTIVE || target == DEPRECATED;
            case ACTIVE -> target == LOCKED || target == SUPERSEDED || target == DEPRECATED;
            case LOCKED -> target == SUPERSEDED || target == DEPRECATED;
            case SUPERSEDED -> target == DEPRECATED;
            case DEPRECATED -> false;
        };
    }
}
