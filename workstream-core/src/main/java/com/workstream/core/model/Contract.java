package com.workstream.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One version of a named contract shared between producers and consumers.
 *
 * Primary Key: (name, version)
 *
 * Invariants:
 * - specification never changes once status is LOCKED
 * - breakingChange implies the major version increased over supersedesVersion
 * - migratedConsumers is a subset of the consumers known when it was recorded
 */
public record Contract(
    String name,
    SemanticVersion version,
    JsonNode specification,
    ContractStatus status,
    String ownerId,
    Set<String> consumers,
    Set<String> migratedConsumers,
    boolean breakingChange,
    SemanticVersion supersedesVersion,
    ContractDiff diff,
    String specHash,
    Instant createdAt,
    Instant activatedAt,
    Instant lockedAt
) {
    public Contract {
        consumers = consumers == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(consumers));
        migratedConsumers = migratedConsumers == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(migratedConsumers));
        diff = diff == null ? ContractDiff.empty() : diff;
    }

    public ContractRef ref() {
        return ContractRef.of(this);
    }

    /**
     * Consumers of this version that have not yet acknowledged the given successor.
     */
    public Set<String> unmigratedConsumers(Contract successor) {
        Set<String> pending = new LinkedHashSet<>(consumers);
        pending.removeAll(successor.migratedConsumers());
        return pending;
    }

    public Contract withStatus(ContractStatus newStatus, Instant now) {
        Builder b = toBuilder().status(newStatus);
        if (newStatus == ContractStatus.ACTIVE) {
            b.activatedAt(now);
        } else if (newStatus == ContractStatus.LOCKED) {
            b.lockedAt(now);
        }
        return b.build();
    }

    public Contract withSpecification(JsonNode newSpec, String newHash, ContractDiff newDiff) {
        return toBuilder().specification(newSpec).specHash(newHash).diff(newDiff).build();
    }

    public Contract withMigratedConsumer(String consumerId) {
        Set<String> migrated = new LinkedHashSet<>(migratedConsumers);
        migrated.add(consumerId);
        return toBuilder().migratedConsumers(migrated).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private String name;
        private SemanticVersion version;
        private JsonNode specification;
        private ContractStatus status = ContractStatus.DRAFT;
        private String ownerId;
        private Set<String> consumers = Set.of();
        private Set<String> migratedConsumers = Set.of();
        private boolean breakingChange;
        private SemanticVersion supersedesVersion;
        private ContractDiff diff;
        private String specHash;
        private Instant createdAt;
        private Instant activatedAt;
        private Instant lockedAt;

        Builder() {
        }

        Builder(Contract c) {
            this.name = c.name;
            this.version = c.version;
            this.specification = c.specification;
            this.status = c.status;
            this.ownerId = c.ownerId;
            this.consumers = c.consumers;
            this.migratedConsumers = c.migratedConsumers;
            this.breakingChange = c.breakingChange;
            this.supersedesVersion = c.supersedesVersion;
            this.diff = c.diff;
            this.specHash = c.specHash;
            this.createdAt = c.createdAt;
            this.activatedAt = c.activatedAt;
            this.lockedAt = c.lockedAt;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(SemanticVersion version) {
            this.version = version;
            return this;
        }

        public Builder specification(JsonNode specification) {
            this.specification = specification;
            return this;
        }

        public Builder status(ContractStatus status) {
            this.status = status;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder consumers(Set<String> consumers) {
            this.consumers = consumers;
            return this;
        }

        public Builder migratedConsumers(Set<String> migratedConsumers) {
            this.migratedConsumers = migratedConsumers;
            return this;
        }

        public Builder breakingChange(boolean breakingChange) {
            this.breakingChange = breakingChange;
            return this;
        }

        public Builder supersedesVersion(SemanticVersion supersedesVersion) {
            this.supersedesVersion = supersedesVersion;
            return this;
        }

        public Builder diff(ContractDiff diff) {
            this.diff = diff;
            return this;
        }

        public Builder specHash(String specHash) {
            this.specHash = specHash;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder activatedAt(Instant activatedAt) {
            this.activatedAt = activatedAt;
            return this;
        }

        public Builder lockedAt(Instant lockedAt) {
            this.lockedAt = lockedAt;
            return this;
        }

        public Contract build() {
            return new Contract(
                name, version, specification, status, ownerId, consumers, migratedConsumers,
                breakingChange, supersedesVersion, diff, specHash, createdAt, activatedAt, lockedAt
            );
        }
    }
}
