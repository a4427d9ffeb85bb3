package com.workstream.engine.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.workstream.core.exception.BreakingChangeMismatchException;
import com.workstream.core.exception.DuplicateVersionException;
import com.workstream.core.exception.InvalidTransitionException;
import com.workstream.core.exception.UnknownContractException;
import com.workstream.core.model.Contract;
import com.workstream.core.model.ContractChangeEvent;
import com.workstream.core.model.ContractDiff;
import com.workstream.core.model.ContractEventType;
import com.workstream.core.model.ContractSnapshot;
import com.workstream.core.model.ContractStatus;
import com.workstream.core.model.SemanticVersion;
import com.workstream.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of named, versioned contracts.
 *
 * Each contract name owns a lineage of versions. All mutations of a lineage are
 * serialized on that lineage, so concurrent evolutions of the same name cannot both
 * create the same version. Distinct names never contend.
 *
 * Lifecycle per version:
 * <pre>
 * DRAFT -> ACTIVE -> LOCKED
 *            |          |
 *            +-> SUPERSEDED (when a successor activates) -> DEPRECATED
 * </pre>
 *
 * Every successful mutation publishes a {@link ContractChangeEvent} to registered
 * listeners once the lineage lock has been released.
 *
 * Instances are not process-wide singletons; pass one explicitly to every run that needs it.
 */
public class ContractRegistry {

    private static final Logger log = LoggerFactory.getLogger(ContractRegistry.class);

    private final ConcurrentHashMap<String, Lineage> lineages = new ConcurrentHashMap<>();
    private final List<ContractEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(ContractEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ContractEventListener listener) {
        listeners.remove(listener);
    }

    // ========== Mutations ==========

    /**
     * Register a new contract version in DRAFT status.
     *
     * @throws DuplicateVersionException if (name, version) already exists
     */
    public Contract createContract(String name, String version, JsonNode specification,
                                   String ownerId, Collection<String> consumers) {
        requireName(name);
        SemanticVersion semver = SemanticVersion.parse(version);
        Lineage lineage = lineages.computeIfAbsent(name, Lineage::new);
        Contract created;

        synchronized (lineage) {
            if (lineage.versions.containsKey(semver)) {
                throw new DuplicateVersionException(name, semver.toString());
            }
            created = Contract.builder()
                .name(name)
                .version(semver)
                .specification(copyOf(specification))
                .status(ContractStatus.DRAFT)
                .ownerId(ownerId)
                .consumers(consumers == null ? Set.of() : new LinkedHashSet<>(consumers))
                .specHash(SpecificationDiff.hash(specification))
                .createdAt(Instant.now())
                .build();
            lineage.versions.put(semver, created);
        }

        try (var ctx = LoggingContext.forContract(name, semver.toString())) {
            log.info("Contract {} {} created by {}", name, semver, ownerId);
        }
        publish(ContractChangeEvent.create(ContractEventType.CREATED, created, null));
        return created;
    }

    /**
     * Create the next version of an existing contract, in DRAFT status.
     * The new version inherits owner and consumers from the latest version.
     *
     * @param breakingChanges caller's declaration; must agree with the structural diff
     *                        and with the major version bump
     * @throws UnknownContractException if the name has no version yet
     * @throws InvalidTransitionException if newVersion is locked, or not newer than the latest
     * @throws DuplicateVersionException if newVersion already exists
     * @throws BreakingChangeMismatchException if the declaration disagrees with diff or version
     */
    public Contract evolveContract(String name, String newVersion, JsonNode newSpecification,
                                   boolean breakingChanges) {
        Lineage lineage = requireLineage(name);
        SemanticVersion semver = SemanticVersion.parse(newVersion);
        JsonNode specification = copyOf(newSpecification);
        List<ContractChangeEvent> events = new ArrayList<>();
        Contract evolved;

        synchronized (lineage) {
            Contract existing = lineage.versions.get(semver);
            if (existing != null && existing.status() == ContractStatus.LOCKED) {
                throw new InvalidTransitionException(String.format(
                    "Contract %s %s is locked; its specification can only change through a new version",
                    name, semver));
            }
            if (existing != null) {
                throw new DuplicateVersionException(name, semver.toString());
            }
            Contract latest = lineage.latest();
            if (!semver.isNewerThan(latest.version())) {
                throw new InvalidTransitionException(String.format(
                    "Contract %s version %s is not newer than latest version %s",
                    name, semver, latest.version()));
            }

            ContractDiff diff = SpecificationDiff.compare(latest.specification(), specification);
            if (diff.isBreaking() && !breakingChanges) {
                throw new BreakingChangeMismatchException(name, semver.toString(),
                    "specification removes or retypes fields " + describe(diff)
                        + " but the evolution is not declared breaking");
            }
            if (breakingChanges && !semver.isMajorBumpOver(latest.version())) {
                throw new BreakingChangeMismatchException(name, semver.toString(),
                    "breaking changes require a major version increase over " + latest.version());
            }

            evolved = Contract.builder()
                .name(name)
                .version(semver)
                .specification(specification)
                .status(ContractStatus.DRAFT)
                .ownerId(latest.ownerId())
                .consumers(latest.consumers())
                .breakingChange(breakingChanges)
                .supersedesVersion(latest.version())
                .diff(diff)
                .specHash(SpecificationDiff.hash(specification))
                .createdAt(Instant.now())
                .build();
            lineage.versions.put(semver, evolved);

            events.add(ContractChangeEvent.create(ContractEventType.EVOLVED, evolved, diff.summary()));
            if (breakingChanges) {
                events.add(ContractChangeEvent.create(ContractEventType.BREAKING_CHANGE, evolved, diff.summary()));
            }
        }

        try (var ctx = LoggingContext.forContract(name, semver.toString())) {
            log.info("Contract {} evolved to {} (breaking={}, {})",
                name, semver, breakingChanges, evolved.diff().summary());
        }
        events.forEach(this::publish);
        return evolved;
    }

    /**
     * Change the specification of a version in place. Allowed while DRAFT or ACTIVE.
     *
     * @throws InvalidTransitionException once the version is LOCKED, SUPERSEDED or DEPRECATED
     */
    public Contract reviseContract(String name, String version, JsonNode newSpecification) {
        Lineage lineage = requireLineage(name);
        SemanticVersion semver = SemanticVersion.parse(version);
        JsonNode specification = copyOf(newSpecification);
        Contract revised;

        synchronized (lineage) {
            Contract current = lineage.require(semver);
            if (!current.status().allowsRevision()) {
                throw new InvalidTransitionException(String.format(
                    "Contract %s %s is %s; its specification can no longer be revised",
                    name, semver, current.status()));
            }
            Contract predecessor = current.supersedesVersion() == null
                ? null
                : lineage.versions.get(current.supersedesVersion());
            ContractDiff diff = predecessor == null
                ? ContractDiff.empty()
                : SpecificationDiff.compare(predecessor.specification(), specification);
            if (predecessor != null && diff.isBreaking() && !current.breakingChange()) {
                throw new BreakingChangeMismatchException(name, semver.toString(),
                    "revision removes or retypes fields " + describe(diff)
                        + " but this version was not declared breaking");
            }
            revised = current.withSpecification(specification, SpecificationDiff.hash(specification), diff);
            lineage.versions.put(semver, revised);
        }

        try (var ctx = LoggingContext.forContract(name, semver.toString())) {
            log.info("Contract {} {} revised", name, semver);
        }
        publish(ContractChangeEvent.create(ContractEventType.REVISED, revised, null));
        return revised;
    }

    /**
     * Record that a consumer has moved to the given version.
     * A consumer not yet listed is added to the version's consumers.
     */
    public Contract acknowledgeMigration(String name, String version, String consumerId) {
        Lineage lineage = requireLineage(name);
        SemanticVersion semver = SemanticVersion.parse(version);
        Contract updated;

        synchronized (lineage) {
            Contract current = lineage.require(semver);
            if (current.status() == ContractStatus.SUPERSEDED || current.status() == ContractStatus.DEPRECATED) {
                throw new InvalidTransitionException(String.format(
                    "Cannot migrate %s to contract %s %s in status %s",
                    consumerId, name, semver, current.status()));
            }
            updated = current.withMigratedConsumer(consumerId);
            if (!updated.consumers().contains(consumerId)) {
                Set<String> consumers = new LinkedHashSet<>(updated.consumers());
                consumers.add(consumerId);
                updated = updated.toBuilder().consumers(consumers).build();
            }
            lineage.versions.put(semver, updated);
        }

        log.debug("Consumer {} acknowledged contract {} {}", consumerId, name, semver);
        publish(ContractChangeEvent.create(ContractEventType.MIGRATION_ACKNOWLEDGED, updated, consumerId));
        return updated;
    }

    /**
     * Transition DRAFT -> ACTIVE.
     * If another version is ACTIVE or LOCKED, it is SUPERSEDED, but only when every
     * one of its consumers has acknowledged the new version.
     *
     * @throws InvalidTransitionException if the version is not DRAFT or consumers are unmigrated
     */
    public Contract activateContract(String name, String version) {
        Lineage lineage = requireLineage(name);
        SemanticVersion semver = SemanticVersion.parse(version);
        List<ContractChangeEvent> events = new ArrayList<>();
        Contract activated;
        Instant now = Instant.now();

        synchronized (lineage) {
            Contract target = lineage.require(semver);
            if (target.status() != ContractStatus.DRAFT) {
                throw new InvalidTransitionException("contract", name + " " + semver,
                    target.status(), ContractStatus.ACTIVE);
            }

            Optional<Contract> current = lineage.live();
            if (current.isPresent()) {
                Set<String> pending = current.get().unmigratedConsumers(target);
                if (!pending.isEmpty()) {
                    throw new InvalidTransitionException(String.format(
                        "Contract %s %s is %s with consumers not migrated to %s: %s",
                        name, current.get().version(), current.get().status(), semver, pending));
                }
            }

            if (current.isPresent()) {
                Contract superseded = current.get().withStatus(ContractStatus.SUPERSEDED, now);
                lineage.versions.put(superseded.version(), superseded);
                events.add(ContractChangeEvent.create(ContractEventType.SUPERSEDED, superseded,
                    "superseded by " + semver));
            }
            activated = target.withStatus(ContractStatus.ACTIVE, now);
            lineage.versions.put(semver, activated);
            events.add(0, ContractChangeEvent.create(ContractEventType.ACTIVATED, activated, null));
        }

        try (var ctx = LoggingContext.forContract(name, semver.toString())) {
            log.info("Contract {} {} activated", name, semver);
        }
        events.forEach(this::publish);
        return activated;
    }

    /**
     * Transition ACTIVE -> LOCKED. From here on the specification is stable.
     *
     * @throws InvalidTransitionException if the version is not ACTIVE
     */
    public Contract lockContract(String name, String version) {
        return transition(name, version, ContractStatus.ACTIVE, ContractStatus.LOCKED, ContractEventType.LOCKED);
    }

    /**
     * Retire a version. Any status other than DEPRECATED may be deprecated.
     */
    public Contract deprecateContract(String name, String version) {
        return transition(name, version, null, ContractStatus.DEPRECATED, ContractEventType.DEPRECATED);
    }

    // ========== Queries ==========

    public Optional<Contract> get(String name, String version) {
        Lineage lineage = lineages.get(name);
        if (lineage == null) {
            return Optional.empty();
        }
        SemanticVersion semver = SemanticVersion.parse(version);
        synchronized (lineage) {
            return Optional.ofNullable(lineage.versions.get(semver));
        }
    }

    public Optional<Contract> latest(String name) {
        Lineage lineage = lineages.get(name);
        if (lineage == null) {
            return Optional.empty();
        }
        synchronized (lineage) {
            return lineage.versions.isEmpty() ? Optional.empty() : Optional.of(lineage.latest());
        }
    }

    /**
     * All versions of a contract, oldest first.
     */
    public List<Contract> versions(String name) {
        Lineage lineage = lineages.get(name);
        if (lineage == null) {
            return List.of();
        }
        synchronized (lineage) {
            return List.copyOf(lineage.versions.values());
        }
    }

    public Set<String> contractNames() {
        return Collections.unmodifiableSet(new TreeSet<>(lineages.keySet()));
    }

    /**
     * Versions consumers currently bind to (ACTIVE or LOCKED), at most one per name.
     */
    public List<Contract> activeContracts() {
        List<Contract> active = new ArrayList<>();
        for (String name : contractNames()) {
            Lineage lineage = lineages.get(name);
            synchronized (lineage) {
                lineage.live().ifPresent(active::add);
            }
        }
        return active;
    }

    /**
     * The full contract table (every version of every name) as persisted in checkpoints.
     */
    public List<ContractSnapshot> snapshot() {
        List<ContractSnapshot> rows = new ArrayList<>();
        for (String name : contractNames()) {
            for (Contract contract : versions(name)) {
                rows.add(ContractSnapshot.of(contract));
            }
        }
        return rows;
    }

    // ========== Internal Methods ==========

    private Contract transition(String name, String version, ContractStatus requiredFrom,
                                ContractStatus to, ContractEventType eventType) {
        Lineage lineage = requireLineage(name);
        SemanticVersion semver = SemanticVersion.parse(version);
        Contract updated;

        synchronized (lineage) {
            Contract current = lineage.require(semver);
            boolean allowed = requiredFrom == null
                ? current.status().canTransitionTo(to)
                : current.status() == requiredFrom;
            if (!allowed) {
                throw new InvalidTransitionException("contract", name + " " + semver, current.status(), to);
            }
            updated = current.withStatus(to, Instant.now());
            lineage.versions.put(semver, updated);
        }

        try (var ctx = LoggingContext.forContract(name, semver.toString())) {
            log.info("Contract {} {} -> {}", name, semver, to);
        }
        publish(ContractChangeEvent.create(eventType, updated, null));
        return updated;
    }

    private void publish(ContractChangeEvent event) {
        for (ContractEventListener listener : listeners) {
            try {
                listener.onContractChange(event);
            } catch (RuntimeException e) {
                log.warn("Contract listener failed for {} {} {}: {}",
                    event.type(), event.contractName(), event.version(), e.getMessage(), e);
            }
        }
    }

    private Lineage requireLineage(String name) {
        requireName(name);
        Lineage lineage = lineages.get(name);
        if (lineage == null) {
            throw new UnknownContractException(name);
        }
        synchronized (lineage) {
            if (lineage.versions.isEmpty()) {
                throw new UnknownContractException(name);
            }
        }
        return lineage;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Contract name must not be blank");
        }
    }

    private static JsonNode copyOf(JsonNode specification) {
        if (specification == null) {
            throw new IllegalArgumentException("Contract specification must not be null");
        }
        return specification.deepCopy();
    }

    private static String describe(ContractDiff diff) {
        Set<String> paths = new TreeSet<>(diff.removed());
        paths.addAll(diff.retyped());
        return paths.toString();
    }

    /**
     * Versions of one contract name. Guarded by its own monitor.
     */
    private static final class Lineage {
        private final String name;
        private final NavigableMap<SemanticVersion, Contract> versions = new TreeMap<>();

        private Lineage(String name) {
            this.name = name;
        }

        private Contract latest() {
            return versions.lastEntry().getValue();
        }

        private Optional<Contract> live() {
            return versions.descendingMap().values().stream()
                .filter(c -> c.status().isLive())
                .findFirst();
        }

        private Contract require(SemanticVersion version) {
            Contract contract = versions.get(version);
            if (contract == null) {
                throw new UnknownContractException(name, version.toString());
            }
            return contract;
        }
    }
}
