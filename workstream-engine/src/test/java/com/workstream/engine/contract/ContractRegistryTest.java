package com.workstream.engine.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workstream.core.exception.BreakingChangeMismatchException;
import com.workstream.core.exception.DuplicateVersionException;
import com.workstream.core.exception.InvalidTransitionException;
import com.workstream.core.exception.UnknownContractException;
import com.workstream.core.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;

class ContractRegistryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final JsonNode USER_V1 = json(
        "{\"endpoint\":\"/users\",\"response\":{\"id\":\"string\",\"email\":\"string\"}}");
    private static final JsonNode USER_ADDED_FIELD = json(
        "{\"endpoint\":\"/users\",\"response\":{\"id\":\"string\",\"email\":\"string\",\"name\":\"string\"}}");
    private static final JsonNode USER_REMOVED_FIELD = json(
        "{\"endpoint\":\"/users\",\"response\":{\"id\":\"string\"}}");

    private ContractRegistry registry;
    private List<ContractChangeEvent> events;

    @BeforeEach
    void setUp() {
        registry = new ContractRegistry();
        events = new CopyOnWriteArrayList<>();
        registry.addListener(events::add);
    }

    // ========== Creation ==========

    @Test
    @DisplayName("New contract starts as DRAFT with a specification hash")
    void createStartsInDraft() {
        Contract created = registry.createContract("X", "1.0.0", USER_V1, "backend", List.of("web"));

        assertThat(created.status()).isEqualTo(ContractStatus.DRAFT);
        assertThat(created.version()).isEqualTo(SemanticVersion.parse("1.0.0"));
        assertThat(created.consumers()).containsExactly("web");
        assertThat(created.specHash()).isEqualTo(SpecificationDiff.hash(USER_V1));
        assertThat(events).extracting(ContractChangeEvent::type).containsExactly(ContractEventType.CREATED);
    }

    @Test
    @DisplayName("Creating an existing version is rejected")
    void duplicateCreateIsRejected() {
        registry.createContract("X", "1.0.0", USER_V1, "backend", List.of());

        assertThatThrownBy(() -> registry.createContract("X", "1.0.0", USER_V1, "backend", List.of()))
            .isInstanceOf(DuplicateVersionException.class);
    }

    // ========== Evolution ==========

    @Test
    @DisplayName("Locked version cannot be evolved in place")
    void lockedVersionCannotBeEvolved() {
        registry.createContract("X", "1.0.0", USER_V1, "backend", List.of());
        registry.activateContract("X", "1.0.0");
        registry.lockContract("X", "1.0.0");

        assertThatThrownBy(() -> registry.evolveContract("X", "1.0.0", USER_ADDED_FIELD, false))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("locked");
        assertThat(registry.get("X", "1.0.0")).get()
            .extracting(Contract::specification)
            .isEqualTo(USER_V1);
    }

    @Test
    @DisplayName("Removing a field requires a declared breaking change with a major bump")
    void removedFieldRequiresBreakingMajorBump() {
        registry.createContract("X", "1.0.0", USER_V1, "backend", List.of());

        assertThatThrownBy(() -> registry.evolveContract("X", "1.1.0", USER_REMOVED_FIELD, false))
            .isInstanceOf(BreakingChangeMismatchException.class);

        Contract evolved = registry.evolveContract("X", "2.0.0", USER_REMOVED_FIELD, true);

        assertThat(evolved.status()).isEqualTo(ContractStatus.DRAFT);
        assertThat(evolved.breakingChange()).isTrue();
        assertThat(evolved.supersedesVersion()).isEqualTo(SemanticVersion.parse("1.0.0"));
        assertThat(evolved.diff().removed()).containsExactly("response.email");
        assertThat(events).extracting(ContractChangeEvent::type)
            .containsExactly(ContractEventType.CREATED, ContractEventType.EVOLVED, ContractEventType.BREAKING_CHANGE);
    }

    @Test
    @DisplayName("Dropping an endpoint from an endpoint list requires a declared breaking change")
    void removedEndpointRequiresBreakingChange() {
        JsonNode twoEndpoints = json("{\"endpoints\":[{\"method\":\"GET\",\"path\":\"/users\"},"
            + "{\"method\":\"DELETE\",\"path\":\"/users\"}]}");
        JsonNode oneEndpoint = json("{\"endpoints\":[{\"method\":\"GET\",\"path\":\"/users\"}]}");
        registry.createContract("X", "1.0.0", twoEndpoints, "backend", List.of());

        assertThatThrownBy(() -> registry.evolveContract("X", "1.1.0", oneEndpoint, false))
            .isInstanceOf(BreakingChangeMismatchException.class)
            .hasMessageContaining("endpoints[DELETE /users]");
        assertThat(registry.versions("X")).hasSize(1);

        Contract evolved = registry.evolveContract("X", "2.0.0", oneEndpoint, true);
        assertThat(evolved.diff().removed()).contains("endpoints[DELETE /users]");
    }

    @Test
    @DisplayName("Declaring a breaking change without a major bump is rejected")
    void breakingWithoutMajorBumpIsRejected() {
        registry.createContract("X", "1.0.0", USER_V1, "backend", List.of());

        assertThatThrownBy(() -> registry.evolveContract("X", "1.1.0", USER_ADDED_FIELD, true))
            .isInstanceOf(BreakingChangeMismatchException.class)
            .hasMessageContaining("major");
    }

    @Test
    @DisplayName("Additive change evolves as a minor version and inherits owner and consumers")
    void additiveChangeEvolves() {
        registry.createContract("X", "1.0.0", USER_V1, "backend", List.of("web", "mobile"));

        Contract evolved = registry.evolveContract("X", "1.1.0", USER_ADDED_FIELD, false);

        assertThat(evolved.ownerId()).isEqualTo("backend");
        assertThat(evolved.consumers()).containsExactly("web", "mobile");
        assertThat(evolved.diff().added()).containsExactly("response.name");
        assertThat(evolved.diff().isBreaking()).isFalse();
        assertThat(registry.latest("X")).get().extracting(Contract::version)
            .isEqualTo(SemanticVersion.parse("1.1.0"));
    }

    @Test
    @DisplayName("Evolution is rejected for unknown names, older versions and existing versions")
    void evolutionRejectsInvalidTargets() {
        registry.createContract("X", "1.2.0", USER_V1, "backend", List.of());

        assertThatThrownBy(() -> registry.evolveContract("Y", "2.0.0", USER_V1, false))
            .isInstanceOf(UnknownContractException.class);
        assertThatThrownBy(() -> registry.evolveContract("X", "1.1.0", USER_ADDED_FIELD, false))
            .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> registry.evolveContract("X", "1.2.0", USER_ADDED_FIELD, false))
            .isInstanceOf(DuplicateVersionException.class);
    }

    @Test
    @DisplayName("Concurrent evolutions to the same version have exactly one winner")
    void concurrentEvolutionHasSingleWinner() throws Exception {
        registry.createContract("X", "1.0.0", USER_V1, "backend", List.of());
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            for (int i = 0; i < contenders; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        registry.evolveContract("X", "1.1.0", USER_ADDED_FIELD, false);
                        return true;
                    } catch (DuplicateVersionException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
            assertThat(registry.versions("X")).hasSize(2);
        } finally {
            pool.shutdownNow();
        }
    }

    // ========== Lifecycle ==========

    @Test
    @DisplayName("Activation supersedes the live version once every consumer has migrated")
    void activationWaitsForConsumerMigration() {
        registry.createContract("X", "1.0.0", USER_V1, "backend", List.of("web", "mobile"));
        registry.activateContract("X", "1.0.0");
        registry.evolveContract("X", "2.0.0", USER_REMOVED_FIELD, true);

        registry.acknowledgeMigration("X", "2.0.0", "web");
        assertThatThrownBy(() -> registry.activateContract("X", "2.0.0"))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("mobile");

        registry.acknowledgeMigration("X", "2.0.0", "mobile");
        Contract activated = registry.activateContract("X", "2.0.0");

        assertThat(activated.status()).isEqualTo(ContractStatus.ACTIVE);
        assertThat(activated.activatedAt()).isNotNull();
        assertThat(registry.get("X", "1.0.0")).get()
            .extracting(Contract::status)
            .isEqualTo(ContractStatus.SUPERSEDED);
        assertThat(registry.activeContracts()).extracting(Contract::version)
            .containsExactly(SemanticVersion.parse("2.0.0"));
    }

    @Test
    @DisplayName("Only DRAFT versions can be activated and only ACTIVE versions locked")
    void lifecycleTransitionsAreEnforced() {
        registry.createContract("X", "1.0.0", USER_V1, "backend", List.of());

        assertThatThrownBy(() -> registry.lockContract("X", "1.0.0"))
            .isInstanceOf(InvalidTransitionException.class);

        registry.activateContract("X", "1.0.0");
        assertThatThrownBy(() -> registry.activateContract("X", "1.0.0"))
            .isInstanceOf(InvalidTransitionException.class);

        Contract locked = registry.lockContract("X", "1.0.0");
        assertThat(locked.status()).isEqualTo(ContractStatus.LOCKED);
        assertThat(locked.lockedAt()).isNotNull();

        Contract deprecated = registry.deprecateContract("X", "1.0.0");
        assertThat(deprecated.status()).isEqualTo(ContractStatus.DEPRECATED);
        assertThat(registry.activeContracts()).isEmpty();
    }

    @Test
    @DisplayName("Revision is allowed while DRAFT and rejected once LOCKED")
    void revisionStopsAtLock() {
        registry.createContract("X", "1.0.0", USER_V1, "backend", List.of());

        Contract revised = registry.reviseContract("X", "1.0.0", USER_ADDED_FIELD);
        assertThat(revised.specification()).isEqualTo(USER_ADDED_FIELD);
        assertThat(revised.specHash()).isNotEqualTo(SpecificationDiff.hash(USER_V1));

        registry.activateContract("X", "1.0.0");
        registry.lockContract("X", "1.0.0");

        assertThatThrownBy(() -> registry.reviseContract("X", "1.0.0", USER_V1))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("Revision of an evolved version cannot sneak in a breaking change")
    void revisionKeepsBreakingDeclaration() {
        registry.createContract("X", "1.0.0", USER_V1, "backend", List.of());
        registry.evolveContract("X", "1.1.0", USER_ADDED_FIELD, false);

        assertThatThrownBy(() -> registry.reviseContract("X", "1.1.0", USER_REMOVED_FIELD))
            .isInstanceOf(BreakingChangeMismatchException.class);
    }

    // ========== Events and Snapshot ==========

    @Test
    @DisplayName("Listeners see lifecycle events in order and a failing listener does not block mutations")
    void listenersReceiveEvents() {
        registry.addListener(event -> {
            throw new IllegalStateException("listener down");
        });

        registry.createContract("X", "1.0.0", USER_V1, "backend", Set.of("web"));
        registry.activateContract("X", "1.0.0");
        registry.lockContract("X", "1.0.0");

        assertThat(events).extracting(ContractChangeEvent::type)
            .containsExactly(ContractEventType.CREATED, ContractEventType.ACTIVATED, ContractEventType.LOCKED);
        assertThat(events.get(2).consumers()).containsExactly("web");
        assertThat(registry.get("X", "1.0.0")).get()
            .extracting(Contract::status)
            .isEqualTo(ContractStatus.LOCKED);
    }

    @Test
    @DisplayName("Snapshot lists every version of every contract")
    void snapshotCoversAllVersions() {
        registry.createContract("B", "1.0.0", USER_V1, "backend", List.of());
        registry.createContract("A", "1.0.0", USER_V1, "backend", List.of());
        registry.evolveContract("A", "1.1.0", USER_ADDED_FIELD, false);

        assertThat(registry.snapshot())
            .extracting(ContractSnapshot::name, ContractSnapshot::version)
            .containsExactly(
                tuple("A", "1.0.0"),
                tuple("A", "1.1.0"),
                tuple("B", "1.0.0"));
    }

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(text, e);
        }
    }
}
