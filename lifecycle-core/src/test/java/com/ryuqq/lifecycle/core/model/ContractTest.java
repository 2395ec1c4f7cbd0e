package com.ryuqq.lifecycle.core.model;

import com.ryuqq.lifecycle.core.error.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract 빌더 검증 및 전이 조회 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ContractTest {

    private static final ContractVersion V1 = ContractVersion.of(1, 0, 0);

    private Contract.Builder graphBuilder() {
        return Contract.builder(NodeType.ORCHESTRATOR_GENERIC, V1)
            .nodeName("graph")
            .state(StateDefinition.of("initializing").asInitial())
            .state(StateDefinition.of("running"))
            .state(StateDefinition.of("stopped").asTerminal())
            .transition(TransitionDefinition.of("initializing", "start", "running"));
    }

    // ========== 전이 조회 ==========

    @Test
    void findTransition_ExactMatchWinsOverWildcard() {
        // given
        Contract contract = graphBuilder()
            .state(StateDefinition.of("draining"))
            .transition(TransitionDefinition.of("running", "shutdown_requested", "draining"))
            .transition(TransitionDefinition.of("*", "shutdown_requested", "stopped"))
            .build();

        // when
        Optional<TransitionDefinition> fromRunning = contract.findTransition("running", "shutdown_requested");
        Optional<TransitionDefinition> fromInitializing = contract.findTransition("initializing", "shutdown_requested");

        // then
        assertThat(fromRunning).get().extracting(TransitionDefinition::toState).isEqualTo("draining");
        assertThat(fromInitializing).get().extracting(TransitionDefinition::toState).isEqualTo("stopped");
    }

    @Test
    void findTransition_WildcardDoesNotFireFromTerminalState() {
        // given
        Contract contract = graphBuilder()
            .transition(TransitionDefinition.of("*", "fatal_error", "stopped"))
            .build();

        // then
        assertThat(contract.findTransition("running", "fatal_error")).isPresent();
        assertThat(contract.findTransition("stopped", "fatal_error")).isEmpty();
    }

    @Test
    void findTransition_ExactTransitionFromTerminalStateStillFires() {
        // given
        Contract contract = graphBuilder()
            .transition(TransitionDefinition.of("stopped", "reset", "initializing"))
            .build();

        // then
        assertThat(contract.findTransition("stopped", "reset")).isPresent();
    }

    @Test
    void findTransition_UnknownEvent_Empty() {
        Contract contract = graphBuilder().build();

        assertThat(contract.findTransition("initializing", "nope")).isEmpty();
        assertThat(contract.handles("start")).isTrue();
        assertThat(contract.handles("nope")).isFalse();
    }

    @Test
    void build_PreservesDeclarationOrderAndDefaults() {
        Contract contract = Contract.builder(NodeType.EFFECT_GENERIC, V1)
            .state(StateDefinition.of("idle").asInitial())
            .state(StateDefinition.of("done").asTerminal())
            .build();

        assertThat(contract.nodeName()).isEqualTo("effect_generic");
        assertThat(contract.initialState()).isEqualTo("idle");
        assertThat(contract.states().keySet()).containsExactly("idle", "done");
        assertThat(contract.isTerminal("done")).isTrue();
    }

    // ========== 검증 실패 ==========

    @Test
    void build_UndeclaredToState_ThrowsSchemaException() {
        assertThatThrownBy(() -> graphBuilder()
            .transition(TransitionDefinition.of("running", "go", "z"))
            .build())
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("undeclared to_state 'z'");
    }

    @Test
    void build_MissingInitialAndTerminal_ReportsBoth() {
        SchemaException e = (SchemaException) catchSchema(() -> Contract.builder(NodeType.COMPUTE_GENERIC, V1)
            .state(StateDefinition.of("a"))
            .build());

        assertThat(e.getViolations())
            .anyMatch(v -> v.contains("exactly one initial state"))
            .anyMatch(v -> v.contains("at least one terminal state"));
        assertThat(e.getErrorCode()).isEqualTo(SchemaException.ERROR_CODE);
    }

    @Test
    void build_AmbiguousTransition_ThrowsSchemaException() {
        assertThatThrownBy(() -> graphBuilder()
            .transition(TransitionDefinition.of("initializing", "start", "stopped"))
            .build())
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("ambiguous transitions");
    }

    @Test
    void build_UnknownActionReference_ThrowsSchemaException() {
        assertThatThrownBy(() -> graphBuilder()
            .state(StateDefinition.of("wiring").withEntryActions("missing"))
            .build())
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("undeclared action 'missing'");
    }

    @Test
    void build_InvalidRollbackReferences_ThrowsSchemaException() {
        SchemaException e = (SchemaException) catchSchema(() -> graphBuilder()
            .action(ActionDefinition.of("self", ActionType.LOGGING).withRollbackAction("self"))
            .action(ActionDefinition.of("dangling", ActionType.LOGGING).withRollbackAction("ghost"))
            .build());

        assertThat(e.getViolations())
            .anyMatch(v -> v.contains("cannot be its own rollback_action"))
            .anyMatch(v -> v.contains("undeclared rollback_action 'ghost'"));
    }

    @Test
    void build_ActionNewerMajorThanContract_ThrowsSchemaException() {
        ActionDefinition newer = new ActionDefinition("emit", ActionType.EVENT, false, 100,
            ContractVersion.of(2, 0, 0), null, null);

        assertThatThrownBy(() -> graphBuilder().action(newer).build())
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("newer than contract version");
    }

    @Test
    void build_DuplicateStateAndDependency_ThrowsSchemaException() {
        SchemaException e = (SchemaException) catchSchema(() -> graphBuilder()
            .state(StateDefinition.of("running"))
            .dependency(new NodeDependency("registry", V1))
            .dependency(new NodeDependency("registry", V1))
            .build());

        assertThat(e.getViolations())
            .anyMatch(v -> v.contains("duplicate state 'running'"))
            .anyMatch(v -> v.contains("duplicate dependency"));
    }

    private static RuntimeException catchSchema(Runnable runnable) {
        try {
            runnable.run();
        } catch (SchemaException e) {
            return e;
        }
        throw new AssertionError("Expected SchemaException");
    }
}
