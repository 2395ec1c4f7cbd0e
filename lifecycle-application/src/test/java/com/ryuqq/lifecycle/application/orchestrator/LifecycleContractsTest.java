package com.ryuqq.lifecycle.application.orchestrator;

import com.ryuqq.lifecycle.core.error.SchemaException;
import com.ryuqq.lifecycle.core.model.Contract;
import com.ryuqq.lifecycle.core.model.ContractVersion;
import com.ryuqq.lifecycle.core.model.NodeType;
import com.ryuqq.lifecycle.core.model.StateDefinition;
import com.ryuqq.lifecycle.core.model.TransitionDefinition;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LifecycleContracts 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class LifecycleContractsTest {

    private static final ContractVersion V1 = ContractVersion.of(1, 0, 0);

    static Contract loader() {
        return Contract.builder(NodeType.EFFECT_GENERIC, V1)
            .nodeName("contract_loader")
            .state(StateDefinition.of("idle").asInitial())
            .state(StateDefinition.of("discovering"))
            .state(StateDefinition.of("ready"))
            .state(StateDefinition.of("error").asTerminal())
            .state(StateDefinition.of("stopped").asTerminal())
            .transition(TransitionDefinition.of("idle", "discover", "discovering"))
            .transition(TransitionDefinition.of("discovering", "contracts_discovered", "ready"))
            .transition(TransitionDefinition.of("discovering", "discovery_failed", "error"))
            .transition(TransitionDefinition.of("*", "shutdown_requested", "stopped"))
            .transition(TransitionDefinition.of("*", "fatal_error", "error"))
            .build();
    }

    static Contract registry() {
        return Contract.builder(NodeType.REDUCER_GENERIC, V1)
            .nodeName("contract_registry")
            .state(StateDefinition.of("idle").asInitial())
            .state(StateDefinition.of("validating"))
            .state(StateDefinition.of("ready"))
            .state(StateDefinition.of("error").asTerminal())
            .state(StateDefinition.of("stopped").asTerminal())
            .transition(TransitionDefinition.of("idle", "validate", "validating"))
            .transition(TransitionDefinition.of("validating", "validation_passed", "ready"))
            .transition(TransitionDefinition.of("validating", "validation_failed", "error"))
            .transition(TransitionDefinition.of("*", "shutdown_requested", "stopped"))
            .transition(TransitionDefinition.of("*", "fatal_error", "error"))
            .build();
    }

    static Contract graph() {
        return Contract.builder(NodeType.ORCHESTRATOR_GENERIC, V1)
            .nodeName("node_graph")
            .state(StateDefinition.of("initializing").asInitial())
            .state(StateDefinition.of("wiring"))
            .state(StateDefinition.of("running"))
            .state(StateDefinition.of("draining"))
            .state(StateDefinition.of("stopped").asTerminal())
            .state(StateDefinition.of("error").asTerminal())
            .transition(TransitionDefinition.of("initializing", "dependencies_resolved", "wiring"))
            .transition(TransitionDefinition.of("wiring", "wiring_complete", "running"))
            .transition(TransitionDefinition.of("*", "shutdown_requested", "draining"))
            .transition(TransitionDefinition.of("draining", "drain_complete", "stopped"))
            .transition(TransitionDefinition.of("*", "fatal_error", "error"))
            .build();
    }

    @Test
    void constructor_CompleteContracts_Accepted() {
        LifecycleContracts contracts = new LifecycleContracts(loader(), registry(), graph());

        assertThat(contracts.forRole(InstanceRole.CONTRACT_LOADER).nodeName()).isEqualTo("contract_loader");
        assertThat(contracts.forRole(InstanceRole.CONTRACT_REGISTRY).nodeName()).isEqualTo("contract_registry");
        assertThat(contracts.forRole(InstanceRole.NODE_GRAPH).nodeName()).isEqualTo("node_graph");
    }

    @Test
    void constructor_GraphMissingDrainEvent_FailsFast() {
        Contract incomplete = Contract.builder(NodeType.ORCHESTRATOR_GENERIC, V1)
            .nodeName("node_graph")
            .state(StateDefinition.of("initializing").asInitial())
            .state(StateDefinition.of("running"))
            .state(StateDefinition.of("stopped").asTerminal())
            .transition(TransitionDefinition.of("initializing", "dependencies_resolved", "running"))
            .transition(TransitionDefinition.of("running", "wiring_complete", "running"))
            .transition(TransitionDefinition.of("*", "shutdown_requested", "stopped"))
            .transition(TransitionDefinition.of("*", "fatal_error", "stopped"))
            .build();

        assertThatThrownBy(() -> new LifecycleContracts(loader(), registry(), incomplete))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("does not handle event 'drain_complete'");
    }

    @Test
    void constructor_LoaderWithoutReadyState_FailsFast() {
        assertThatThrownBy(() -> new LifecycleContracts(graph(), registry(), graph()))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("contract_loader contract does not declare state 'ready'");
    }

    @Test
    void constructor_RegistryErrorStateNotTerminal_FailsFast() {
        Contract nonTerminalError = Contract.builder(NodeType.REDUCER_GENERIC, V1)
            .nodeName("contract_registry")
            .state(StateDefinition.of("idle").asInitial())
            .state(StateDefinition.of("validating"))
            .state(StateDefinition.of("ready"))
            .state(StateDefinition.of("error"))
            .state(StateDefinition.of("stopped").asTerminal())
            .transition(TransitionDefinition.of("idle", "validate", "validating"))
            .transition(TransitionDefinition.of("validating", "validation_passed", "ready"))
            .transition(TransitionDefinition.of("validating", "validation_failed", "error"))
            .transition(TransitionDefinition.of("*", "shutdown_requested", "stopped"))
            .transition(TransitionDefinition.of("*", "fatal_error", "error"))
            .build();

        assertThatThrownBy(() -> new LifecycleContracts(loader(), nonTerminalError, graph()))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("contract_registry contract does not declare terminal state 'error'");
    }

    @Test
    void constructor_Null_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> new LifecycleContracts(null, registry(), graph()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
