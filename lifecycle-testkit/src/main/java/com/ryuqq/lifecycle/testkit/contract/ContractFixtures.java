package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.model.ActionType;
import com.ryuqq.lifecycle.core.model.Contract;
import com.ryuqq.lifecycle.core.model.ContractVersion;
import com.ryuqq.lifecycle.core.model.NodeType;
import com.ryuqq.lifecycle.core.model.StateDefinition;
import com.ryuqq.lifecycle.core.model.TransitionDefinition;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Canonical contracts used by the lifecycle contract tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ContractFixtures {

    public static final ContractVersion VERSION = ContractVersion.of(1, 0, 0);

    private ContractFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * initializing → wiring → running, with wildcard stop/fatal routes to {@code stopped}.
     *
     * <ul>
     *   <li>exit of initializing: {@code prepare_wiring} (critical)</li>
     *   <li>transition start: {@code announce_wiring} (non-critical event)</li>
     *   <li>entry of wiring: {@code warm_up}</li>
     *   <li>entry of stopped: {@code capture_state}</li>
     * </ul>
     */
    public static Contract wiringContract() {
        return Contract.builder(NodeType.ORCHESTRATOR_GENERIC, VERSION)
            .nodeName("wiring_node")
            .action(ActionDefinition.of("prepare_wiring", ActionType.PERSISTENCE).withCritical(true))
            .action(ActionDefinition.of("announce_wiring", ActionType.EVENT))
            .action(ActionDefinition.of("warm_up", ActionType.LOGGING))
            .action(ActionDefinition.of("capture_state", ActionType.DATA_CAPTURE))
            .state(StateDefinition.of("initializing").asInitial().withExitActions("prepare_wiring"))
            .state(StateDefinition.of("wiring").withEntryActions("warm_up"))
            .state(StateDefinition.of("running"))
            .state(StateDefinition.of("stopped").asTerminal().withEntryActions("capture_state"))
            .transition(TransitionDefinition.of("initializing", "start", "wiring").withActions("announce_wiring"))
            .transition(TransitionDefinition.of("wiring", "wiring_complete", "running"))
            .transition(TransitionDefinition.of(TransitionDefinition.WILDCARD, "shutdown_requested", "stopped"))
            .transition(TransitionDefinition.of(TransitionDefinition.WILDCARD, "fatal_error", "stopped"))
            .build();
    }

    /**
     * A contract whose initial state is already {@code running}; {@code fatal_error} from anywhere
     * reaches the terminal {@code stopped}, which captures diagnostics on entry.
     */
    public static Contract runningContract() {
        return Contract.builder(NodeType.EFFECT_GENERIC, VERSION)
            .nodeName("worker")
            .action(ActionDefinition.of("capture_state", ActionType.DATA_CAPTURE))
            .state(StateDefinition.of("running").asInitial())
            .state(StateDefinition.of("stopped").asTerminal().withEntryActions("capture_state"))
            .transition(TransitionDefinition.of(TransitionDefinition.WILDCARD, "fatal_error", "stopped"))
            .build();
    }

    /**
     * idle → active with actions in every phase, several of them compensable.
     *
     * <pre>
     * exit(idle):     exit_a [rollback undo_exit_a], exit_b
     * transition:     step_a [rollback undo_a], step_b (critical) [rollback undo_b], step_c
     * entry(active):  entry_a, entry_b (critical)
     * </pre>
     *
     * <p>active → idle on {@code deactivate}; any state → stopped on {@code shutdown_requested}.</p>
     */
    public static Contract orderedContract() {
        return Contract.builder(NodeType.REDUCER_GENERIC, VERSION)
            .nodeName("ordered")
            .action(ActionDefinition.of("exit_a", ActionType.LOGGING).withRollbackAction("undo_exit_a"))
            .action(ActionDefinition.of("exit_b", ActionType.LOGGING))
            .action(ActionDefinition.of("step_a", ActionType.PERSISTENCE).withRollbackAction("undo_a"))
            .action(ActionDefinition.of("step_b", ActionType.EVENT).withCritical(true).withRollbackAction("undo_b"))
            .action(ActionDefinition.of("step_c", ActionType.LOGGING))
            .action(ActionDefinition.of("entry_a", ActionType.LOGGING))
            .action(ActionDefinition.of("entry_b", ActionType.PERSISTENCE).withCritical(true))
            .action(ActionDefinition.of("undo_exit_a", ActionType.CLEANUP))
            .action(ActionDefinition.of("undo_a", ActionType.CLEANUP))
            .action(ActionDefinition.of("undo_b", ActionType.CLEANUP))
            .state(StateDefinition.of("idle").asInitial().withExitActions("exit_a", "exit_b"))
            .state(StateDefinition.of("active").withEntryActions("entry_a", "entry_b"))
            .state(StateDefinition.of("stopped").asTerminal())
            .transition(TransitionDefinition.of("idle", "activate", "active").withActions("step_a", "step_b", "step_c"))
            .transition(TransitionDefinition.of("active", "deactivate", "idle"))
            .transition(TransitionDefinition.of(TransitionDefinition.WILDCARD, "shutdown_requested", "stopped"))
            .build();
    }

    /**
     * Exact and wildcard routes for the same event.
     *
     * <pre>
     * idle     --start-->              running
     * running  --shutdown_requested--> draining   (exact, wins over the wildcard)
     * draining --drain_complete-->     stopped
     * error    --recover-->            idle       (exact route out of a terminal state)
     * *        --shutdown_requested--> stopped
     * *        --fatal_error-->        error
     * </pre>
     */
    public static Contract wildcardContract() {
        return Contract.builder(NodeType.ORCHESTRATOR_GENERIC, VERSION)
            .nodeName("graph")
            .action(ActionDefinition.of("log_draining", ActionType.LOGGING))
            .action(ActionDefinition.of("capture_failure", ActionType.DATA_CAPTURE))
            .state(StateDefinition.of("idle").asInitial())
            .state(StateDefinition.of("running"))
            .state(StateDefinition.of("draining").withEntryActions("log_draining"))
            .state(StateDefinition.of("stopped").asTerminal())
            .state(StateDefinition.of("error").asTerminal().withEntryActions("capture_failure"))
            .transition(TransitionDefinition.of("idle", "start", "running"))
            .transition(TransitionDefinition.of("running", "shutdown_requested", "draining"))
            .transition(TransitionDefinition.of("draining", "drain_complete", "stopped"))
            .transition(TransitionDefinition.of("error", "recover", "idle"))
            .transition(TransitionDefinition.of(TransitionDefinition.WILDCARD, "shutdown_requested", "stopped"))
            .transition(TransitionDefinition.of(TransitionDefinition.WILDCARD, "fatal_error", "error"))
            .build();
    }

    /**
     * Raw document whose only transition targets the undeclared state {@code z}.
     */
    public static Map<String, Object> danglingTargetDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("node_type", "EFFECT_GENERIC");
        document.put("contract_version", "1.0.0");
        document.put("node_name", "dangling");
        document.put("states", List.of(
            Map.of("state_name", "a", "is_initial", true),
            Map.of("state_name", "done", "is_terminal", true)));
        document.put("transitions", List.of(
            Map.of("from_state", "a", "to_state", "z", "trigger", "go")));
        return document;
    }

    /**
     * Raw node document: idle → running on {@code start}, wildcard stop and fatal routes.
     *
     * @param nodeName node name
     * @param dependencies names of nodes this one depends on (version 1.0.0)
     */
    public static Map<String, Object> nodeDocument(String nodeName, String... dependencies) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("node_type", "EFFECT_GENERIC");
        document.put("contract_version", "1.0.0");
        document.put("node_name", nodeName);
        if (dependencies.length > 0) {
            document.put("dependencies", Arrays.stream(dependencies)
                .map(dependency -> Map.<String, Object>of("node_name", dependency, "version", "1.0.0"))
                .collect(Collectors.toList()));
        }
        document.put("actions", List.of(
            Map.of("action_name", "announce_started", "action_type", "event"),
            Map.of("action_name", "capture_stop", "action_type", "data_capture")));
        document.put("states", List.of(
            Map.of("state_name", "idle", "is_initial", true),
            Map.of("state_name", "running", "entry_actions", List.of("announce_started")),
            Map.of("state_name", "stopped", "is_terminal", true, "entry_actions", List.of("capture_stop")),
            Map.of("state_name", "error", "is_terminal", true, "entry_actions", List.of("capture_stop"))));
        document.put("transitions", List.of(
            Map.of("from_state", "idle", "to_state", "running", "trigger", "start"),
            Map.of("from_state", "*", "to_state", "stopped", "trigger", "shutdown_requested"),
            Map.of("from_state", "*", "to_state", "error", "trigger", "fatal_error")));
        return document;
    }
}
