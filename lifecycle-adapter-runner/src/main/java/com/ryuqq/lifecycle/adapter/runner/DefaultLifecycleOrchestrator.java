package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.adapter.runner.graph.NodeGraph;
import com.ryuqq.lifecycle.adapter.runner.graph.SubscriptionWiring;
import com.ryuqq.lifecycle.adapter.runner.handler.TopicNames;
import com.ryuqq.lifecycle.application.orchestrator.HealthSummary;
import com.ryuqq.lifecycle.application.orchestrator.InstanceRole;
import com.ryuqq.lifecycle.application.orchestrator.LifecycleContracts;
import com.ryuqq.lifecycle.application.orchestrator.LifecycleOrchestrator;
import com.ryuqq.lifecycle.application.orchestrator.ShutdownReport;
import com.ryuqq.lifecycle.application.orchestrator.StartupException;
import com.ryuqq.lifecycle.application.orchestrator.StartupReport;
import com.ryuqq.lifecycle.application.phase.OrchestratorPhase;
import com.ryuqq.lifecycle.application.phase.PhaseTransition;
import com.ryuqq.lifecycle.core.contract.ContractAnalysis;
import com.ryuqq.lifecycle.core.contract.ContractAnalyzer;
import com.ryuqq.lifecycle.core.contract.ContractDocument;
import com.ryuqq.lifecycle.core.contract.ContractParser;
import com.ryuqq.lifecycle.core.error.ContractSourceException;
import com.ryuqq.lifecycle.core.error.FatalLifecycleException;
import com.ryuqq.lifecycle.core.error.InstanceBusyException;
import com.ryuqq.lifecycle.core.error.LifecycleException;
import com.ryuqq.lifecycle.core.error.SchemaException;
import com.ryuqq.lifecycle.core.error.TransitionAbortedException;
import com.ryuqq.lifecycle.core.executor.ActionExecutor;
import com.ryuqq.lifecycle.core.model.Contract;
import com.ryuqq.lifecycle.core.outcome.ActionFailure;
import com.ryuqq.lifecycle.core.statemachine.ActionRecord;
import com.ryuqq.lifecycle.core.statemachine.FsmInstance;
import com.ryuqq.lifecycle.core.statemachine.InstanceSnapshot;
import com.ryuqq.lifecycle.core.statemachine.LifecycleListener;
import com.ryuqq.lifecycle.core.statemachine.Slf4jLifecycleListener;
import com.ryuqq.lifecycle.core.statemachine.StateChangedEvent;
import com.ryuqq.lifecycle.core.statemachine.TransitionEngine;
import com.ryuqq.lifecycle.core.statemachine.TransitionResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static com.ryuqq.lifecycle.application.orchestrator.LifecycleEvents.*;

/**
 * LifecycleOrchestrator 기본 구현체.
 *
 * <p>내장 인스턴스 세 개(contract_loader, contract_registry, node_graph)와 발견된 노드마다
 * 하나의 FSM 인스턴스를 소유하며, 모든 협력자는 생성자로 명시적으로 전달받습니다.</p>
 *
 * <p><strong>시작 시퀀스:</strong></p>
 * <pre>
 * loader:   discover → (ContractSource.discover) → contracts_discovered | discovery_failed
 * registry: validate → (문서별 스키마 검증) → validation_passed | validation_failed
 * graph:    (의존성 해석) → dependencies_resolved
 *           → 노드 인스턴스 생성, 명령 토픽 구독, 노드 start
 *           → wiring_complete
 * runtime.ready 발행
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>시작 중 치명 액션 실패, 계약 검증 실패, 의존성 오류는 시작 시퀀스에 치명적 (자동 재시도 없음)</li>
 *   <li>비치명 액션 실패는 기록만 하고 계속 진행</li>
 *   <li>종료 중이 아닐 때 인스턴스가 {@code fatal_error}로 전이하거나 내장 인스턴스가
 *       error 상태에 들어가면, 종료 상태가 아닌 모든 인스턴스에 {@code fatal_error}를 한 번 전달</li>
 *   <li>노드가 자기 계약에 따라 정상 종료 상태(예: completed)에 들어가는 것은 실패가 아님</li>
 *   <li>실패한 인스턴스를 자동으로 재시작하지 않음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> start/shutdown은 서로 직렬화됩니다. 이벤트 전달은 인스턴스 단위로만
 * 직렬화되며 Busy 응답은 백오프 후 재시도합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefaultLifecycleOrchestrator implements LifecycleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultLifecycleOrchestrator.class);

    /** 노드 구독 묶음의 자원 이름 (node_graph 계약의 cleanup 액션이 해제) */
    public static final String GRAPH_SUBSCRIPTIONS = "node_graph.subscriptions";

    private final LifecycleCollaborators collaborators;
    private final OrchestratorConfig config;
    private final TransitionEngine engine;
    private final BackoffCalculator backoff;
    private final InFlightTracker inFlight = new InFlightTracker();

    private final FsmInstance loader;
    private final FsmInstance registry;
    private final FsmInstance graph;
    private final Map<String, FsmInstance> nodes = new ConcurrentHashMap<>();
    private volatile List<String> wiringOrder = List.of();

    private final AtomicReference<OrchestratorPhase> phase = new AtomicReference<>(OrchestratorPhase.CREATED);
    private final AtomicBoolean fatalPropagated = new AtomicBoolean();
    private volatile boolean shuttingDown;

    private final LifecycleListener observer = new Slf4jLifecycleListener();
    private final LifecycleListener fatalWatcher = this::onStateChanged;

    private final Object lifecycleLock = new Object();
    private ShutdownReport shutdownReport;

    public DefaultLifecycleOrchestrator(LifecycleContracts contracts,
                                        LifecycleCollaborators collaborators,
                                        ActionExecutor executor) {
        this(contracts, collaborators, executor, new OrchestratorConfig());
    }

    /**
     * 생성자.
     *
     * @param contracts 내장 인스턴스 계약
     * @param collaborators 외부 협력자
     * @param executor 액션 실행자
     * @param config 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultLifecycleOrchestrator(LifecycleContracts contracts,
                                        LifecycleCollaborators collaborators,
                                        ActionExecutor executor,
                                        OrchestratorConfig config) {
        if (contracts == null) {
            throw new IllegalArgumentException("contracts cannot be null");
        }
        if (collaborators == null) {
            throw new IllegalArgumentException("collaborators cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.collaborators = collaborators;
        this.config = config;
        this.engine = new TransitionEngine(executor);
        this.backoff = new BackoffCalculator(config);

        this.loader = track(new FsmInstance(InstanceRole.CONTRACT_LOADER.instanceName(), contracts.loader(), engine));
        this.registry = track(new FsmInstance(InstanceRole.CONTRACT_REGISTRY.instanceName(), contracts.registry(), engine));
        this.graph = track(new FsmInstance(InstanceRole.NODE_GRAPH.instanceName(), contracts.graph(), engine));
    }

    @Override
    public StartupReport start() {
        synchronized (lifecycleLock) {
            moveTo(OrchestratorPhase.STARTING);
            long startNanos = System.nanoTime();
            List<String> warnings = new ArrayList<>();
            List<String> nonCritical = new ArrayList<>();

            try {
                List<Contract> contracts = discoverAndValidate(warnings, nonCritical);
                NodeGraph nodeGraph = resolveGraph(contracts, nonCritical);
                wireNodes(nodeGraph, nonCritical);
                verifyReady();

                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                publishRuntimeReady(nodeGraph, elapsedMs);
                moveTo(OrchestratorPhase.RUNNING);

                List<String> nodeNames = contracts.stream().map(Contract::nodeName).collect(Collectors.toList());
                log.info("Runtime ready: {} nodes wired in {}ms ({} warnings, {} non-critical failures)",
                    nodeNames.size(), elapsedMs, warnings.size(), nonCritical.size());
                return new StartupReport(nodeNames, nodeGraph.nodeNames(), warnings, nonCritical, elapsedMs);

            } catch (TransitionAbortedException e) {
                failStartup(e);
                throw StartupException.aborted(e);
            } catch (StartupException e) {
                failStartup(e);
                throw e;
            } catch (RuntimeException e) {
                failStartup(e);
                throw new StartupException(null, null, "Startup failed: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public ShutdownReport shutdown() {
        synchronized (lifecycleLock) {
            if (shutdownReport != null) {
                return shutdownReport;
            }

            OrchestratorPhase current = phase.get();
            boolean wasRunning = current == OrchestratorPhase.RUNNING;
            if (wasRunning) {
                moveTo(OrchestratorPhase.SHUTTING_DOWN);
            } else if (current != OrchestratorPhase.FAILED) {
                PhaseTransition.validate(current, OrchestratorPhase.SHUTTING_DOWN);
            }
            shuttingDown = true;
            log.info("Shutdown requested (phase: {})", current);

            List<String> nonCritical = new ArrayList<>();
            long drainStart = System.nanoTime();
            boolean drained = true;

            if (!graph.isTerminal()) {
                deliverForShutdown(graph, SHUTDOWN_REQUESTED, nonCritical);
                drained = awaitDrain();
                if (!drained) {
                    nonCritical.add(String.format("%s/drain: %d in-flight operations still running after %dms",
                        graph.name(), inFlight.inFlight(), config.drainTimeoutMs()));
                    log.warn("Drain timed out after {}ms, forcing {}", config.drainTimeoutMs(), DRAIN_COMPLETE);
                }
                deliverForShutdown(graph, DRAIN_COMPLETE, nonCritical);
            }
            long drainWaitMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - drainStart);

            List<String> order = wiringOrder;
            for (int i = order.size() - 1; i >= 0; i--) {
                deliverForShutdown(nodes.get(order.get(i)), SHUTDOWN_REQUESTED, nonCritical);
            }
            deliverForShutdown(registry, SHUTDOWN_REQUESTED, nonCritical);
            deliverForShutdown(loader, SHUTDOWN_REQUESTED, nonCritical);

            if (wasRunning) {
                moveTo(OrchestratorPhase.STOPPED);
            }
            shutdownReport = new ShutdownReport(drained, drainWaitMs, nonCritical, snapshots());
            log.info("Shutdown complete (drained: {}, {} non-critical failures)", drained, nonCritical.size());
            return shutdownReport;
        }
    }

    @Override
    public TransitionResult deliver(String instanceName, String event) {
        FsmInstance target = instance(instanceName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown instance: " + instanceName));
        try (InFlightTracker.Ticket ticket = inFlight.begin()) {
            return deliverWithRetry(target, event);
        }
    }

    @Override
    public HealthSummary health() {
        return HealthSummary.of(phase.get(), snapshots());
    }

    @Override
    public OrchestratorPhase phase() {
        return phase.get();
    }

    @Override
    public FsmInstance instance(InstanceRole role) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        return switch (role) {
            case CONTRACT_LOADER -> loader;
            case CONTRACT_REGISTRY -> registry;
            case NODE_GRAPH -> graph;
        };
    }

    @Override
    public Optional<FsmInstance> instance(String instanceName) {
        if (instanceName == null) {
            return Optional.empty();
        }
        for (FsmInstance builtIn : List.of(loader, registry, graph)) {
            if (builtIn.name().equals(instanceName)) {
                return Optional.of(builtIn);
            }
        }
        return Optional.ofNullable(nodes.get(instanceName));
    }

    /**
     * 외부 작업의 drain 대상 등록용 추적기.
     *
     * @return 진행 중 작업 추적기
     */
    public InFlightTracker inFlight() {
        return inFlight;
    }

    // ============================================================
    // 시작 단계
    // ============================================================

    private List<Contract> discoverAndValidate(List<String> warnings, List<String> nonCritical) {
        drive(loader, DISCOVER, nonCritical, true);
        List<ContractDocument> documents;
        try {
            documents = collaborators.contractSource().discover();
        } catch (ContractSourceException e) {
            log.error("Contract discovery failed: {}", e.getMessage());
            drive(loader, DISCOVERY_FAILED, nonCritical, false);
            throw new StartupException(loader.name(), null,
                "Startup failed: contract discovery failed: " + e.getMessage(), e);
        }
        drive(loader, CONTRACTS_DISCOVERED, nonCritical, true);
        log.info("Discovered {} node contracts", documents.size());

        drive(registry, VALIDATE, nonCritical, true);
        List<Contract> contracts = new ArrayList<>(documents.size());
        List<SchemaException> rejected = new ArrayList<>();
        for (ContractDocument document : documents) {
            try {
                Contract contract = ContractParser.parse(document);
                ContractAnalysis analysis = ContractAnalyzer.analyze(contract);
                if (analysis.hasWarnings()) {
                    analysis.warnings().forEach(warning -> log.warn("Contract warning: {}", warning));
                    warnings.addAll(analysis.warnings());
                }
                contracts.add(contract);
            } catch (SchemaException e) {
                log.error("Contract {} rejected: {}", document.sourceId(), e.getViolations());
                rejected.add(e);
            }
        }
        if (!rejected.isEmpty()) {
            drive(registry, VALIDATION_FAILED, nonCritical, false);
            throw StartupException.invalidContract(rejected.get(0));
        }
        drive(registry, VALIDATION_PASSED, nonCritical, true);
        return contracts;
    }

    private NodeGraph resolveGraph(List<Contract> contracts, List<String> nonCritical) {
        NodeGraph nodeGraph;
        try {
            rejectReservedNames(contracts);
            nodeGraph = NodeGraph.resolve(contracts);
        } catch (SchemaException e) {
            log.error("Node graph rejected: {}", e.getViolations());
            deliverQuietly(graph, FATAL_ERROR);
            throw StartupException.invalidContract(e);
        }
        drive(graph, DEPENDENCIES_RESOLVED, nonCritical, true);
        return nodeGraph;
    }

    private void wireNodes(NodeGraph nodeGraph, List<String> nonCritical) {
        for (Contract contract : nodeGraph.order()) {
            nodes.put(contract.nodeName(), track(new FsmInstance(contract.nodeName(), contract, engine)));
        }
        wiringOrder = nodeGraph.nodeNames();

        SubscriptionWiring wiring = SubscriptionWiring.wire(nodeGraph, collaborators.eventBus());
        collaborators.resourceReleaser().register(GRAPH_SUBSCRIPTIONS, wiring);

        for (String name : wiringOrder) {
            FsmInstance node = nodes.get(name);
            if (node.contract().handles(START)) {
                drive(node, START, nonCritical, false);
            }
        }
        drive(graph, WIRING_COMPLETE, nonCritical, true);
    }

    private void verifyReady() {
        for (InstanceRole role : InstanceRole.values()) {
            FsmInstance instance = instance(role);
            if (!role.readyState().equals(instance.currentState())) {
                throw new StartupException(instance.name(), null, String.format(
                    "Startup failed: %s is in state '%s', expected '%s'",
                    instance.name(), instance.currentState(), role.readyState()), null);
            }
        }
    }

    private void publishRuntimeReady(NodeGraph nodeGraph, long elapsedMs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("nodes", nodeGraph.nodeNames());
        payload.put("elapsed_ms", elapsedMs);
        collaborators.eventBus().publish(TopicNames.RUNTIME_TOPIC, RUNTIME_READY, payload);
    }

    private void rejectReservedNames(List<Contract> contracts) {
        List<String> violations = new ArrayList<>();
        for (Contract contract : contracts) {
            for (InstanceRole role : InstanceRole.values()) {
                if (role.instanceName().equals(contract.nodeName())) {
                    violations.add("node name '" + contract.nodeName() + "' is reserved for a lifecycle instance");
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new SchemaException(NodeGraph.GRAPH_SOURCE, violations);
        }
    }

    private void failStartup(Exception cause) {
        log.error("Startup failed: {}", cause.getMessage());
        propagateFatal("startup");
        phase.updateAndGet(current -> current == OrchestratorPhase.STARTING
            ? PhaseTransition.transition(current, OrchestratorPhase.FAILED)
            : current);
    }

    // ============================================================
    // 이벤트 전달
    // ============================================================

    /**
     * 시작 단계 이벤트 전달.
     *
     * @param required true이면 NoMatch를 시작 실패로 처리
     */
    private TransitionResult drive(FsmInstance instance, String event, List<String> nonCritical, boolean required) {
        TransitionResult result = deliverWithRetry(instance, event);
        if (result instanceof TransitionResult.Committed committed) {
            recordFailures(instance, committed.failures(), nonCritical);
        } else if (required && result.isNoMatch()) {
            throw new StartupException(instance.name(), null, String.format(
                "Startup failed: %s did not accept '%s' in state '%s'",
                instance.name(), event, instance.currentState()), null);
        }
        return result;
    }

    private void deliverForShutdown(FsmInstance instance, String event, List<String> nonCritical) {
        if (instance == null || instance.isTerminal()) {
            return;
        }
        try {
            TransitionResult result = deliverWithRetry(instance, event);
            if (result instanceof TransitionResult.Committed committed) {
                recordFailures(instance, committed.failures(), nonCritical);
            }
        } catch (TransitionAbortedException e) {
            ActionFailure failure = e.getResult().failure();
            nonCritical.add(instance.name() + "/" + failure.actionName() + ": " + failure.message());
            log.warn("{} aborted '{}' during shutdown: {}", instance.name(), event, failure.message());
        } catch (LifecycleException e) {
            nonCritical.add(instance.name() + ": " + e.getMessage());
            log.warn("{} could not handle '{}' during shutdown: {}", instance.name(), event, e.getMessage());
        }
    }

    private void deliverQuietly(FsmInstance instance, String event) {
        try {
            deliverWithRetry(instance, event);
        } catch (LifecycleException e) {
            log.warn("Delivering '{}' to {} failed: {}", event, instance.name(), e.getMessage());
        }
    }

    private TransitionResult deliverWithRetry(FsmInstance instance, String event) {
        for (int attempt = 1; ; attempt++) {
            try {
                return instance.handle(event);
            } catch (InstanceBusyException e) {
                if (attempt >= config.busyRetryAttempts()) {
                    log.warn("{} still busy after {} attempts, giving up on '{}'", instance.name(), attempt, event);
                    throw e;
                }
                long delayMs = backoff.calculate(attempt);
                log.debug("{} busy, retrying '{}' in {}ms (attempt {}/{})",
                    instance.name(), event, delayMs, attempt, config.busyRetryAttempts());
                sleep(instance, delayMs);
            }
        }
    }

    private void sleep(FsmInstance instance, long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalLifecycleException(instance.name(), "interrupted while retrying a busy delivery", e);
        }
    }

    private boolean awaitDrain() {
        try {
            return inFlight.awaitIdle(config.drainTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ============================================================
    // 치명 오류 전파
    // ============================================================

    private void onStateChanged(FsmInstance instance, StateChangedEvent event) {
        if (shuttingDown) {
            return;
        }
        if (FATAL_ERROR.equals(event.event()) || enteredErrorState(instance, event.toState())) {
            propagateFatal(instance.name());
        }
    }

    private boolean enteredErrorState(FsmInstance instance, String toState) {
        for (InstanceRole role : InstanceRole.values()) {
            if (instance(role) == instance) {
                return role.errorState().equals(toState);
            }
        }
        return false;
    }

    private void propagateFatal(String origin) {
        if (!fatalPropagated.compareAndSet(false, true)) {
            return;
        }
        log.error("Propagating {} from {} to all non-terminal instances", FATAL_ERROR, origin);
        for (FsmInstance instance : allInstances()) {
            if (!instance.isTerminal()) {
                deliverQuietly(instance, FATAL_ERROR);
            }
        }
        OrchestratorPhase previous = phase.getAndUpdate(current -> current == OrchestratorPhase.RUNNING
            ? PhaseTransition.transition(current, OrchestratorPhase.FAILED)
            : current);
        if (previous == OrchestratorPhase.RUNNING) {
            log.error("Runtime failed after fatal error in {}", origin);
        }
    }

    // ============================================================
    // 내부 유틸리티
    // ============================================================

    private FsmInstance track(FsmInstance instance) {
        instance.addListener(observer);
        instance.addListener(fatalWatcher);
        return instance;
    }

    private void moveTo(OrchestratorPhase next) {
        OrchestratorPhase previous = phase.getAndUpdate(current -> PhaseTransition.transition(current, next));
        log.info("Orchestrator phase {} -> {}", previous, next);
    }

    private List<FsmInstance> allInstances() {
        List<FsmInstance> all = new ArrayList<>(List.of(loader, registry, graph));
        for (String name : wiringOrder) {
            all.add(nodes.get(name));
        }
        return all;
    }

    private List<InstanceSnapshot> snapshots() {
        return allInstances().stream().map(FsmInstance::snapshot).collect(Collectors.toList());
    }

    private static void recordFailures(FsmInstance instance, List<ActionRecord> failures, List<String> nonCritical) {
        for (ActionRecord record : failures) {
            String message = record.outcome() instanceof ActionFailure failure ? failure.message() : "failed";
            nonCritical.add(instance.name() + "/" + record.actionName() + ": " + message);
        }
    }
}
