package com.ryuqq.lifecycle.application.orchestrator;

/**
 * 오케스트레이터가 내장 라이프사이클 인스턴스에 전달하는 이벤트 이름.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LifecycleEvents {

    public static final String DISCOVER = "discover";
    public static final String CONTRACTS_DISCOVERED = "contracts_discovered";
    public static final String DISCOVERY_FAILED = "discovery_failed";

    public static final String VALIDATE = "validate";
    public static final String VALIDATION_PASSED = "validation_passed";
    public static final String VALIDATION_FAILED = "validation_failed";

    public static final String DEPENDENCIES_RESOLVED = "dependencies_resolved";
    public static final String WIRING_COMPLETE = "wiring_complete";
    public static final String SHUTDOWN_REQUESTED = "shutdown_requested";
    public static final String DRAIN_COMPLETE = "drain_complete";

    /** 모든 인스턴스가 처리해야 하는 와일드카드 치명 이벤트 */
    public static final String FATAL_ERROR = "fatal_error";

    /** 노드 인스턴스 시작 이벤트 */
    public static final String START = "start";

    /** 런타임 준비 완료 알림 */
    public static final String RUNTIME_READY = "runtime.ready";

    private LifecycleEvents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
