package com.ryuqq.lifecycle.core.statemachine;

/**
 * FSM 인스턴스 상태 변경 리스너.
 *
 * <p>커밋 이후, 인스턴스 잠금이 해제된 뒤에 호출되므로 리스너 안에서 다른 이벤트를
 * 전달해도 됩니다. 리스너 예외는 로그로 남고 인스턴스에 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LifecycleListener {

    void onStateChanged(FsmInstance instance, StateChangedEvent event);
}
