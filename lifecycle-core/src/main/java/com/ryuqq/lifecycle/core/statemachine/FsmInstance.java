package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.error.InstanceBusyException;
import com.ryuqq.lifecycle.core.error.TransitionAbortedException;
import com.ryuqq.lifecycle.core.model.Contract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 계약 하나와 런타임 상태를 묶은 FSM 인스턴스.
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>{@code inTransition} 플래그가 단일 작성자 잠금 역할 (CAS)</li>
 *   <li>전이 중 들어온 이벤트는 대기하지 않고 {@link InstanceBusyException}으로 거절</li>
 *   <li>상태와 generation은 하나의 불변 값으로 함께 교체되어 스냅샷이 항상 일관됨</li>
 * </ul>
 *
 * <p>상태는 {@link TransitionEngine}만 변경하며, {@code state_changed} 알림은
 * 커밋 후 잠금이 풀린 다음 발행됩니다.</p>
 *
 * <p><strong>알림 순서:</strong> 알림은 generation 순서대로만 리스너에 전달됩니다.
 * 앞선 알림을 다른 스레드(또는 리스너 자신)가 전달하는 중이면, 뒤의 알림은 대기열에 들어가고
 * 이미 전달 중인 스레드가 이어서 전달합니다. 따라서 {@link #handle(String, String)}이
 * 반환된 시점에 자기 알림이 아직 전달되지 않았을 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FsmInstance {

    private static final Logger log = LoggerFactory.getLogger(FsmInstance.class);

    private final String name;
    private final Contract contract;
    private final TransitionEngine engine;
    private final AtomicBoolean inTransition = new AtomicBoolean(false);
    private final List<LifecycleListener> listeners = new CopyOnWriteArrayList<>();

    private final Object dispatchLock = new Object();
    private final NavigableMap<Long, StateChangedEvent> pendingNotifications = new TreeMap<>();
    private long nextNotification = 1L;
    private boolean dispatching;

    private volatile Position position;
    private volatile TransitionResult lastResult;

    /**
     * 생성자. 초기 상태, generation 0으로 시작합니다.
     *
     * @param name 인스턴스 이름
     * @param contract 검증된 계약
     * @param engine 전이 엔진
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public FsmInstance(String name, Contract contract, TransitionEngine engine) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.name = name;
        this.contract = contract;
        this.engine = engine;
        this.position = new Position(contract.initialState(), 0L);
    }

    /**
     * 이벤트 처리 (새 상관관계 ID 생성).
     *
     * @param event 이벤트 이름
     * @return Committed 또는 NoMatch
     * @throws InstanceBusyException 다른 전이가 진행 중인 경우
     * @throws TransitionAbortedException 치명 액션 실패로 전이가 중단된 경우
     */
    public TransitionResult handle(String event) {
        return handle(event, UUID.randomUUID().toString());
    }

    /**
     * 이벤트 처리.
     *
     * <p>중단된 전이는 결과를 기록한 뒤 {@link TransitionAbortedException}으로 호출자에게
     * 한 번 전달됩니다.</p>
     *
     * @param event 이벤트 이름
     * @param correlationId 상관관계 ID
     * @return Committed 또는 NoMatch
     * @throws InstanceBusyException 다른 전이가 진행 중인 경우
     * @throws TransitionAbortedException 치명 액션 실패로 전이가 중단된 경우
     */
    public TransitionResult handle(String event, String correlationId) {
        TransitionResult result = engine.apply(this, event, correlationId);

        if (result instanceof TransitionResult.Committed committed) {
            dispatch(new StateChangedEvent(name, committed.fromState(), committed.toState(),
                committed.generation(), event, correlationId));
        } else if (result instanceof TransitionResult.Aborted aborted) {
            throw new TransitionAbortedException(name, aborted);
        }
        return result;
    }

    /**
     * 현재 상태 스냅샷.
     *
     * @return 읽기 전용 스냅샷
     */
    public InstanceSnapshot snapshot() {
        Position current = position;
        return new InstanceSnapshot(
            name,
            contract.nodeType(),
            contract.version(),
            current.state(),
            current.generation(),
            contract.isTerminal(current.state()),
            inTransition.get(),
            lastResult
        );
    }

    public void addListener(LifecycleListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    public boolean removeListener(LifecycleListener listener) {
        return listeners.remove(listener);
    }

    public String name() {
        return name;
    }

    public Contract contract() {
        return contract;
    }

    public String currentState() {
        return position.state();
    }

    public long generation() {
        return position.generation();
    }

    public boolean isTerminal() {
        return contract.isTerminal(position.state());
    }

    public boolean isInTransition() {
        return inTransition.get();
    }

    public TransitionResult lastResult() {
        return lastResult;
    }

    // ---- TransitionEngine 전용 ----

    boolean tryBegin() {
        return inTransition.compareAndSet(false, true);
    }

    long commit(String toState) {
        Position next = new Position(toState, position.generation() + 1);
        position = next;
        return next.generation();
    }

    void record(TransitionResult result) {
        this.lastResult = result;
    }

    void release() {
        inTransition.set(false);
    }

    /**
     * 알림을 대기열에 넣고, 전달 중인 스레드가 없으면 generation 순서대로 전달.
     *
     * <p>아직 도착하지 않은 generation이 있으면 그 알림을 커밋한 스레드가 이어서 전달합니다.</p>
     */
    private void dispatch(StateChangedEvent event) {
        synchronized (dispatchLock) {
            pendingNotifications.put(event.generation(), event);
            if (dispatching) {
                return;
            }
            dispatching = true;
        }
        boolean drained = false;
        try {
            while (true) {
                StateChangedEvent next;
                synchronized (dispatchLock) {
                    next = pendingNotifications.remove(nextNotification);
                    if (next == null) {
                        dispatching = false;
                        drained = true;
                        return;
                    }
                    nextNotification++;
                }
                notifyListeners(next);
            }
        } finally {
            if (!drained) {
                synchronized (dispatchLock) {
                    dispatching = false;
                }
            }
        }
    }

    private void notifyListeners(StateChangedEvent event) {
        for (LifecycleListener listener : listeners) {
            try {
                listener.onStateChanged(this, event);
            } catch (RuntimeException e) {
                log.error("Lifecycle listener failed for instance {} ({} -> {}): {}",
                    name, event.fromState(), event.toState(), e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        Position current = position;
        return "FsmInstance{" + name + ", state=" + current.state() + ", generation=" + current.generation() + "}";
    }

    private record Position(String state, long generation) {
    }
}
