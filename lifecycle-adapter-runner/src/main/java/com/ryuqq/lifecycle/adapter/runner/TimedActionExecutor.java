package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.executor.ActionExecutor;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.model.ActionType;
import com.ryuqq.lifecycle.core.outcome.ActionFailure;
import com.ryuqq.lifecycle.core.outcome.ActionOutcome;
import com.ryuqq.lifecycle.core.outcome.ActionSuccess;
import com.ryuqq.lifecycle.core.spi.ActionHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 기한을 강제하는 ActionExecutor 구현체.
 *
 * <p>액션 종류별 {@link ActionHandler}를 전용 스레드 풀에서 실행하고,
 * 호출 스레드는 {@code timeout_ms}까지만 대기합니다.</p>
 *
 * <p><strong>결과 분류:</strong></p>
 * <ul>
 *   <li>기한 내 정상 종료: {@link ActionSuccess}</li>
 *   <li>핸들러 예외: ACTION_FAILED</li>
 *   <li>기한 초과: ACTION_TIMEOUT (실행 중인 핸들러는 인터럽트)</li>
 *   <li>호출 스레드 인터럽트: ACTION_INTERRUPTED (인터럽트 플래그 복원)</li>
 *   <li>핸들러 미등록: NO_HANDLER</li>
 * </ul>
 *
 * <p>재시도는 하지 않습니다. 치명 여부에 따른 처리는 TransitionEngine 책임입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TimedActionExecutor implements ActionExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimedActionExecutor.class);

    private static final long SHUTDOWN_WAIT_MS = 1000;

    private final Map<ActionType, ActionHandler> handlers;
    private final ExecutorService pool;

    /**
     * 기본 설정으로 생성.
     *
     * @param handlers 액션 종류별 핸들러
     */
    public TimedActionExecutor(Map<ActionType, ActionHandler> handlers) {
        this(handlers, new ActionExecutorConfig());
    }

    /**
     * 생성자.
     *
     * @param handlers 액션 종류별 핸들러 (없는 종류는 NO_HANDLER로 실패)
     * @param config 실행 설정
     * @throws IllegalArgumentException handlers 또는 config가 null인 경우
     */
    public TimedActionExecutor(Map<ActionType, ActionHandler> handlers, ActionExecutorConfig config) {
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.handlers = handlers.isEmpty() ? Map.of() : new EnumMap<>(handlers);
        this.pool = Executors.newFixedThreadPool(config.maxConcurrentActions(),
            new NamedThreadFactory(config.threadNamePrefix()));
    }

    @Override
    public ActionOutcome execute(ActionDefinition action, ActionContext context) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        ActionHandler handler = handlers.get(action.type());
        if (handler == null) {
            return ActionFailure.of(action.name(), ActionFailure.NO_HANDLER,
                "No handler registered for action_type '" + action.type().wireName() + "'");
        }

        long startNanos = System.nanoTime();
        Future<?> future;
        try {
            future = pool.submit(() -> {
                handler.handle(action, context);
                return null;
            });
        } catch (RejectedExecutionException e) {
            return ActionFailure.of(action.name(), ActionFailure.ACTION_FAILED,
                "Action executor is closed", e.getClass().getName());
        }

        try {
            future.get(action.timeoutMs(), TimeUnit.MILLISECONDS);
            return ActionSuccess.of(action.name(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Action {} of {} exceeded {}ms, interrupting handler",
                action.name(), context.instanceName(), action.timeoutMs());
            return ActionFailure.timeout(action.name(), action.timeoutMs());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return ActionFailure.of(action.name(), ActionFailure.ACTION_FAILED,
                describe(cause), cause.getClass().getName());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ActionFailure.of(action.name(), ActionFailure.ACTION_INTERRUPTED,
                "Interrupted while waiting for action '" + action.name() + "'");
        }
    }

    /**
     * 스레드 풀 종료.
     *
     * <p>실행 중인 액션은 잠시 기다린 뒤 인터럽트합니다.</p>
     */
    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isClosed() {
        return pool.isShutdown();
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger sequence = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
