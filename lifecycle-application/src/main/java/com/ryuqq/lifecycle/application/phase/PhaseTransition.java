package com.ryuqq.lifecycle.application.phase;

/**
 * 오케스트레이터 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CREATED → STARTING</li>
 *   <li>STARTING → RUNNING</li>
 *   <li>STARTING → FAILED</li>
 *   <li>RUNNING → SHUTTING_DOWN</li>
 *   <li>RUNNING → FAILED</li>
 *   <li>SHUTTING_DOWN → STOPPED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(OrchestratorPhase from, OrchestratorPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case CREATED -> to == OrchestratorPhase.STARTING;
            case STARTING, RUNNING -> to == next(from) || to == OrchestratorPhase.FAILED;
            case SHUTTING_DOWN -> to == OrchestratorPhase.STOPPED;
            case STOPPED, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static OrchestratorPhase transition(OrchestratorPhase current, OrchestratorPhase next) {
        validate(current, next);
        return next;
    }

    private static OrchestratorPhase next(OrchestratorPhase phase) {
        return phase == OrchestratorPhase.STARTING ? OrchestratorPhase.RUNNING : OrchestratorPhase.SHUTTING_DOWN;
    }
}
