package com.ryuqq.stepflow.core.statemachine;

/**
 * 세션 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INITIALIZING → ACTIVE, FAILED</li>
 *   <li>ACTIVE → PAUSED, BUSY, COMPLETED, FAILED, CANCELLED</li>
 *   <li>PAUSED → ACTIVE, FAILED, CANCELLED</li>
 *   <li>BUSY → COMPLETED, FAILED, CANCELLED</li>
 *   <li>CLEANUP을 제외한 모든 상태 → CLEANUP</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>CLEANUP에서는 어떤 상태로도 전이 불가</li>
 *   <li>COMPLETED, FAILED, CANCELLED에서는 CLEANUP으로만 전이 가능</li>
 *   <li>자기 자신으로의 전이 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionStatusTransition {

    private SessionStatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 허용 여부 확인.
     *
     * @param from 현재 상태
     * @param to 다음 상태
     * @return 허용되는 경우 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(SessionStatus from, SessionStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from == to || from == SessionStatus.CLEANUP) {
            return false;
        }
        if (to == SessionStatus.CLEANUP) {
            return true;
        }

        return switch (from) {
            case INITIALIZING -> to == SessionStatus.ACTIVE || to == SessionStatus.FAILED;
            case ACTIVE -> to == SessionStatus.PAUSED
                || to == SessionStatus.BUSY
                || to == SessionStatus.COMPLETED
                || to == SessionStatus.FAILED
                || to == SessionStatus.CANCELLED;
            case PAUSED -> to == SessionStatus.ACTIVE
                || to == SessionStatus.FAILED
                || to == SessionStatus.CANCELLED;
            case BUSY -> to == SessionStatus.COMPLETED
                || to == SessionStatus.FAILED
                || to == SessionStatus.CANCELLED;
            case COMPLETED, FAILED, CANCELLED, CLEANUP -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SessionStatus from, SessionStatus to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid session status transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static SessionStatus transition(SessionStatus current, SessionStatus next) {
        validate(current, next);
        return next;
    }
}
