package com.ryuqq.stepflow.core.statemachine;

/**
 * 워크플로우 세션의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * INITIALIZING
 *    │
 *    ▼
 * ACTIVE ◄──► PAUSED
 *    │
 *    ├─► BUSY (스텝 실행 중)
 *    │
 *    └─► COMPLETED / FAILED / CANCELLED
 *                 │
 *                 ▼
 *              CLEANUP (세션 제거)
 * </pre>
 *
 * <p>ACTIVE ⇄ PAUSED 만 양방향이며, 나머지 전이는 모두 전진 방향입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SessionStatus {

    /**
     * 세션 등록 직후.
     */
    INITIALIZING,

    /**
     * 실행 가능 (스텝 대기 또는 진행).
     */
    ACTIVE,

    /**
     * 스텝 실행 중.
     */
    BUSY,

    /**
     * 일시 중지.
     */
    PAUSED,

    /**
     * 모든 스텝 성공.
     */
    COMPLETED,

    /**
     * 스텝 실패로 종료.
     */
    FAILED,

    /**
     * 사용자 취소.
     */
    CANCELLED,

    /**
     * 리소스 정리 중 (제거 직전).
     */
    CLEANUP;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태의 세션에 대한 제어/조회 요청은 WORKFLOW_SESSION_NOT_FOUND로 거부됩니다.</p>
     *
     * @return COMPLETED, FAILED, CANCELLED, CLEANUP인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == CLEANUP;
    }

    /**
     * 동시 세션 수 집계 대상인지 확인.
     *
     * @return 종료 상태가 아닌 경우 true
     */
    public boolean isLive() {
        return !isTerminal();
    }
}
