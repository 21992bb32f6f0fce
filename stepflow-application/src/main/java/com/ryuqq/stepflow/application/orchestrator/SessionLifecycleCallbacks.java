package com.ryuqq.stepflow.application.orchestrator;

import com.ryuqq.stepflow.core.statemachine.SessionStatus;

/**
 * 세션 생명주기 관찰자.
 *
 * <p>모든 메서드는 기본 no-op이며, 필요한 것만 재정의합니다.
 * 콜백에서 발생한 예외는 로그로 남고 오케스트레이터 동작에는 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SessionLifecycleCallbacks {

    SessionLifecycleCallbacks NONE = new SessionLifecycleCallbacks() { };

    default void onSessionCreated(String sessionId) {
    }

    default void onSessionDestroyed(String sessionId) {
    }

    default void onSessionStatusChanged(String sessionId, SessionStatus oldStatus, SessionStatus newStatus) {
    }
}
