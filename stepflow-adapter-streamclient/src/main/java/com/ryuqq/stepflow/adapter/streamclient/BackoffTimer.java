package com.ryuqq.stepflow.adapter.streamclient;

/**
 * 재연결 지연 실행 추상화.
 *
 * <p>테스트에서는 수동으로 진행시키는 구현으로 교체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BackoffTimer {

    /**
     * 지연 후 작업 실행 예약.
     *
     * @param delayMs 대기 시간 (밀리초)
     * @param task 실행할 작업
     * @return 취소 핸들
     */
    ScheduledTask schedule(long delayMs, Runnable task);

    /**
     * 예약 취소 핸들.
     */
    interface ScheduledTask {

        void cancel();
    }
}
