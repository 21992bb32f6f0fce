package com.ryuqq.stepflow.application.orchestrator;

import com.ryuqq.stepflow.core.statemachine.SessionStatus;

import java.time.Instant;

/**
 * {@link WorkflowOrchestrator#processSteps(StepProcessingRequest)} 결과.
 *
 * <p>설정 완료 시점의 스냅샷이며, 이후 진행 상황은 스트림 이벤트로 관찰합니다.</p>
 *
 * @param sessionId 워크플로우 세션 ID
 * @param streamId 스트림 ID (스트리밍 비활성 시 null)
 * @param initialStatus 세션 코디네이터가 보고한 초기 상태
 * @param estimatedDurationMs 예상 소요 시간 (밀리초)
 * @param createdAt 세션 생성 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepProcessingResult(
    String sessionId,
    String streamId,
    SessionStatus initialStatus,
    long estimatedDurationMs,
    Instant createdAt
) {

    public boolean hasStream() {
        return streamId != null;
    }
}
