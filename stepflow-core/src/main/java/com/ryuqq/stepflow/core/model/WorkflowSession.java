package com.ryuqq.stepflow.core.model;

import com.ryuqq.stepflow.core.statemachine.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 하나의 자동화 실행을 식별하는 통합 워크플로우 세션.
 *
 * <p>Session Coordinator가 단독으로 소유합니다. 오케스트레이터는 같은 sessionId로
 * 연결된 {@link StepProcessorSession}을 별도로 관리합니다.</p>
 *
 * @param sessionId 세션 ID (고유)
 * @param executorSessionId 실행기 세션 ID
 * @param streamId 이벤트 스트림 ID (스트리밍 비활성 시 null)
 * @param aiConnectionId AI 연결 ID
 * @param status 상태
 * @param createdAt 생성 시각
 * @param lastActivity 마지막 활동 시각
 * @param steps 제출된 원본 스텝 목록
 * @param metadata 부가 정보
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowSession(
    String sessionId,
    String executorSessionId,
    String streamId,
    String aiConnectionId,
    SessionStatus status,
    Instant createdAt,
    Instant lastActivity,
    List<String> steps,
    Map<String, Object> metadata
) {

    public WorkflowSession {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (executorSessionId == null || executorSessionId.isBlank()) {
            throw new IllegalArgumentException("executorSessionId cannot be null or blank");
        }
        if (aiConnectionId == null || aiConnectionId.isBlank()) {
            throw new IllegalArgumentException("aiConnectionId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        lastActivity = lastActivity == null ? createdAt : lastActivity;
        steps = steps == null ? List.of() : List.copyOf(steps);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean hasStream() {
        return streamId != null && !streamId.isBlank();
    }

    public WorkflowSession withStatus(SessionStatus status, Instant at) {
        return new WorkflowSession(sessionId, executorSessionId, streamId, aiConnectionId,
            status, createdAt, at, steps, metadata);
    }
}
