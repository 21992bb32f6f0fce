package com.ryuqq.stepflow.core.model;

import com.ryuqq.stepflow.core.error.StandardError;
import com.ryuqq.stepflow.core.statemachine.SessionStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 오케스트레이터 로컬 세션 상태 (불변 스냅샷).
 *
 * <p>같은 sessionId의 {@link WorkflowSession}과 연결됩니다. 레지스트리는 이 스냅샷을
 * 원자적으로 교체하는 방식으로만 상태를 변경합니다.</p>
 *
 * @param sessionId 세션 ID
 * @param linkedWorkflowSessionId 연결된 워크플로우 세션 ID
 * @param status 상태
 * @param currentStepIndex 현재 스텝 인덱스
 * @param totalSteps 전체 스텝 수
 * @param streamingEnabled 스트리밍 활성화 여부
 * @param executionProgress 진행 상황
 * @param stepHistory 스텝 실행 이력
 * @param createdAt 생성 시각
 * @param lastActivity 마지막 활동 시각
 * @param metadata 부가 정보
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepProcessorSession(
    String sessionId,
    String linkedWorkflowSessionId,
    SessionStatus status,
    int currentStepIndex,
    int totalSteps,
    boolean streamingEnabled,
    ExecutionProgress executionProgress,
    List<StepExecutionSummary> stepHistory,
    Instant createdAt,
    Instant lastActivity,
    Map<String, Object> metadata
) {

    public StepProcessorSession {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (executionProgress == null) {
            throw new IllegalArgumentException("executionProgress cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        linkedWorkflowSessionId = linkedWorkflowSessionId == null ? sessionId : linkedWorkflowSessionId;
        lastActivity = lastActivity == null ? createdAt : lastActivity;
        stepHistory = stepHistory == null ? List.of() : List.copyOf(stepHistory);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * 새 세션 생성 (INITIALIZING, 스텝 0개).
     */
    public static StepProcessorSession initializing(String sessionId, boolean streamingEnabled,
                                                    Map<String, Object> metadata, Instant now) {
        return new StepProcessorSession(sessionId, sessionId, SessionStatus.INITIALIZING, 0, 0,
            streamingEnabled, ExecutionProgress.initial(sessionId, 0, "", now), List.of(), now, now, metadata);
    }

    public StepProcessorSession withStatus(SessionStatus status, Instant now) {
        return new StepProcessorSession(sessionId, linkedWorkflowSessionId, status, currentStepIndex, totalSteps,
            streamingEnabled, executionProgress, stepHistory, createdAt, now, metadata);
    }

    public StepProcessorSession withSteps(List<String> steps, Instant now) {
        String first = steps.isEmpty() ? "" : steps.get(0);
        return new StepProcessorSession(sessionId, linkedWorkflowSessionId, status, 0, steps.size(),
            streamingEnabled, ExecutionProgress.initial(sessionId, steps.size(), first, now), List.of(),
            createdAt, now, metadata);
    }

    public StepProcessorSession withActivity(Instant now) {
        return new StepProcessorSession(sessionId, linkedWorkflowSessionId, status, currentStepIndex, totalSteps,
            streamingEnabled, executionProgress, stepHistory, createdAt, now, metadata);
    }

    /**
     * i번째 스텝 시작 반영 (진행 상황 + 이력 추가).
     */
    public StepProcessorSession startingStep(int stepIndex, String stepContent, Instant now) {
        List<StepExecutionSummary> history = new ArrayList<>(stepHistory);
        history.add(StepExecutionSummary.started(stepIndex, stepContent, now));
        return new StepProcessorSession(sessionId, linkedWorkflowSessionId, status, stepIndex, totalSteps,
            streamingEnabled, executionProgress.startingStep(stepIndex, stepContent, now), history,
            createdAt, now, metadata);
    }

    /**
     * 마지막으로 시작된 스텝의 성공 반영.
     */
    public StepProcessorSession completingStep(Instant now) {
        List<StepExecutionSummary> history = new ArrayList<>(stepHistory);
        long durationMs = 0L;
        if (!history.isEmpty()) {
            StepExecutionSummary done = history.remove(history.size() - 1).completed(now);
            durationMs = done.durationMs();
            history.add(done);
        }
        return new StepProcessorSession(sessionId, linkedWorkflowSessionId, status, currentStepIndex, totalSteps,
            streamingEnabled, executionProgress.completingStep(durationMs, now), history,
            createdAt, now, metadata);
    }

    /**
     * 마지막으로 시작된 스텝의 실패 반영.
     */
    public StepProcessorSession failingStep(StandardError error, Instant now) {
        List<StepExecutionSummary> history = new ArrayList<>(stepHistory);
        if (!history.isEmpty()) {
            history.add(history.remove(history.size() - 1).failed(now, error));
        }
        return new StepProcessorSession(sessionId, linkedWorkflowSessionId, status, currentStepIndex, totalSteps,
            streamingEnabled, executionProgress, history, createdAt, now, metadata);
    }

    /**
     * 모든 스텝 완료 반영.
     */
    public StepProcessorSession finished(Instant now) {
        return new StepProcessorSession(sessionId, linkedWorkflowSessionId, status, totalSteps, totalSteps,
            streamingEnabled, executionProgress.finished(now), stepHistory, createdAt, now, metadata);
    }
}
