package com.ryuqq.stepflow.application.orchestrator;

/**
 * Workflow Orchestrator 설정.
 *
 * <p>동시 세션 수, 요청 검증 한도, 기본 스트리밍 여부, 예상 소요 시간 산정 기준을 정의합니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>maxConcurrentSessions: 10</li>
 *   <li>maxStepsPerWorkflow: 100</li>
 *   <li>maxStepContentLength: 2000자</li>
 *   <li>streamingEnabled: true</li>
 *   <li>estimatedStepDurationMs: 30000ms (스텝당)</li>
 * </ul>
 *
 * @param maxConcurrentSessions 동시에 살아있을 수 있는 세션 수 (1 이상)
 * @param maxStepsPerWorkflow 워크플로우당 최대 스텝 수 (1 이상)
 * @param maxStepContentLength 스텝 하나의 최대 문자 수 (1 이상)
 * @param streamingEnabled 세션 설정이 없을 때의 스트리밍 기본값
 * @param estimatedStepDurationMs 스텝당 예상 소요 시간 (밀리초, 0 이상)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorConfig(
    int maxConcurrentSessions,
    int maxStepsPerWorkflow,
    int maxStepContentLength,
    boolean streamingEnabled,
    long estimatedStepDurationMs
) {

    public static final int DEFAULT_MAX_CONCURRENT_SESSIONS = 10;
    public static final int DEFAULT_MAX_STEPS_PER_WORKFLOW = 100;
    public static final int DEFAULT_MAX_STEP_CONTENT_LENGTH = 2000;
    public static final long DEFAULT_ESTIMATED_STEP_DURATION_MS = 30_000L;

    public OrchestratorConfig {
        if (maxConcurrentSessions <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentSessions must be positive (current: " + maxConcurrentSessions + ")"
            );
        }
        if (maxStepsPerWorkflow <= 0) {
            throw new IllegalArgumentException(
                "maxStepsPerWorkflow must be positive (current: " + maxStepsPerWorkflow + ")"
            );
        }
        if (maxStepContentLength <= 0) {
            throw new IllegalArgumentException(
                "maxStepContentLength must be positive (current: " + maxStepContentLength + ")"
            );
        }
        if (estimatedStepDurationMs < 0) {
            throw new IllegalArgumentException(
                "estimatedStepDurationMs cannot be negative (current: " + estimatedStepDurationMs + ")"
            );
        }
    }

    public OrchestratorConfig() {
        this(DEFAULT_MAX_CONCURRENT_SESSIONS, DEFAULT_MAX_STEPS_PER_WORKFLOW, DEFAULT_MAX_STEP_CONTENT_LENGTH,
            true, DEFAULT_ESTIMATED_STEP_DURATION_MS);
    }

    public OrchestratorConfig withMaxConcurrentSessions(int maxConcurrentSessions) {
        return new OrchestratorConfig(maxConcurrentSessions, maxStepsPerWorkflow, maxStepContentLength,
            streamingEnabled, estimatedStepDurationMs);
    }

    public OrchestratorConfig withMaxStepsPerWorkflow(int maxStepsPerWorkflow) {
        return new OrchestratorConfig(maxConcurrentSessions, maxStepsPerWorkflow, maxStepContentLength,
            streamingEnabled, estimatedStepDurationMs);
    }

    public OrchestratorConfig withMaxStepContentLength(int maxStepContentLength) {
        return new OrchestratorConfig(maxConcurrentSessions, maxStepsPerWorkflow, maxStepContentLength,
            streamingEnabled, estimatedStepDurationMs);
    }

    public OrchestratorConfig withStreamingEnabled(boolean streamingEnabled) {
        return new OrchestratorConfig(maxConcurrentSessions, maxStepsPerWorkflow, maxStepContentLength,
            streamingEnabled, estimatedStepDurationMs);
    }

    public OrchestratorConfig withEstimatedStepDurationMs(long estimatedStepDurationMs) {
        return new OrchestratorConfig(maxConcurrentSessions, maxStepsPerWorkflow, maxStepContentLength,
            streamingEnabled, estimatedStepDurationMs);
    }
}
