package com.ryuqq.stepflow.core.model;

/**
 * 스트림 이벤트 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StreamEventType {

    // 워크플로우 이벤트
    WORKFLOW_STARTED,
    WORKFLOW_PROGRESS,
    WORKFLOW_COMPLETED,
    WORKFLOW_FAILED,
    WORKFLOW_PAUSED,
    WORKFLOW_RESUMED,

    // 스텝 이벤트
    STEP_STARTED,
    STEP_COMPLETED,
    STEP_FAILED,

    // 태스크 실행기에서 전달되는 이벤트
    AI_REASONING,
    COMMAND_COMPLETED,
    COMMAND_FAILED,
    SCREENSHOT_CAPTURED
}
