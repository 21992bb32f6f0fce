package com.ryuqq.stepflow.adapter.streamclient;

/**
 * 소비자 측 이벤트 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DisplayEventType {
    WORKFLOW_PROGRESS,
    STRUCTURED_REASONING,
    STRUCTURED_ACTION,
    STRUCTURED_SCREENSHOT
}
