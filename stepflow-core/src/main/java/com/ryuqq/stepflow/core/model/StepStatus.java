package com.ryuqq.stepflow.core.model;

/**
 * 개별 스텝의 실행 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StepStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
