package com.ryuqq.stepflow.core.error;

/**
 * 오류 심각도.
 *
 * <p>{@link ErrorHandler#handleError(StandardError)}는 심각도에 따라 로그 레벨을 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
