package com.ryuqq.stepflow.core.error;

import java.util.Optional;

/**
 * 워크플로우 오케스트레이션 오류 코드 테이블.
 *
 * <p>각 코드는 분류, 심각도, 복구/재시도 가능 여부, 권장 조치를 고정적으로 가집니다.
 * {@link ErrorHandler}의 분류 함수들은 이 테이블만을 참조합니다.</p>
 *
 * <p><strong>외부 코드:</strong> 로그/대시보드에서 사용하는 안정적인 식별자
 * (SP001 ~ SP011)를 함께 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCode {

    VALIDATION_FAILED("SP001", ErrorCategory.VALIDATION, ErrorSeverity.LOW, false, false,
        "Check step format and content. Ensure all required fields are present and valid."),

    SESSION_CREATION_FAILED("SP002", ErrorCategory.EXECUTION, ErrorSeverity.CRITICAL, true, true,
        "Retry with exponential backoff. Check session coordinator availability."),

    TASK_LOOP_TIMEOUT("SP003", ErrorCategory.EXECUTION, ErrorSeverity.HIGH, true, true,
        "Increase timeout or simplify steps. Check AI integration connectivity."),

    CONCURRENT_LIMIT_EXCEEDED("SP004", ErrorCategory.SYSTEM, ErrorSeverity.CRITICAL, false, true,
        "Wait for available session slots or increase maximum concurrent sessions."),

    WORKFLOW_SESSION_NOT_FOUND("SP005", ErrorCategory.SYSTEM, ErrorSeverity.LOW, true, false,
        "Verify session ID and check if session was properly created."),

    MODULE_INITIALIZATION_FAILED("SP006", ErrorCategory.EXECUTION, ErrorSeverity.CRITICAL, false, false,
        "Check module dependencies and configuration. Restart the service."),

    STREAMING_INITIALIZATION_FAILED("SP007", ErrorCategory.INTEGRATION, ErrorSeverity.MEDIUM, true, true,
        "Check executor streamer availability and retry connection."),

    STEP_PROCESSING_TIMEOUT("SP008", ErrorCategory.EXECUTION, ErrorSeverity.HIGH, true, true,
        "Increase step timeout or break down complex steps into smaller ones."),

    DEPENDENCY_RESOLUTION_FAILED("SP009", ErrorCategory.SYSTEM, ErrorSeverity.CRITICAL, false, false,
        "Check dependency wiring and module registrations."),

    SESSION_COORDINATOR_ERROR("SP010", ErrorCategory.INTEGRATION, ErrorSeverity.HIGH, true, true,
        "Check session coordinator status and retry operation."),

    EVENT_PUBLISHING_FAILED("SP011", ErrorCategory.INTEGRATION, ErrorSeverity.MEDIUM, true, true,
        "Check event streaming system availability and retry publishing.");

    /**
     * 테이블에 없는 코드에 대한 권장 조치.
     */
    public static final String DEFAULT_SUGGESTED_ACTION = "Contact system administrator for assistance.";

    private final String externalCode;
    private final ErrorCategory category;
    private final ErrorSeverity severity;
    private final boolean recoverable;
    private final boolean retryable;
    private final String suggestedAction;

    ErrorCode(String externalCode, ErrorCategory category, ErrorSeverity severity,
              boolean recoverable, boolean retryable, String suggestedAction) {
        this.externalCode = externalCode;
        this.category = category;
        this.severity = severity;
        this.recoverable = recoverable;
        this.retryable = retryable;
        this.suggestedAction = suggestedAction;
    }

    /**
     * 코드 이름으로 조회.
     *
     * @param name 코드 이름 (예: "VALIDATION_FAILED")
     * @return 일치하는 코드, 없으면 empty
     */
    public static Optional<ErrorCode> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ErrorCode code : values()) {
            if (code.name().equals(name)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }

    public String externalCode() {
        return externalCode;
    }

    public ErrorCategory category() {
        return category;
    }

    public ErrorSeverity severity() {
        return severity;
    }

    public boolean recoverable() {
        return recoverable;
    }

    public boolean retryable() {
        return retryable;
    }

    public String suggestedAction() {
        return suggestedAction;
    }
}
