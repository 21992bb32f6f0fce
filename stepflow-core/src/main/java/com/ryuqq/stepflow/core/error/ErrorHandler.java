package com.ryuqq.stepflow.core.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 오류 분류 및 표준화 처리기.
 *
 * <p>분류 함수들은 {@link ErrorCode} 테이블만 참조하는 순수 함수이며,
 * 유일한 부수효과는 {@link #handleError(StandardError)}의 로깅입니다.</p>
 *
 * <p><strong>테이블에 없는 코드의 기본값:</strong></p>
 * <ul>
 *   <li>category: SYSTEM</li>
 *   <li>severity: LOW</li>
 *   <li>recoverable: true, retryable: false</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try {
 *     taskExecutor.processStep(request);
 * } catch (RuntimeException e) {
 *     StandardError error = errorHandler.wrapError(e, "STEP_PROCESSING_TIMEOUT", "Failed to process step 0");
 *     errorHandler.handleError(error);
 *     throw new WorkflowException(error, e);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ErrorHandler {

    public static final String DEFAULT_MODULE_ID = "workflow-orchestrator";

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    private final String moduleId;

    public ErrorHandler() {
        this(DEFAULT_MODULE_ID);
    }

    /**
     * 생성자.
     *
     * @param moduleId 생성되는 오류에 기록될 모듈 ID
     * @throws IllegalArgumentException moduleId가 null이거나 빈 문자열인 경우
     */
    public ErrorHandler(String moduleId) {
        if (moduleId == null || moduleId.isBlank()) {
            throw new IllegalArgumentException("moduleId cannot be null or blank");
        }
        this.moduleId = moduleId;
    }

    public ErrorCategory categorizeError(String code) {
        return ErrorCode.fromName(code).map(ErrorCode::category).orElse(ErrorCategory.SYSTEM);
    }

    public ErrorSeverity determineSeverity(String code) {
        return ErrorCode.fromName(code).map(ErrorCode::severity).orElse(ErrorSeverity.LOW);
    }

    public boolean isRecoverable(String code) {
        return ErrorCode.fromName(code).map(ErrorCode::recoverable).orElse(true);
    }

    public boolean isRetryable(String code) {
        return ErrorCode.fromName(code).map(ErrorCode::retryable).orElse(false);
    }

    public String getSuggestedAction(String code) {
        return ErrorCode.fromName(code)
            .map(ErrorCode::suggestedAction)
            .orElse(ErrorCode.DEFAULT_SUGGESTED_ACTION);
    }

    public StandardError createStandardError(ErrorCode code, String message) {
        return createStandardError(code.name(), message, null, null);
    }

    public StandardError createStandardError(ErrorCode code, String message, Map<String, Object> details) {
        return createStandardError(code.name(), message, details, null);
    }

    /**
     * 코드 테이블을 기반으로 StandardError 생성.
     *
     * <p>cause가 주어지면 "WRAPPED_ERROR" 코드로 감싸 오류 체인에 연결합니다.
     * cause가 이미 {@link WorkflowException}이면 그 오류를 그대로 연결합니다.</p>
     *
     * @param code 오류 코드 이름
     * @param message 메시지
     * @param details 부가 정보 (nullable)
     * @param cause 원인 예외 (nullable)
     * @return 새 StandardError
     */
    public StandardError createStandardError(String code, String message,
                                             Map<String, Object> details, Throwable cause) {
        StandardError wrappedCause = cause == null
            ? null
            : wrapError(cause, "WRAPPED_ERROR", "Wrapped underlying error");
        return build(code, message, details, wrappedCause);
    }

    public StandardError wrapError(Throwable error, String code, String message) {
        return wrapError(error, code, message, null);
    }

    /**
     * 임의의 예외를 StandardError로 정규화.
     *
     * <p><strong>멱등성:</strong> 이미 StandardError를 운반하는 {@link WorkflowException}이면
     * 새로 감싸지 않고 기존 오류를 그대로 반환합니다.</p>
     *
     * @param error 원본 예외
     * @param code 적용할 오류 코드 이름
     * @param message 메시지
     * @param details 부가 정보 (nullable)
     * @return StandardError
     */
    public StandardError wrapError(Throwable error, String code, String message, Map<String, Object> details) {
        if (error instanceof WorkflowException workflowException) {
            return workflowException.getError();
        }

        Map<String, Object> merged = new LinkedHashMap<>();
        if (details != null) {
            merged.putAll(details);
        }
        if (error != null) {
            merged.put("originalError", error.getMessage() != null ? error.getMessage() : error.toString());
            merged.put("originalType", error.getClass().getName());
        }
        return build(code, message, merged, null);
    }

    /**
     * 심각도에 따라 로깅.
     *
     * <ul>
     *   <li>CRITICAL, HIGH → error</li>
     *   <li>MEDIUM → warn</li>
     *   <li>LOW → info</li>
     * </ul>
     *
     * <p>메트릭/알림 연동 지점입니다.</p>
     *
     * @param error 처리할 오류
     */
    public void handleError(StandardError error) {
        switch (error.severity()) {
            case CRITICAL, HIGH -> log.error("[{}] {} (code={}, category={}, id={}, details={})",
                error.severity(), error.message(), error.code(), error.category(), error.id(), error.details());
            case MEDIUM -> log.warn("{} (code={}, category={}, id={}, details={})",
                error.message(), error.code(), error.category(), error.id(), error.details());
            default -> log.info("{} (code={}, category={}, id={})",
                error.message(), error.code(), error.category(), error.id());
        }
    }

    public void handleSessionError(String workflowSessionId, StandardError error) {
        handleError(error.withDetails(Map.of(
            "workflowSessionId", workflowSessionId,
            "context", "session_operation"
        )));
    }

    public void handleStepError(String workflowSessionId, int stepIndex, StandardError error) {
        handleError(error.withDetails(Map.of(
            "workflowSessionId", workflowSessionId,
            "stepIndex", stepIndex,
            "context", "step_execution"
        )));
    }

    public String getModuleId() {
        return moduleId;
    }

    private StandardError build(String code, String message, Map<String, Object> details, StandardError cause) {
        return new StandardError(
            UUID.randomUUID().toString(),
            categorizeError(code),
            determineSeverity(code),
            code,
            message,
            details,
            cause,
            Instant.now(),
            moduleId,
            isRecoverable(code),
            isRetryable(code),
            getSuggestedAction(code)
        );
    }
}
