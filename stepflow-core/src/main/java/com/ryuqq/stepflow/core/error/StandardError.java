package com.ryuqq.stepflow.core.error;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 표준화된 오류 값 (불변 record).
 *
 * <p>오류가 처음 감지된 경계에서 {@link ErrorHandler}가 생성하며, 생성 후 변경되지 않고
 * 값으로 전파됩니다. 예외로 던질 때는 {@link WorkflowException}에 담습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>id, category, severity, code, message, timestamp, moduleId는 non-null</li>
 *   <li>details는 수정 불가능한 Map (빈 Map 허용)</li>
 *   <li>cause는 null 허용 (오류 체인의 끝)</li>
 * </ul>
 *
 * @param id 고유 ID
 * @param category 오류 분류
 * @param severity 심각도
 * @param code 오류 코드 이름 (예: "VALIDATION_FAILED")
 * @param message 사람이 읽을 수 있는 메시지
 * @param details 부가 정보
 * @param cause 원인 오류 (nullable)
 * @param timestamp 생성 시각
 * @param moduleId 오류를 생성한 모듈
 * @param recoverable 복구 가능 여부
 * @param retryable 재시도 가능 여부
 * @param suggestedAction 권장 조치
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StandardError(
    String id,
    ErrorCategory category,
    ErrorSeverity severity,
    String code,
    String message,
    Map<String, Object> details,
    StandardError cause,
    Instant timestamp,
    String moduleId,
    boolean recoverable,
    boolean retryable,
    String suggestedAction
) {

    public StandardError {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (moduleId == null || moduleId.isBlank()) {
            throw new IllegalArgumentException("moduleId cannot be null or blank");
        }
        details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * details에 항목을 추가한 새 인스턴스 생성.
     *
     * <p>원본은 변경되지 않으며 id와 timestamp는 유지됩니다.</p>
     *
     * @param extra 추가할 항목
     * @return 새 StandardError
     */
    public StandardError withDetails(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.putAll(extra);
        return new StandardError(id, category, severity, code, message, merged, cause,
            timestamp, moduleId, recoverable, retryable, suggestedAction);
    }

    /**
     * 오류 코드가 주어진 코드와 일치하는지 확인.
     *
     * @param errorCode 비교할 코드
     * @return 일치 여부
     */
    public boolean hasCode(ErrorCode errorCode) {
        return errorCode != null && errorCode.name().equals(code);
    }
}
