package com.ryuqq.stepflow.core.model;

import com.ryuqq.stepflow.core.error.StandardError;

import java.util.Map;

/**
 * 스트림 이벤트 데이터.
 *
 * <p>message 외의 필드는 이벤트 유형에 따라 선택적으로 채워집니다.</p>
 *
 * @param message 표시용 메시지
 * @param step 스텝 정보 (nullable)
 * @param progress 진행 상황 (nullable)
 * @param error 오류 (nullable)
 * @param structured 구조화된 페이로드 (nullable)
 * @param details 부가 정보
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StreamEventData(
    String message,
    StepInfo step,
    ExecutionProgress progress,
    StandardError error,
    StructuredPayload structured,
    Map<String, Object> details
) {

    public StreamEventData {
        message = message == null ? "" : message;
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static StreamEventData ofMessage(String message) {
        return new StreamEventData(message, null, null, null, null, null);
    }

    public static StreamEventData ofStep(String message, StepInfo step) {
        return new StreamEventData(message, step, null, null, null, null);
    }

    public static StreamEventData ofStructured(String message, StructuredPayload structured) {
        return new StreamEventData(message, null, null, null, structured, null);
    }

    public boolean hasStructured() {
        return structured != null;
    }
}
