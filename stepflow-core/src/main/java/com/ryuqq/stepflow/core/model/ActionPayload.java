package com.ryuqq.stepflow.core.model;

import java.time.Instant;

/**
 * 브라우저 액션 실행 결과 페이로드.
 *
 * @param actionName 액션 이름
 * @param success 성공 여부
 * @param error 실패 사유 (성공 시 null)
 * @param stepIndex 스텝 인덱스 (nullable)
 * @param timestamp 발생 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActionPayload(
    String actionName,
    boolean success,
    String error,
    Integer stepIndex,
    Instant timestamp
) implements StructuredPayload {

    public ActionPayload {
        if (actionName == null || actionName.isBlank()) {
            throw new IllegalArgumentException("actionName cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    @Override
    public String kind() {
        return "action";
    }
}
