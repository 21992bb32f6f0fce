package com.ryuqq.stepflow.core.model;

import java.time.Instant;

/**
 * 스크린샷 캡처 페이로드.
 *
 * @param screenshotId 스크린샷 참조 ID
 * @param actionName 스크린샷을 유발한 액션 (nullable)
 * @param stepIndex 스텝 인덱스 (nullable)
 * @param timestamp 발생 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ScreenshotPayload(
    String screenshotId,
    String actionName,
    Integer stepIndex,
    Instant timestamp
) implements StructuredPayload {

    public ScreenshotPayload {
        if (screenshotId == null || screenshotId.isBlank()) {
            throw new IllegalArgumentException("screenshotId cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    @Override
    public String kind() {
        return "screenshot";
    }
}
