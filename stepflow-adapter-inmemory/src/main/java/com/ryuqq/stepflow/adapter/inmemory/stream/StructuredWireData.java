package com.ryuqq.stepflow.adapter.inmemory.stream;

import java.time.Instant;

/**
 * {@code structured_event} 메시지의 data에 JSON 문자열로 실리는 페이로드.
 *
 * <p>type에 따라 채워지는 필드가 다르며, null 필드는 직렬화되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StructuredWireData(
    String type,
    String text,
    String confidence,
    String actionName,
    Boolean success,
    String error,
    String screenshotId,
    Integer stepId,
    Instant timestamp
) {
}
