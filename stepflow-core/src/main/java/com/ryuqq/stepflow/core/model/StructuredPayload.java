package com.ryuqq.stepflow.core.model;

import java.time.Instant;

/**
 * 스트림 이벤트에 실리는 구조화된 하위 페이로드.
 *
 * <p>와이어 상에서는 {@code structured_event} 메시지로 전달되며, {@link #kind()}가
 * 페이로드의 {@code type} 태그가 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface StructuredPayload permits ReasoningPayload, ActionPayload, ScreenshotPayload {

    /**
     * 페이로드 태그 ("reasoning", "action", "screenshot").
     */
    String kind();

    /**
     * 관련 스텝 인덱스 (nullable).
     */
    Integer stepIndex();

    Instant timestamp();
}
