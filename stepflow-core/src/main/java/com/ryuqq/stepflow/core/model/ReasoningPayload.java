package com.ryuqq.stepflow.core.model;

import java.time.Instant;

/**
 * AI 추론 페이로드.
 *
 * @param text 추론 내용
 * @param confidence 신뢰도 등급
 * @param stepIndex 스텝 인덱스 (nullable)
 * @param timestamp 발생 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ReasoningPayload(
    String text,
    ConfidenceLevel confidence,
    Integer stepIndex,
    Instant timestamp
) implements StructuredPayload {

    public ReasoningPayload {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (confidence == null) {
            throw new IllegalArgumentException("confidence cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    @Override
    public String kind() {
        return "reasoning";
    }
}
