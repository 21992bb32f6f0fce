package com.ryuqq.stepflow.core.model;

import java.time.Instant;

/**
 * 스트림으로 게시되는 이벤트 (불변 record).
 *
 * <p>게시 시점에 새로운 id와 timestamp가 부여됩니다. 소비자는 timestamp 오름차순으로
 * 재정렬합니다.</p>
 *
 * @param id 고유 ID
 * @param type 이벤트 유형
 * @param sessionId 세션 ID
 * @param stepIndex 스텝 인덱스 (nullable)
 * @param timestamp 게시 시각
 * @param data 이벤트 데이터
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StreamEvent(
    String id,
    StreamEventType type,
    String sessionId,
    Integer stepIndex,
    Instant timestamp,
    StreamEventData data
) {

    public StreamEvent {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        data = data == null ? StreamEventData.ofMessage("") : data;
    }
}
