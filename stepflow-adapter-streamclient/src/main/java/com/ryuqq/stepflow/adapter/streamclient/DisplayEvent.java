package com.ryuqq.stepflow.adapter.streamclient;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * 수신 메시지를 표시용으로 변환한 이벤트.
 *
 * @param id 클라이언트에서 생성한 ID
 * @param type 이벤트 타입
 * @param sessionId 세션 ID
 * @param stepIndex 스텝 인덱스 (nullable)
 * @param timestamp 이벤트 시각
 * @param message 표시 메시지
 * @param level 표시 수준
 * @param structuredData 구조화 페이로드 원본 (일반 이벤트는 null)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DisplayEvent(
    String id,
    DisplayEventType type,
    String sessionId,
    Integer stepIndex,
    Instant timestamp,
    String message,
    DisplayLevel level,
    JsonNode structuredData
) {

    public boolean isStructured() {
        return structuredData != null;
    }
}
