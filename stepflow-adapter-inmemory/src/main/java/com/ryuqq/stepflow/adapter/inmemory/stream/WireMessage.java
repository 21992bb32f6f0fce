package com.ryuqq.stepflow.adapter.inmemory.stream;

import java.time.Instant;

/**
 * 스트림 소비자에게 전달되는 와이어 메시지.
 *
 * <p>JSON 형태: {@code {"type": ..., "sessionId": ..., "data": ..., "timestamp": ...}}.
 * {@code structured_event}의 data는 그 자체로 JSON 문자열이므로 소비자는 두 번 파싱합니다.</p>
 *
 * @param type event, structured_event, error 중 하나
 * @param sessionId 세션 ID
 * @param data 메시지 본문 또는 JSON 인코딩된 구조화 페이로드
 * @param timestamp 전송 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WireMessage(String type, String sessionId, String data, Instant timestamp) {

    public static final String TYPE_EVENT = "event";
    public static final String TYPE_STRUCTURED_EVENT = "structured_event";
    public static final String TYPE_ERROR = "error";
}
