package com.ryuqq.stepflow.application.orchestrator;

import java.util.Map;

/**
 * 로컬 세션 생성 옵션.
 *
 * @param enableStreaming 스트림 이벤트 발행 여부
 * @param metadata 세션 메타데이터 (nullable → 빈 Map)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SessionConfig(boolean enableStreaming, Map<String, Object> metadata) {

    public SessionConfig {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static SessionConfig streaming(boolean enableStreaming) {
        return new SessionConfig(enableStreaming, Map.of());
    }
}
