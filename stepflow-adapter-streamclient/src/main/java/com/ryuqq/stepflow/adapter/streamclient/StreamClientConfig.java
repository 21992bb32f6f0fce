package com.ryuqq.stepflow.adapter.streamclient;

import java.util.List;

/**
 * Reconnecting Stream Client 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>baseUrl: http://localhost:3000</li>
 *   <li>reconnectDelaysMs: [3000, 9000, 15000]</li>
 *   <li>maxReconnectAttempts: 3</li>
 * </ul>
 *
 * @param baseUrl 스트림 서버 주소 (끝의 '/' 없이)
 * @param reconnectDelaysMs 재연결 시도별 대기 시간 (비어 있지 않아야 함, 모두 0 이상)
 * @param maxReconnectAttempts 최대 재연결 시도 횟수 (1 이상)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StreamClientConfig(String baseUrl, List<Long> reconnectDelaysMs, int maxReconnectAttempts) {

    public static final String DEFAULT_BASE_URL = "http://localhost:3000";
    public static final List<Long> DEFAULT_RECONNECT_DELAYS_MS = List.of(3_000L, 9_000L, 15_000L);
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 3;

    static final String STREAM_PATH = "/api/stream/ws/";

    public StreamClientConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be null or blank");
        }
        if (reconnectDelaysMs == null || reconnectDelaysMs.isEmpty()) {
            throw new IllegalArgumentException("reconnectDelaysMs cannot be null or empty");
        }
        for (Long delay : reconnectDelaysMs) {
            if (delay == null || delay < 0) {
                throw new IllegalArgumentException("reconnectDelaysMs cannot contain negative values (current: " + delay + ")");
            }
        }
        if (maxReconnectAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxReconnectAttempts must be positive (current: " + maxReconnectAttempts + ")"
            );
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        reconnectDelaysMs = List.copyOf(reconnectDelaysMs);
    }

    public StreamClientConfig() {
        this(DEFAULT_BASE_URL, DEFAULT_RECONNECT_DELAYS_MS, DEFAULT_MAX_RECONNECT_ATTEMPTS);
    }

    public StreamClientConfig withBaseUrl(String baseUrl) {
        return new StreamClientConfig(baseUrl, reconnectDelaysMs, maxReconnectAttempts);
    }

    public StreamClientConfig withReconnectDelaysMs(List<Long> reconnectDelaysMs) {
        return new StreamClientConfig(baseUrl, reconnectDelaysMs, maxReconnectAttempts);
    }

    public StreamClientConfig withMaxReconnectAttempts(int maxReconnectAttempts) {
        return new StreamClientConfig(baseUrl, reconnectDelaysMs, maxReconnectAttempts);
    }

    /**
     * 스트림 엔드포인트 URL.
     *
     * @param streamId 스트림 ID
     * @return {@code <baseUrl>/api/stream/ws/<streamId>}
     */
    public String streamUrl(String streamId) {
        return baseUrl + STREAM_PATH + streamId;
    }
}
