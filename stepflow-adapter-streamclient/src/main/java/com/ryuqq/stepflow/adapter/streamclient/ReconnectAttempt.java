package com.ryuqq.stepflow.adapter.streamclient;

/**
 * 재연결 예약 알림.
 *
 * @param attempt 시도 번호 (1부터 시작)
 * @param delayMs 시도 전 대기 시간
 * @param maxAttempts 최대 시도 횟수
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ReconnectAttempt(int attempt, long delayMs, int maxAttempts) {
}
