package com.ryuqq.stepflow.adapter.streamclient;

import java.util.List;

/**
 * 고정 단계 재연결 대기 시간 계산기.
 *
 * <p>지수 증가가 아니라 설정된 목록을 시도마다 하나씩 소비합니다.
 * 목록이 끝나면 마지막 값을 반복하지만, 시도 횟수 자체는 {@code maxAttempts}로 제한됩니다.</p>
 *
 * <p><strong>예시 (delays=[3000, 9000, 15000], maxAttempts=5):</strong></p>
 * <ul>
 *   <li>attempt=1: 3000ms</li>
 *   <li>attempt=2: 9000ms</li>
 *   <li>attempt=3: 15000ms</li>
 *   <li>attempt=4, 5: 15000ms (마지막 값 반복)</li>
 *   <li>attempt=6: 시도하지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffSchedule {

    private final List<Long> delaysMs;
    private final int maxAttempts;

    public BackoffSchedule(StreamClientConfig config) {
        this(config.reconnectDelaysMs(), config.maxReconnectAttempts());
    }

    /**
     * 생성자.
     *
     * @param delaysMs 시도별 대기 시간 (비어 있지 않아야 함)
     * @param maxAttempts 최대 시도 횟수 (양수)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffSchedule(List<Long> delaysMs, int maxAttempts) {
        if (delaysMs == null || delaysMs.isEmpty()) {
            throw new IllegalArgumentException("delaysMs cannot be null or empty");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        this.delaysMs = List.copyOf(delaysMs);
        this.maxAttempts = maxAttempts;
    }

    /**
     * 시도별 대기 시간.
     *
     * @param attempt 시도 번호 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long delayForAttempt(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }
        return delaysMs.get(Math.min(attempt - 1, delaysMs.size() - 1));
    }

    /**
     * 추가 시도 가능 여부.
     *
     * @param attemptsSoFar 지금까지의 시도 횟수
     * @return 한도 미만이면 true
     */
    public boolean canAttempt(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
