package com.ryuqq.stepflow.core.model;

import java.time.Instant;

/**
 * 워크플로우 진행 상황 스냅샷 (불변 record).
 *
 * <p><strong>불변식:</strong> {@code 0 ≤ completedSteps ≤ currentStepIndex ≤ totalSteps},
 * {@code 0 ≤ overallProgress ≤ 100}</p>
 *
 * <p>진행 상황은 다음 메서드로만 전진합니다:</p>
 * <ul>
 *   <li>{@link #initial(String, int, String, Instant)} - 세션 시작</li>
 *   <li>{@link #startingStep(int, String, Instant)} - i번째 스텝 시작</li>
 *   <li>{@link #completingStep(long, Instant)} - 현재 스텝 성공</li>
 *   <li>{@link #finished(Instant)} - 모든 스텝 완료</li>
 * </ul>
 *
 * @param sessionId 세션 ID
 * @param totalSteps 전체 스텝 수
 * @param completedSteps 완료된 스텝 수
 * @param currentStepIndex 현재 스텝 인덱스
 * @param currentStepName 현재 스텝 내용
 * @param overallProgress 전체 진행률 (0~100)
 * @param averageStepDurationMs 평균 스텝 소요 시간 (밀리초)
 * @param estimatedTimeRemainingMs 예상 남은 시간 (밀리초, 산정 불가 시 null)
 * @param lastActivity 마지막 활동 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionProgress(
    String sessionId,
    int totalSteps,
    int completedSteps,
    int currentStepIndex,
    String currentStepName,
    double overallProgress,
    long averageStepDurationMs,
    Long estimatedTimeRemainingMs,
    Instant lastActivity
) {

    public ExecutionProgress {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (completedSteps < 0 || completedSteps > currentStepIndex || currentStepIndex > totalSteps) {
            throw new IllegalArgumentException(String.format(
                "Progress invariant violated: 0 <= completed(%d) <= current(%d) <= total(%d)",
                completedSteps, currentStepIndex, totalSteps));
        }
        if (overallProgress < 0.0 || overallProgress > 100.0) {
            throw new IllegalArgumentException("overallProgress must be between 0 and 100 (current: " + overallProgress + ")");
        }
        currentStepName = currentStepName == null ? "" : currentStepName;
    }

    public static ExecutionProgress initial(String sessionId, int totalSteps, String firstStepName, Instant now) {
        return new ExecutionProgress(sessionId, totalSteps, 0, 0, firstStepName, 0.0, 0L, null, now);
    }

    public ExecutionProgress startingStep(int stepIndex, String stepName, Instant now) {
        return new ExecutionProgress(sessionId, totalSteps, completedSteps, stepIndex, stepName,
            overallProgress, averageStepDurationMs, estimatedTimeRemainingMs, now);
    }

    /**
     * 현재 스텝 성공 반영.
     *
     * <p>평균 소요 시간은 누적 평균으로 갱신되고, 예상 남은 시간은
     * 평균 × 남은 스텝 수로 계산됩니다.</p>
     *
     * @param durationMs 방금 끝난 스텝의 소요 시간
     * @param now 현재 시각
     * @return 갱신된 진행 상황
     */
    public ExecutionProgress completingStep(long durationMs, Instant now) {
        int completed = completedSteps + 1;
        int current = Math.max(currentStepIndex, completed);
        long average = (averageStepDurationMs * completedSteps + Math.max(0L, durationMs)) / completed;
        int remaining = totalSteps - completed;
        return new ExecutionProgress(sessionId, totalSteps, completed, current, currentStepName,
            percentage(completed, totalSteps), average, average * remaining, now);
    }

    public ExecutionProgress finished(Instant now) {
        return new ExecutionProgress(sessionId, totalSteps, totalSteps, totalSteps, currentStepName,
            100.0, averageStepDurationMs, 0L, now);
    }

    private static double percentage(int completed, int total) {
        if (total == 0) {
            return 100.0;
        }
        return Math.min(100.0, completed * 100.0 / total);
    }
}
