package com.ryuqq.stepflow.core.model;

import com.ryuqq.stepflow.core.error.StandardError;

import java.time.Duration;
import java.time.Instant;

/**
 * 스텝 실행 이력 한 건.
 *
 * @param stepIndex 스텝 인덱스
 * @param stepContent 스텝 내용
 * @param status 실행 상태
 * @param startTime 시작 시각
 * @param endTime 종료 시각 (진행 중이면 null)
 * @param durationMs 소요 시간 (진행 중이면 null)
 * @param error 실패 시 오류 (nullable)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepExecutionSummary(
    int stepIndex,
    String stepContent,
    StepStatus status,
    Instant startTime,
    Instant endTime,
    Long durationMs,
    StandardError error
) {

    public StepExecutionSummary {
        if (stepIndex < 0) {
            throw new IllegalArgumentException("stepIndex cannot be negative (current: " + stepIndex + ")");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (startTime == null) {
            throw new IllegalArgumentException("startTime cannot be null");
        }
    }

    public static StepExecutionSummary started(int stepIndex, String stepContent, Instant startTime) {
        return new StepExecutionSummary(stepIndex, stepContent, StepStatus.IN_PROGRESS, startTime, null, null, null);
    }

    public StepExecutionSummary completed(Instant endTime) {
        return new StepExecutionSummary(stepIndex, stepContent, StepStatus.COMPLETED, startTime, endTime,
            Duration.between(startTime, endTime).toMillis(), null);
    }

    public StepExecutionSummary failed(Instant endTime, StandardError error) {
        return new StepExecutionSummary(stepIndex, stepContent, StepStatus.FAILED, startTime, endTime,
            Duration.between(startTime, endTime).toMillis(), error);
    }
}
