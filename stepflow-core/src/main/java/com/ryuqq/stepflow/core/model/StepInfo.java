package com.ryuqq.stepflow.core.model;

/**
 * 이벤트에 실리는 스텝 정보.
 *
 * @param stepIndex 스텝 인덱스
 * @param stepContent 스텝 내용
 * @param status 스텝 상태
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepInfo(int stepIndex, String stepContent, StepStatus status) {

    public StepInfo {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        stepContent = stepContent == null ? "" : stepContent;
    }
}
