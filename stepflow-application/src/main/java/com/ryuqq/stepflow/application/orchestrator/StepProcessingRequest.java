package com.ryuqq.stepflow.application.orchestrator;

import com.ryuqq.stepflow.core.model.ProcessingConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 워크플로우 실행 요청.
 *
 * <p>요청 자체는 검증하지 않습니다. 빈 스텝 목록, 한도 초과, 누락된 설정 등은
 * {@link WorkflowOrchestrator#processSteps(StepProcessingRequest)}가 VALIDATION 오류로 거부합니다.</p>
 *
 * @param steps 자연어 스텝 목록 (nullable)
 * @param config 처리 설정 (nullable)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepProcessingRequest(List<String> steps, ProcessingConfig config) {

    public StepProcessingRequest {
        // null 원소를 허용해야 하므로 List.copyOf 대신 사용
        steps = steps == null ? null : Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static StepProcessingRequest of(List<String> steps) {
        return new StepProcessingRequest(steps, ProcessingConfig.defaults());
    }
}
