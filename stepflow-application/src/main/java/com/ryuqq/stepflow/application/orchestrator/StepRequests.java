package com.ryuqq.stepflow.application.orchestrator;

import com.ryuqq.stepflow.core.model.ProcessingConfig;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 입력 텍스트로부터 실행 요청을 만드는 헬퍼.
 *
 * <p>한 줄이 한 스텝입니다. 앞뒤 공백은 제거되고 빈 줄은 버려집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StepRequests {

    public static final String EMPTY_STEPS_MESSAGE = "Please enter some automation steps";

    private StepRequests() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static List<String> parseSteps(String stepText) {
        if (stepText == null) {
            return List.of();
        }
        return stepText.lines()
            .map(String::trim)
            .filter(step -> !step.isEmpty())
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 텍스트를 기본 처리 설정의 요청으로 변환.
     *
     * @param stepText 줄 단위 스텝 텍스트
     * @return 실행 요청 ({@link ProcessingConfig#defaults()})
     */
    public static StepProcessingRequest fromText(String stepText) {
        return new StepProcessingRequest(parseSteps(stepText), ProcessingConfig.defaults());
    }

    /**
     * 입력 텍스트 검증.
     *
     * @param stepText 줄 단위 스텝 텍스트
     * @return 오류 메시지 (유효하면 empty)
     */
    public static Optional<String> validateStepInput(String stepText) {
        if (parseSteps(stepText).isEmpty()) {
            return Optional.of(EMPTY_STEPS_MESSAGE);
        }
        return Optional.empty();
    }
}
