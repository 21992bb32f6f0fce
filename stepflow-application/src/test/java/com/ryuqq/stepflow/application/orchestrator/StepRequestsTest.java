package com.ryuqq.stepflow.application.orchestrator;

import com.ryuqq.stepflow.core.model.ProcessingConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StepRequestsTest {

    @Test
    void parseSteps_줄_단위로_자르고_빈_줄_제거() {
        String text = "  open the login page \n\n\tclick login\r\n   \ntype password";

        assertThat(StepRequests.parseSteps(text))
            .containsExactly("open the login page", "click login", "type password");
    }

    @Test
    void parseSteps_null은_빈_목록() {
        assertThat(StepRequests.parseSteps(null)).isEmpty();
    }

    @Test
    void fromText_기본_처리_설정_사용() {
        StepProcessingRequest request = StepRequests.fromText("a\nb");

        assertThat(request.steps()).containsExactly("a", "b");
        assertThat(request.config()).isEqualTo(ProcessingConfig.defaults());
    }

    @Test
    void validateStepInput_공백만_있으면_오류_메시지() {
        assertThat(StepRequests.validateStepInput(" \n \n")).contains(StepRequests.EMPTY_STEPS_MESSAGE);
        assertThat(StepRequests.validateStepInput(null)).contains("Please enter some automation steps");
        assertThat(StepRequests.validateStepInput("click")).isEmpty();
    }
}
