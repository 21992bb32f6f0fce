package com.ryuqq.stepflow.core.spi;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TaskEvent 팩토리/조회 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskEventTest {

    @Test
    void reasoning_데이터_키() {
        TaskEvent event = TaskEvent.reasoning("s-1", 0, "stream_s-1", "find button", 0.9);

        assertThat(TaskEventType.from(event.type())).contains(TaskEventType.AI_REASONING_UPDATE);
        assertThat(event.stringValue("content")).isEqualTo("find button");
        assertThat(event.numberValue("confidence")).isEqualTo(0.9);
        assertThat(event.timestamp()).isNotNull();
    }

    @Test
    void commandExecuted_오류_없으면_키_생략() {
        TaskEvent ok = TaskEvent.commandExecuted("s-1", 1, null, "click", true, null);
        TaskEvent failed = TaskEvent.commandExecuted("s-1", 1, null, "click", false, "Element not found");

        assertThat(ok.booleanValue("success")).isTrue();
        assertThat(ok.data()).doesNotContainKey("error");
        assertThat(failed.booleanValue("success")).isFalse();
        assertThat(failed.stringValue("error")).isEqualTo("Element not found");
    }

    @Test
    void 알_수_없는_타입은_empty() {
        assertThat(TaskEventType.from("SOMETHING_NEW")).isEmpty();
        assertThat(TaskEventType.from(null)).isEmpty();
    }

    @Test
    void 숫자가_아닌_값은_null() {
        TaskEvent event = TaskEvent.reasoning("s-1", 0, null, "x", 0.1);

        assertThat(event.numberValue("content")).isNull();
        assertThat(event.numberValue("missing")).isNull();
    }

    @Test
    void 필수값_검증() {
        assertThatThrownBy(() -> new TaskEvent(" ", "s-1", 0, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TaskStepRequest("s-1", -1, "x", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("stepIndex cannot be negative");
    }
}
