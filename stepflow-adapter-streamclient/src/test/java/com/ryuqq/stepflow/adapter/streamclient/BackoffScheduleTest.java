package com.ryuqq.stepflow.adapter.streamclient;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffSchedule 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BackoffScheduleTest {

    @Test
    void delayForAttempt_설정_순서대로_소비() {
        // given
        BackoffSchedule schedule = new BackoffSchedule(new StreamClientConfig());

        // when & then
        assertThat(schedule.delayForAttempt(1)).isEqualTo(3_000L);
        assertThat(schedule.delayForAttempt(2)).isEqualTo(9_000L);
        assertThat(schedule.delayForAttempt(3)).isEqualTo(15_000L);
    }

    @Test
    void delayForAttempt_목록_초과_시_마지막_값_반복() {
        // given
        BackoffSchedule schedule = new BackoffSchedule(List.of(100L, 200L), 5);

        // when & then
        assertThat(schedule.delayForAttempt(4)).isEqualTo(200L);
    }

    @Test
    void canAttempt_최대_횟수_미만에서만_true() {
        // given
        BackoffSchedule schedule = new BackoffSchedule(List.of(100L), 3);

        // when & then
        assertThat(schedule.canAttempt(0)).isTrue();
        assertThat(schedule.canAttempt(2)).isTrue();
        assertThat(schedule.canAttempt(3)).isFalse();
    }

    @Test
    void 잘못된_파라미터_예외() {
        assertThatThrownBy(() -> new BackoffSchedule(List.of(), 3))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffSchedule(List.of(1L), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxAttempts must be positive");
        assertThatThrownBy(() -> new BackoffSchedule(List.of(1L), 1).delayForAttempt(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
