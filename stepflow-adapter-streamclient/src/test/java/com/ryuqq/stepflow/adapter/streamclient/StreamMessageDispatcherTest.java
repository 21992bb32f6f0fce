package com.ryuqq.stepflow.adapter.streamclient;

import com.ryuqq.stepflow.adapter.streamclient.internal.Json;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * StreamMessageDispatcher 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StreamMessageDispatcherTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final List<DisplayEvent> events = new ArrayList<>();
    private final List<StreamClientError> errors = new ArrayList<>();
    private StreamMessageDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        CallbackRegistry<DisplayEvent> eventCallbacks = new CallbackRegistry<>("event");
        CallbackRegistry<StreamClientError> errorCallbacks = new CallbackRegistry<>("error");
        eventCallbacks.add(events::add);
        errorCallbacks.add(errors::add);
        dispatcher = new StreamMessageDispatcher(
            Json.mapper(), Clock.fixed(NOW, ZoneOffset.UTC), eventCallbacks, errorCallbacks
        );
    }

    @Test
    void event_메시지는_WORKFLOW_PROGRESS_INFO로_변환() {
        // when
        dispatcher.dispatch("{\"type\":\"event\",\"sessionId\":\"s-1\",\"data\":\"Step 1 completed\","
            + "\"timestamp\":\"2025-02-01T10:00:00Z\"}");

        // then
        assertThat(events).hasSize(1);
        DisplayEvent event = events.get(0);
        assertThat(event.type()).isEqualTo(DisplayEventType.WORKFLOW_PROGRESS);
        assertThat(event.level()).isEqualTo(DisplayLevel.INFO);
        assertThat(event.message()).isEqualTo("Step 1 completed");
        assertThat(event.sessionId()).isEqualTo("s-1");
        assertThat(event.timestamp()).isEqualTo(Instant.parse("2025-02-01T10:00:00Z"));
        assertThat(event.isStructured()).isFalse();
    }

    @Test
    void reasoning_신뢰도별_수준_매핑() {
        // when
        dispatcher.dispatch(structured("{\\\"type\\\":\\\"reasoning\\\",\\\"text\\\":\\\"click login\\\",\\\"confidence\\\":\\\"high\\\"}"));
        dispatcher.dispatch(structured("{\\\"type\\\":\\\"reasoning\\\",\\\"text\\\":\\\"maybe\\\",\\\"confidence\\\":\\\"medium\\\"}"));
        dispatcher.dispatch(structured("{\\\"type\\\":\\\"reasoning\\\",\\\"text\\\":\\\"unsure\\\",\\\"confidence\\\":\\\"low\\\"}"));

        // then
        assertThat(events).extracting(DisplayEvent::level)
            .containsExactly(DisplayLevel.INFO, DisplayLevel.WARNING, DisplayLevel.ERROR);
        assertThat(events).extracting(DisplayEvent::type)
            .containsOnly(DisplayEventType.STRUCTURED_REASONING);
        assertThat(events.get(0).message()).isEqualTo("click login");
    }

    @Test
    void action_성공과_실패_메시지() {
        // when
        dispatcher.dispatch(structured("{\\\"type\\\":\\\"action\\\",\\\"actionName\\\":\\\"click\\\",\\\"success\\\":true,\\\"stepId\\\":2}"));
        dispatcher.dispatch(structured("{\\\"type\\\":\\\"action\\\",\\\"actionName\\\":\\\"type\\\",\\\"success\\\":false,\\\"error\\\":\\\"Timeout\\\"}"));

        // then
        assertThat(events.get(0).level()).isEqualTo(DisplayLevel.SUCCESS);
        assertThat(events.get(0).message()).isEqualTo("click: Success");
        assertThat(events.get(0).stepIndex()).isEqualTo(2);
        assertThat(events.get(1).level()).isEqualTo(DisplayLevel.ERROR);
        assertThat(events.get(1).message()).isEqualTo("type: Failed - Timeout");
        assertThat(events.get(1).structuredData().path("error").asText()).isEqualTo("Timeout");
    }

    @Test
    void screenshot_메시지() {
        // when
        dispatcher.dispatch(structured("{\\\"type\\\":\\\"screenshot\\\",\\\"actionName\\\":\\\"click\\\"}"));
        dispatcher.dispatch(structured("{\\\"type\\\":\\\"screenshot\\\"}"));

        // then
        assertThat(events).extracting(DisplayEvent::message)
            .containsExactly("Screenshot captured for click", "Screenshot captured");
        assertThat(events).extracting(DisplayEvent::type)
            .containsOnly(DisplayEventType.STRUCTURED_SCREENSHOT);
    }

    @Test
    void 알_수_없는_구조화_타입은_무시() {
        // when
        dispatcher.dispatch(structured("{\\\"type\\\":\\\"telemetry\\\"}"));

        // then
        assertThat(events).isEmpty();
        assertThat(errors).isEmpty();
    }

    @Test
    void error_메시지는_오류_콜백으로_전달() {
        // when
        dispatcher.dispatch("{\"type\":\"error\",\"sessionId\":\"s-1\",\"data\":\"executor crashed\"}");
        dispatcher.dispatch("{\"type\":\"error\",\"sessionId\":\"s-1\"}");

        // then
        assertThat(errors).extracting(StreamClientError::message)
            .containsExactly("executor crashed", "Stream error");
        assertThat(events).isEmpty();
    }

    @Test
    void 파싱_실패는_PARSE_FAILED_오류() {
        // when
        dispatcher.dispatch("{broken");
        dispatcher.dispatch(structured("not-json"));

        // then
        assertThat(errors).hasSize(2);
        assertThat(errors).extracting(StreamClientError::message)
            .containsOnly("Failed to parse stream message");
    }

    @Test
    void 프레임_뒤에_남은_내용이_있으면_PARSE_FAILED() {
        // when
        dispatcher.dispatch("{\"type\":\"event\",\"data\":\"Step 1 completed\"} trailing");

        // then
        assertThat(events).isEmpty();
        assertThat(errors).extracting(StreamClientError::code)
            .containsExactly(StreamClientErrorCode.PARSE_FAILED);
    }

    @Test
    void 알_수_없는_메시지_타입은_무시() {
        // when
        dispatcher.dispatch("{\"type\":\"heartbeat\"}");

        // then
        assertThat(events).isEmpty();
        assertThat(errors).isEmpty();
    }

    @Test
    void 타임스탬프가_없으면_Clock_사용() {
        // when
        dispatcher.dispatch("{\"type\":\"event\",\"data\":\"no time\"}");

        // then
        assertThat(events.get(0).timestamp()).isEqualTo(NOW);
        assertThat(events.get(0).sessionId()).isNull();
    }

    private static String structured(String escapedData) {
        return "{\"type\":\"structured_event\",\"sessionId\":\"s-1\",\"data\":\"" + escapedData + "\"}";
    }
}
