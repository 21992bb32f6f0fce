package com.ryuqq.stepflow.adapter.inmemory.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.stepflow.adapter.inmemory.internal.Json;
import com.ryuqq.stepflow.core.model.ActionPayload;
import com.ryuqq.stepflow.core.model.ReasoningPayload;
import com.ryuqq.stepflow.core.model.ScreenshotPayload;
import com.ryuqq.stepflow.core.model.StreamEvent;
import com.ryuqq.stepflow.core.model.StructuredPayload;

import java.time.Instant;

/**
 * {@link StreamEvent} → 와이어 JSON 변환기.
 *
 * <ul>
 *   <li>구조화 페이로드가 있으면 {@code structured_event}, data는 페이로드 JSON 문자열</li>
 *   <li>그 외에는 {@code event}, data는 이벤트 메시지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WireMessageEncoder {

    private final ObjectMapper mapper;

    public WireMessageEncoder() {
        this(Json.mapper());
    }

    public WireMessageEncoder(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    public WireMessage toWireMessage(StreamEvent event) {
        if (event.data().hasStructured()) {
            String data = write(toWireData(event.data().structured()));
            return new WireMessage(WireMessage.TYPE_STRUCTURED_EVENT, event.sessionId(), data, event.timestamp());
        }
        return new WireMessage(WireMessage.TYPE_EVENT, event.sessionId(), event.data().message(), event.timestamp());
    }

    public String encode(StreamEvent event) {
        return write(toWireMessage(event));
    }

    public String encodeError(String sessionId, String message, Instant at) {
        return write(new WireMessage(WireMessage.TYPE_ERROR, sessionId, message, at));
    }

    private StructuredWireData toWireData(StructuredPayload payload) {
        if (payload instanceof ReasoningPayload reasoning) {
            return new StructuredWireData(reasoning.kind(), reasoning.text(), reasoning.confidence().wireValue(),
                null, null, null, null, reasoning.stepIndex(), reasoning.timestamp());
        }
        if (payload instanceof ActionPayload action) {
            return new StructuredWireData(action.kind(), null, null, action.actionName(), action.success(),
                action.error(), null, action.stepIndex(), action.timestamp());
        }
        ScreenshotPayload screenshot = (ScreenshotPayload) payload;
        return new StructuredWireData(screenshot.kind(), null, null, screenshot.actionName(), null, null,
            screenshot.screenshotId(), screenshot.stepIndex(), screenshot.timestamp());
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode wire message", e);
        }
    }
}
