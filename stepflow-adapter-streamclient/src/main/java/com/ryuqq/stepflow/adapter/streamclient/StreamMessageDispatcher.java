package com.ryuqq.stepflow.adapter.streamclient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.UUID;

/**
 * 수신 프레임을 표시용 이벤트로 변환하여 콜백에 전달합니다.
 *
 * <p><strong>메시지 타입별 처리:</strong></p>
 * <ul>
 *   <li>{@code event}: WORKFLOW_PROGRESS, level INFO, message = data</li>
 *   <li>{@code structured_event}: data(JSON 문자열)를 다시 파싱하여 reasoning/action/screenshot으로 변환</li>
 *   <li>{@code error}: 오류 콜백 (data가 없으면 "Stream error")</li>
 *   <li>그 외: 로그 후 무시</li>
 * </ul>
 *
 * <p>파싱 실패는 PARSE_FAILED 오류 콜백으로 보고되며 연결에는 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamMessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StreamMessageDispatcher.class);

    static final String TYPE_EVENT = "event";
    static final String TYPE_STRUCTURED_EVENT = "structured_event";
    static final String TYPE_ERROR = "error";

    private final ObjectMapper mapper;
    private final Clock clock;
    private final CallbackRegistry<DisplayEvent> eventCallbacks;
    private final CallbackRegistry<StreamClientError> errorCallbacks;

    public StreamMessageDispatcher(
        ObjectMapper mapper,
        Clock clock,
        CallbackRegistry<DisplayEvent> eventCallbacks,
        CallbackRegistry<StreamClientError> errorCallbacks
    ) {
        this.mapper = mapper;
        this.clock = clock;
        this.eventCallbacks = eventCallbacks;
        this.errorCallbacks = errorCallbacks;
    }

    /**
     * 원문 프레임 처리.
     *
     * @param raw JSON 텍스트
     */
    public void dispatch(String raw) {
        JsonNode message;
        try {
            message = raw == null ? null : mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            parseFailed(e);
            return;
        }
        if (message == null || !message.isObject()) {
            parseFailed(null);
            return;
        }

        String type = message.path("type").asText("");
        switch (type) {
            case TYPE_EVENT -> eventCallbacks.fire(progressEvent(message));
            case TYPE_STRUCTURED_EVENT -> structuredEvent(message).ifPresent(eventCallbacks::fire);
            case TYPE_ERROR -> {
                String data = message.path("data").asText("");
                errorCallbacks.fire(new StreamClientError(StreamClientErrorCode.STREAM_ERROR, data));
            }
            default -> log.info("Unknown message type: {}", type);
        }
    }

    private DisplayEvent progressEvent(JsonNode message) {
        return new DisplayEvent(
            newId(),
            DisplayEventType.WORKFLOW_PROGRESS,
            textOrNull(message, "sessionId"),
            null,
            timestampOf(message.path("timestamp"), null),
            message.path("data").asText(""),
            DisplayLevel.INFO,
            null
        );
    }

    private Optional<DisplayEvent> structuredEvent(JsonNode message) {
        JsonNode data = message.path("data");
        JsonNode structured;
        if (data.isTextual()) {
            try {
                structured = mapper.readTree(data.asText());
            } catch (JsonProcessingException e) {
                parseFailed(e);
                return Optional.empty();
            }
        } else {
            structured = data;
        }
        if (structured == null || !structured.isObject()) {
            parseFailed(null);
            return Optional.empty();
        }

        String sessionId = textOrNull(message, "sessionId");
        Integer stepIndex = structured.path("stepId").isInt() ? structured.path("stepId").asInt() : null;
        Instant timestamp = timestampOf(structured.path("timestamp"), message.path("timestamp"));
        String kind = structured.path("type").asText("");

        DisplayEventType type;
        DisplayLevel level;
        String text;
        switch (kind) {
            case "reasoning" -> {
                type = DisplayEventType.STRUCTURED_REASONING;
                level = reasoningLevel(structured.path("confidence").asText(""));
                text = structured.path("text").asText("");
            }
            case "action" -> {
                boolean success = structured.path("success").asBoolean(false);
                String actionName = structured.path("actionName").asText("");
                String error = structured.path("error").asText("");
                type = DisplayEventType.STRUCTURED_ACTION;
                level = success ? DisplayLevel.SUCCESS : DisplayLevel.ERROR;
                text = actionName + ": " + (success ? "Success" : "Failed")
                    + (error.isEmpty() ? "" : " - " + error);
            }
            case "screenshot" -> {
                String actionName = structured.path("actionName").asText("");
                type = DisplayEventType.STRUCTURED_SCREENSHOT;
                level = DisplayLevel.INFO;
                text = "Screenshot captured" + (actionName.isEmpty() ? "" : " for " + actionName);
            }
            default -> {
                log.warn("Unknown structured event type: {}", kind);
                return Optional.empty();
            }
        }
        return Optional.of(new DisplayEvent(newId(), type, sessionId, stepIndex, timestamp, text, level, structured));
    }

    static DisplayLevel reasoningLevel(String confidence) {
        return switch (confidence) {
            case "high" -> DisplayLevel.INFO;
            case "medium" -> DisplayLevel.WARNING;
            default -> DisplayLevel.ERROR;
        };
    }

    private Instant timestampOf(JsonNode primary, JsonNode fallback) {
        Instant parsed = parseInstant(primary);
        if (parsed == null && fallback != null) {
            parsed = parseInstant(fallback);
        }
        return parsed != null ? parsed : clock.instant();
    }

    private static Instant parseInstant(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp: {}", node.asText());
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    private static String newId() {
        return "event_" + UUID.randomUUID();
    }

    private void parseFailed(Exception cause) {
        log.error("Error parsing stream message", cause);
        errorCallbacks.fire(StreamClientError.of(StreamClientErrorCode.PARSE_FAILED));
    }
}
