package com.ryuqq.stepflow.core.spi;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification emitted by the {@link TaskExecutor}.
 *
 * <p>The type is kept as a plain string: executors may emit types this module does not know,
 * and those are dropped by the sink rather than rejected here.</p>
 *
 * <p><strong>Data keys by type:</strong></p>
 * <ul>
 *   <li>AI_REASONING_UPDATE: {@code content} (String), {@code confidence} (Number, 0.0-1.0)</li>
 *   <li>COMMAND_EXECUTED: {@code action} (String), {@code success} (Boolean), {@code error} (String, optional)</li>
 *   <li>SCREENSHOT_CAPTURED: {@code screenshotId} (String), {@code action} (String, optional)</li>
 *   <li>PROGRESS_UPDATE: {@code completedSteps}, {@code totalSteps} (Number), {@code overallProgress} (Number)</li>
 *   <li>STEP_FAILED: {@code errorCode} (String, optional)</li>
 * </ul>
 *
 * @param type event type name
 * @param sessionId workflow session id
 * @param stepIndex step index, or null
 * @param streamId stream id, or null when streaming is disabled
 * @param timestamp emission time
 * @param data type-specific values
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskEvent(
    String type,
    String sessionId,
    Integer stepIndex,
    String streamId,
    Instant timestamp,
    Map<String, Object> data
) {

    public TaskEvent {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        timestamp = timestamp == null ? Instant.now() : timestamp;
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static TaskEvent of(TaskEventType type, String sessionId, Integer stepIndex,
                               String streamId, Map<String, Object> data) {
        return new TaskEvent(type.name(), sessionId, stepIndex, streamId, Instant.now(), data);
    }

    public static TaskEvent reasoning(String sessionId, int stepIndex, String streamId,
                                      String content, double confidence) {
        return of(TaskEventType.AI_REASONING_UPDATE, sessionId, stepIndex, streamId,
            Map.of("content", content, "confidence", confidence));
    }

    public static TaskEvent commandExecuted(String sessionId, int stepIndex, String streamId,
                                            String action, boolean success, String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action", action);
        data.put("success", success);
        if (error != null) {
            data.put("error", error);
        }
        return of(TaskEventType.COMMAND_EXECUTED, sessionId, stepIndex, streamId, data);
    }

    public String stringValue(String key) {
        Object value = data.get(key);
        return value == null ? null : value.toString();
    }

    public Double numberValue(String key) {
        Object value = data.get(key);
        return value instanceof Number number ? number.doubleValue() : null;
    }

    public boolean booleanValue(String key) {
        Object value = data.get(key);
        return value instanceof Boolean bool ? bool : Boolean.parseBoolean(String.valueOf(value));
    }
}
