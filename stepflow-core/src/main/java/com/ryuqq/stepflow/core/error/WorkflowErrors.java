package com.ryuqq.stepflow.core.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 자주 쓰이는 오류 시나리오용 팩토리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowErrors {

    private static final ErrorHandler HANDLER = new ErrorHandler();

    private WorkflowErrors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static StandardError validation(String message) {
        return HANDLER.createStandardError(ErrorCode.VALIDATION_FAILED, message);
    }

    public static StandardError validation(String message, Map<String, Object> details) {
        return HANDLER.createStandardError(ErrorCode.VALIDATION_FAILED, message, details);
    }

    public static StandardError sessionCreation(String message, Throwable cause) {
        return HANDLER.createStandardError(ErrorCode.SESSION_CREATION_FAILED.name(), message, null, cause);
    }

    public static StandardError taskLoopTimeout(String sessionId, int stepIndex, long timeoutMs) {
        return HANDLER.createStandardError(ErrorCode.TASK_LOOP_TIMEOUT,
            "Task loop execution timed out after " + timeoutMs + "ms",
            Map.of("sessionId", sessionId, "stepIndex", stepIndex, "timeoutMs", timeoutMs));
    }

    public static StandardError concurrentLimit(int currentCount, int maxLimit) {
        return HANDLER.createStandardError(ErrorCode.CONCURRENT_LIMIT_EXCEEDED,
            "Concurrent session limit exceeded: " + currentCount + "/" + maxLimit,
            Map.of("currentCount", currentCount, "maxLimit", maxLimit));
    }

    public static StandardError sessionNotFound(String sessionId) {
        return HANDLER.createStandardError(ErrorCode.WORKFLOW_SESSION_NOT_FOUND,
            "Workflow session not found: " + sessionId,
            Map.of("sessionId", String.valueOf(sessionId)));
    }

    public static StandardError moduleInitialization(String moduleId, Throwable cause) {
        return HANDLER.createStandardError(ErrorCode.MODULE_INITIALIZATION_FAILED.name(),
            "Failed to initialize module: " + moduleId,
            Map.of("moduleId", moduleId), cause);
    }

    public static StandardError dependencyResolution(String dependency) {
        return HANDLER.createStandardError(ErrorCode.DEPENDENCY_RESOLUTION_FAILED,
            "Failed to resolve dependency: " + dependency,
            Map.of("dependency", dependency));
    }

    public static StandardError eventPublishing(String eventType, String streamId, Throwable cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventType", eventType);
        if (streamId != null) {
            details.put("streamId", streamId);
        }
        return HANDLER.createStandardError(ErrorCode.EVENT_PUBLISHING_FAILED.name(),
            "Failed to publish event: " + eventType, details, cause);
    }
}
