package com.ryuqq.stepflow.core.spi;

/**
 * Single-step execution request handed to the {@link TaskExecutor}.
 *
 * @param sessionId workflow session id
 * @param stepIndex zero-based step index
 * @param stepContent natural-language step
 * @param streamId stream id, or null when streaming is disabled
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskStepRequest(
    String sessionId,
    int stepIndex,
    String stepContent,
    String streamId
) {

    public TaskStepRequest {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (stepIndex < 0) {
            throw new IllegalArgumentException("stepIndex cannot be negative (current: " + stepIndex + ")");
        }
        if (stepContent == null) {
            throw new IllegalArgumentException("stepContent cannot be null");
        }
    }
}
