package com.ryuqq.stepflow.core.spi;

import java.util.Optional;

/**
 * Known {@link TaskEvent} types.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TaskEventType {
    STEP_STARTED,
    STEP_COMPLETED,
    STEP_FAILED,
    AI_REASONING_UPDATE,
    COMMAND_EXECUTED,
    SCREENSHOT_CAPTURED,
    PROGRESS_UPDATE;

    /**
     * Resolves a wire type name.
     *
     * @param type type name as emitted by the executor
     * @return matching type, or empty for unknown types
     */
    public static Optional<TaskEventType> from(String type) {
        if (type == null) {
            return Optional.empty();
        }
        for (TaskEventType candidate : values()) {
            if (candidate.name().equals(type)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
