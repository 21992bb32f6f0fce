package com.ryuqq.stepflow.core.spi;

/**
 * Receives notifications emitted by the {@link TaskExecutor}.
 *
 * <p>Implementations must not throw back into the executor.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskEventSink {

    void onTaskEvent(TaskEvent event);
}
