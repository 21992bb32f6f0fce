package com.ryuqq.stepflow.core.spi;

/**
 * Task Executor (task loop) SPI.
 *
 * <p>Executes one natural-language step at a time. Success is signalled by a normal return
 * of {@link #processStep(TaskStepRequest)}; failure by a thrown exception. Step timeouts are
 * the executor's responsibility and surface here only as failures.</p>
 *
 * <p>Intermediate notifications (AI reasoning, command results, progress) are reported
 * through the sink registered with {@link #setEventSink(TaskEventSink)}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TaskExecutor {

    /**
     * Executes one step, blocking until it finishes.
     *
     * @param request step request
     * @throws RuntimeException if the step fails
     */
    void processStep(TaskStepRequest request);

    void pauseExecution(String sessionId, int stepIndex);

    void resumeExecution(String sessionId, int stepIndex);

    void cancelExecution(String sessionId, int stepIndex);

    void setEventSink(TaskEventSink sink);
}
