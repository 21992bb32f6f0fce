package com.ryuqq.stepflow.core.spi;

/**
 * Browser executor session SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ExecutorSessionManager {

    void createSession(String executorSessionId);

    void destroySession(String executorSessionId);
}
