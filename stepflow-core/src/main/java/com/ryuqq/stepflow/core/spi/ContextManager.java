package com.ryuqq.stepflow.core.spi;

import java.util.List;

/**
 * AI Context Manager SPI.
 *
 * <p>Keeps the AI-side working context (steps, linked executor session) for a workflow.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ContextManager {

    void createSession(String sessionId);

    void linkExecutorSession(String sessionId, String executorSessionId);

    void setSteps(String sessionId, List<String> steps);

    void destroySession(String sessionId);
}
