package com.ryuqq.stepflow.core.spi;

import com.ryuqq.stepflow.core.model.ProcessingConfig;
import com.ryuqq.stepflow.core.model.WorkflowSession;

import java.util.List;
import java.util.Optional;

/**
 * Session Coordinator SPI.
 *
 * <p>Owns the unified {@link WorkflowSession} that links the executor, stream and AI
 * sub-resources of one workflow under a single session id.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called from caller threads and from background step loops</li>
 *   <li>{@link #destroyWorkflowSession(String)} is idempotent</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SessionCoordinator {

    /**
     * Creates a workflow session for the given steps.
     *
     * @param steps submitted steps (non-empty)
     * @param config processing configuration; streaming decides whether a stream id is assigned
     * @return the created session
     * @throws RuntimeException if the session cannot be created
     */
    WorkflowSession createWorkflowSession(List<String> steps, ProcessingConfig config);

    void destroyWorkflowSession(String sessionId);

    Optional<WorkflowSession> getWorkflowSession(String sessionId);

    List<String> listActiveWorkflowSessions();
}
