package com.ryuqq.stepflow.adapter.inmemory.session;

import com.ryuqq.stepflow.core.model.ProcessingConfig;
import com.ryuqq.stepflow.core.model.WorkflowSession;
import com.ryuqq.stepflow.core.spi.SessionCoordinator;
import com.ryuqq.stepflow.core.statemachine.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link SessionCoordinator} SPI.
 *
 * <p>Generates linked executor, stream and AI connection ids for each workflow session.
 * A stream id is assigned only when the processing config enables streaming.</p>
 *
 * <p><strong>Id format:</strong> {@code workflow_<id>}, {@code executor_<id>},
 * {@code stream_<id>}, {@code ai_<id>} sharing one generated {@code <id>}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySessionCoordinator implements SessionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionCoordinator.class);

    private final ConcurrentHashMap<String, WorkflowSession> sessions = new ConcurrentHashMap<>();
    private final Supplier<String> idGenerator;
    private final Clock clock;

    public InMemorySessionCoordinator() {
        this(() -> UUID.randomUUID().toString(), Clock.systemUTC());
    }

    public InMemorySessionCoordinator(Supplier<String> idGenerator, Clock clock) {
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @Override
    public WorkflowSession createWorkflowSession(List<String> steps, ProcessingConfig config) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("steps cannot be null or empty");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        String id = idGenerator.get();
        Instant now = clock.instant();
        WorkflowSession session = new WorkflowSession(
            "workflow_" + id,
            "executor_" + id,
            config.enableStreaming() ? "stream_" + id : null,
            "ai_" + id,
            SessionStatus.ACTIVE,
            now,
            now,
            steps,
            Map.of("stepCount", steps.size(), "maxExecutionTimeMs", config.maxExecutionTimeMs())
        );

        if (sessions.putIfAbsent(session.sessionId(), session) != null) {
            throw new IllegalStateException("Workflow session id collision: " + session.sessionId());
        }
        log.info("Workflow session created: {} ({} steps, stream={})",
            session.sessionId(), steps.size(), session.streamId());
        return session;
    }

    @Override
    public void destroyWorkflowSession(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.info("Workflow session destroyed: {}", sessionId);
        }
    }

    @Override
    public Optional<WorkflowSession> getWorkflowSession(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public List<String> listActiveWorkflowSessions() {
        return sessions.values().stream()
            .filter(session -> session.status().isLive())
            .map(WorkflowSession::sessionId)
            .sorted()
            .collect(Collectors.toList());
    }

    /**
     * Updates the coordinator-side status of a session.
     *
     * @param sessionId session id
     * @param status new status
     * @return true if the session exists
     */
    public boolean updateStatus(String sessionId, SessionStatus status) {
        return sessions.computeIfPresent(sessionId, (id, session) -> session.withStatus(status, clock.instant())) != null;
    }
}
