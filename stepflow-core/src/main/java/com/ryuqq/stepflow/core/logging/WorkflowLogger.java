package com.ryuqq.stepflow.core.logging;

import com.ryuqq.stepflow.core.error.StandardError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * 워크플로우 컨텍스트 로거.
 *
 * <p>SLF4J 로거를 감싸 각 호출 동안 {@code sessionId}, {@code stepIndex}를
 * {@link MDC}에 올려 둡니다. 로그 패턴에서 {@code %X{sessionId}}로 참조할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowLogger logger = new WorkflowLogger(DefaultWorkflowOrchestrator.class);
 * logger.logStepStarted(sessionId, 0, "Open the login page");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WorkflowLogger {

    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_STEP_INDEX = "stepIndex";

    static final long SLOW_OPERATION_THRESHOLD_MS = 5_000L;

    private final Logger log;

    public WorkflowLogger(Class<?> owner) {
        this(LoggerFactory.getLogger(owner));
    }

    public WorkflowLogger(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
    }

    public void logWorkflowStarted(String sessionId, int totalSteps) {
        withContext(sessionId, null, () -> log.info("Workflow started: {} ({} steps)", sessionId, totalSteps));
    }

    public void logWorkflowCompleted(String sessionId, int totalSteps, long durationMs) {
        withContext(sessionId, null, () ->
            log.info("Workflow completed: {} ({} steps, {}ms)", sessionId, totalSteps, durationMs));
    }

    public void logWorkflowFailed(String sessionId, StandardError error) {
        withContext(sessionId, null, () ->
            log.error("Workflow failed: {} (code={}, message={})", sessionId, error.code(), error.message()));
    }

    public void logStepStarted(String sessionId, int stepIndex, String stepContent) {
        withContext(sessionId, stepIndex, () ->
            log.info("Step {} started: {}", stepIndex, stepContent));
    }

    public void logStepCompleted(String sessionId, int stepIndex, long durationMs) {
        withContext(sessionId, stepIndex, () ->
            log.info("Step {} completed in {}ms", stepIndex, durationMs));
    }

    public void logStepFailed(String sessionId, int stepIndex, StandardError error) {
        withContext(sessionId, stepIndex, () ->
            log.warn("Step {} failed: {} (code={})", stepIndex, error.message(), error.code()));
    }

    public void logSessionCreated(String sessionId) {
        withContext(sessionId, null, () -> log.info("Session created: {}", sessionId));
    }

    public void logSessionDestroyed(String sessionId) {
        withContext(sessionId, null, () -> log.info("Session destroyed: {}", sessionId));
    }

    public void logEventPublished(String sessionId, String eventType, String streamId) {
        withContext(sessionId, null, () ->
            log.debug("Event published: {} → stream {}", eventType, streamId));
    }

    /**
     * 작업 소요 시간 기록.
     *
     * <p>5초를 넘으면 warn, 아니면 debug로 남깁니다.</p>
     *
     * @param operation 작업 이름
     * @param durationMs 소요 시간 (밀리초)
     */
    public void logPerformanceMetric(String operation, long durationMs) {
        if (durationMs > SLOW_OPERATION_THRESHOLD_MS) {
            log.warn("Slow operation: {} took {}ms", operation, durationMs);
        } else {
            log.debug("Operation {} took {}ms", operation, durationMs);
        }
    }

    public Logger getLogger() {
        return log;
    }

    private void withContext(String sessionId, Integer stepIndex, Runnable action) {
        String previousSession = MDC.get(MDC_SESSION_ID);
        String previousStep = MDC.get(MDC_STEP_INDEX);
        MDC.put(MDC_SESSION_ID, sessionId);
        if (stepIndex != null) {
            MDC.put(MDC_STEP_INDEX, String.valueOf(stepIndex));
        }
        try {
            action.run();
        } finally {
            restore(MDC_SESSION_ID, previousSession);
            restore(MDC_STEP_INDEX, previousStep);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
