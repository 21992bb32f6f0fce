package com.ryuqq.stepflow.application.orchestrator;

import com.ryuqq.stepflow.application.event.StreamEventPublisher;
import com.ryuqq.stepflow.core.error.ErrorCode;
import com.ryuqq.stepflow.core.error.ErrorHandler;
import com.ryuqq.stepflow.core.error.StandardError;
import com.ryuqq.stepflow.core.error.WorkflowErrors;
import com.ryuqq.stepflow.core.error.WorkflowException;
import com.ryuqq.stepflow.core.logging.WorkflowLogger;
import com.ryuqq.stepflow.core.model.ExecutionProgress;
import com.ryuqq.stepflow.core.model.ProcessingConfig;
import com.ryuqq.stepflow.core.model.StepExecutionSummary;
import com.ryuqq.stepflow.core.model.StepProcessorSession;
import com.ryuqq.stepflow.core.model.WorkflowSession;
import com.ryuqq.stepflow.core.spi.SessionCoordinator;
import com.ryuqq.stepflow.core.spi.StreamTransport;
import com.ryuqq.stepflow.core.spi.TaskExecutor;
import com.ryuqq.stepflow.core.spi.TaskStepRequest;
import com.ryuqq.stepflow.core.statemachine.SessionStatus;
import com.ryuqq.stepflow.core.statemachine.SessionStatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * {@link WorkflowOrchestrator} 기본 구현체.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>로컬 세션 생명주기 ({@link SessionRegistry})</li>
 *   <li>협력자 초기화/정리와 부분 초기화 롤백</li>
 *   <li>스텝 순차 실행 루프와 진행 상황/이력 갱신</li>
 *   <li>일시정지/재개/취소 위임과 이벤트 발행</li>
 * </ul>
 *
 * <p><strong>스텝 루프:</strong></p>
 * <pre>
 * for i in 0..n-1:
 *   PAUSED면 대기 → 세션이 사라졌거나 종료 상태면 조용히 중단
 *   진행 상황 갱신 + STEP_STARTED(i) 발행
 *   taskExecutor.processStep(i)
 *     ├─ 성공 → 진행 상황/이력 갱신, 다음 스텝
 *     └─ 실패 → FAILED + WORKFLOW_FAILED 발행 후 중단 (재시도/건너뛰기 없음)
 * COMPLETED + WORKFLOW_COMPLETED 발행
 * 정리: 스트림 → 실행 세션 → 컨텍스트 → 로컬 세션 → 코디네이터 세션
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>세션당 하나의 루프가 {@code stepRunner}에서 실행되고, 한 번에 한 스텝만 실행</li>
 *   <li>레지스트리 읽기/쓰기는 모두 레지스트리 잠금 아래에서 수행</li>
 *   <li>루프는 매 스텝 전에 레지스트리를 다시 확인하므로 취소된 세션을 진행시키지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefaultWorkflowOrchestrator implements WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkflowOrchestrator.class);

    private final OrchestratorDependencies dependencies;
    private final OrchestratorConfig config;
    private final SessionRegistry registry;
    private final StreamEventPublisher publisher;
    private final ErrorHandler errorHandler;
    private final WorkflowLogger workflowLogger;
    private final Executor stepRunner;
    private final ExecutorService ownedRunner;
    private final Clock clock;
    private final Map<String, WorkflowSession> linkedSessions = new ConcurrentHashMap<>();

    private volatile SessionLifecycleCallbacks callbacks = SessionLifecycleCallbacks.NONE;

    /**
     * 생성자 (기본 스레드 풀 사용).
     *
     * <p>스텝 루프는 {@code maxConcurrentSessions} 크기의 고정 데몬 스레드 풀에서 실행됩니다.
     * 진행 중인 워크플로우를 마치려면 종료 전에 {@link #shutdown()}을 호출하세요.</p>
     *
     * @param dependencies 외부 협력자
     * @param config 설정
     */
    public DefaultWorkflowOrchestrator(OrchestratorDependencies dependencies, OrchestratorConfig config) {
        this(dependencies, config, newStepRunner(config.maxConcurrentSessions()),
            new ErrorHandler(), Clock.systemUTC(), true);
    }

    /**
     * 생성자 (스텝 루프 실행자 주입).
     *
     * @param dependencies 외부 협력자
     * @param config 설정
     * @param stepRunner 스텝 루프를 실행할 Executor (테스트에서는 {@code Runnable::run})
     * @param errorHandler 오류 처리기
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultWorkflowOrchestrator(OrchestratorDependencies dependencies, OrchestratorConfig config,
                                      Executor stepRunner, ErrorHandler errorHandler, Clock clock) {
        this(dependencies, config, stepRunner, errorHandler, clock, false);
    }

    private DefaultWorkflowOrchestrator(OrchestratorDependencies dependencies, OrchestratorConfig config,
                                        Executor stepRunner, ErrorHandler errorHandler, Clock clock,
                                        boolean ownsRunner) {
        if (dependencies == null) {
            throw new IllegalArgumentException("dependencies cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (stepRunner == null) {
            throw new IllegalArgumentException("stepRunner cannot be null");
        }
        if (errorHandler == null) {
            throw new IllegalArgumentException("errorHandler cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        this.dependencies = dependencies;
        this.config = config;
        this.stepRunner = stepRunner;
        this.ownedRunner = ownsRunner ? (ExecutorService) stepRunner : null;
        this.errorHandler = errorHandler;
        this.clock = clock;
        this.registry = new SessionRegistry();
        this.publisher = new StreamEventPublisher(dependencies.streamTransport(), errorHandler, clock);
        this.workflowLogger = new WorkflowLogger(log);

        // Task Executor 알림을 발행기로 연결
        if (dependencies.taskExecutor() != null) {
            dependencies.taskExecutor().setEventSink(publisher);
        }
    }

    // ===== Session Management =====

    @Override
    public String createSession(String workflowSessionId, SessionConfig sessionConfig) {
        try {
            return createLocalSession(workflowSessionId, sessionConfig);
        } catch (RuntimeException e) {
            throw handled(e, ErrorCode.SESSION_CREATION_FAILED, "Failed to create session: " + workflowSessionId);
        }
    }

    /**
     * 로컬 세션 등록 (INITIALIZING → ACTIVE). 오류 로깅은 호출자가 한 번만 수행합니다.
     */
    private String createLocalSession(String workflowSessionId, SessionConfig sessionConfig) {
        if (workflowSessionId == null || workflowSessionId.isBlank()) {
            throw new WorkflowException(WorkflowErrors.validation("Session id cannot be null or blank"));
        }
        boolean streaming = sessionConfig == null ? config.streamingEnabled() : sessionConfig.enableStreaming();
        Map<String, Object> metadata = sessionConfig == null ? Map.of() : sessionConfig.metadata();

        registry.createIfAbsent(workflowSessionId, config.maxConcurrentSessions(),
            () -> StepProcessorSession.initializing(workflowSessionId, streaming, metadata, clock.instant()));

        updateSessionStatus(workflowSessionId, SessionStatus.ACTIVE);
        workflowLogger.logSessionCreated(workflowSessionId);
        notifyCallbacks(cb -> cb.onSessionCreated(workflowSessionId), "onSessionCreated");
        return workflowSessionId;
    }

    @Override
    public void destroySession(String workflowSessionId) {
        Optional<StepProcessorSession> session = registry.get(workflowSessionId);
        if (session.isEmpty()) {
            log.warn("Attempted to destroy non-existent session: {}", workflowSessionId);
            return;
        }
        try {
            if (session.get().status() != SessionStatus.CLEANUP) {
                updateSessionStatus(workflowSessionId, SessionStatus.CLEANUP);
            }
            registry.remove(workflowSessionId);
            workflowLogger.logSessionDestroyed(workflowSessionId);
            notifyCallbacks(cb -> cb.onSessionDestroyed(workflowSessionId), "onSessionDestroyed");
        } catch (RuntimeException e) {
            throw handled(e, ErrorCode.SESSION_CREATION_FAILED, "Failed to destroy session: " + workflowSessionId);
        }
    }

    @Override
    public Optional<StepProcessorSession> getSession(String workflowSessionId) {
        return registry.get(workflowSessionId);
    }

    @Override
    public boolean sessionExists(String workflowSessionId) {
        return registry.contains(workflowSessionId);
    }

    @Override
    public Optional<SessionStatus> getSessionStatus(String workflowSessionId) {
        return registry.get(workflowSessionId).map(StepProcessorSession::status);
    }

    @Override
    public void updateSessionStatus(String workflowSessionId, SessionStatus status) {
        SessionStatus previous = transitionOrThrow(workflowSessionId, status);
        log.debug("Session status updated: {} -> {} (session={})", previous, status, workflowSessionId);
        notifyCallbacks(cb -> cb.onSessionStatusChanged(workflowSessionId, previous, status),
            "onSessionStatusChanged");
    }

    @Override
    public void recordActivity(String workflowSessionId) {
        registry.update(workflowSessionId, s -> s.withActivity(clock.instant()));
    }

    @Override
    public Optional<Instant> getLastActivity(String workflowSessionId) {
        return registry.get(workflowSessionId).map(StepProcessorSession::lastActivity);
    }

    @Override
    public void setLifecycleCallbacks(SessionLifecycleCallbacks callbacks) {
        this.callbacks = callbacks == null ? SessionLifecycleCallbacks.NONE : callbacks;
    }

    // ===== Workflow Management =====

    @Override
    public StepProcessingResult processSteps(StepProcessingRequest request) {
        long startNanos = System.nanoTime();
        try {
            requireDependencies();
            validateRequest(request);

            List<String> steps = request.steps();
            ProcessingConfig processingConfig = request.config();

            // 1. 통합 워크플로우 세션 생성
            WorkflowSession workflowSession = createWorkflowSession(steps, processingConfig);
            String sessionId = workflowSession.sessionId();

            // 2. 협력자 초기화 (실패 시 내부에서 역순 롤백)
            initializeModulesForSession(workflowSession, steps);

            // 3. 로컬 세션 생성 → WORKFLOW_STARTED → 백그라운드 실행
            boolean streaming = processingConfig.enableStreaming() && workflowSession.hasStream();
            boolean localCreated = false;
            try {
                createLocalSession(sessionId, new SessionConfig(streaming, Map.of("steps", steps)));
                localCreated = true;
                registry.update(sessionId, s -> s.withSteps(steps, clock.instant()));
                linkedSessions.put(sessionId, workflowSession);

                if (streaming) {
                    publisher.publishWorkflowStarted(workflowSession.streamId(), sessionId, steps.size());
                }
                workflowLogger.logWorkflowStarted(sessionId, steps.size());

                stepRunner.execute(() -> runSteps(workflowSession, steps, streaming));
            } catch (RuntimeException e) {
                teardown(workflowSession, localCreated);
                throw e;
            }

            return new StepProcessingResult(
                sessionId,
                workflowSession.streamId(),
                workflowSession.status(),
                estimateDuration(steps),
                workflowSession.createdAt()
            );
        } catch (RuntimeException e) {
            throw handled(e, ErrorCode.SESSION_CREATION_FAILED, "Failed to process steps");
        } finally {
            workflowLogger.logPerformanceMetric("processSteps",
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        }
    }

    @Override
    public void pauseExecution(String workflowSessionId) {
        StepProcessorSession session = transitionLiveSession(workflowSessionId, SessionStatus.PAUSED);
        try {
            streamOf(workflowSessionId).ifPresent(streamId ->
                publisher.publishWorkflowPaused(streamId, workflowSessionId));
            taskExecutor().pauseExecution(workflowSessionId, session.currentStepIndex());
            log.info("Workflow paused: {} at step {}", workflowSessionId, session.currentStepIndex());
        } catch (RuntimeException e) {
            throw handled(e, ErrorCode.SESSION_COORDINATOR_ERROR, "Failed to pause execution: " + workflowSessionId);
        }
    }

    @Override
    public void resumeExecution(String workflowSessionId) {
        StepProcessorSession session = transitionLiveSession(workflowSessionId, SessionStatus.ACTIVE);
        try {
            streamOf(workflowSessionId).ifPresent(streamId ->
                publisher.publishWorkflowResumed(streamId, workflowSessionId));
            taskExecutor().resumeExecution(workflowSessionId, session.currentStepIndex());
            log.info("Workflow resumed: {} at step {}", workflowSessionId, session.currentStepIndex());
        } catch (RuntimeException e) {
            throw handled(e, ErrorCode.SESSION_COORDINATOR_ERROR, "Failed to resume execution: " + workflowSessionId);
        }
    }

    @Override
    public void cancelExecution(String workflowSessionId) {
        StepProcessorSession session = transitionLiveSession(workflowSessionId, SessionStatus.CANCELLED);
        try {
            taskExecutor().cancelExecution(workflowSessionId, session.currentStepIndex());
            log.info("Workflow cancelled: {} at step {}", workflowSessionId, session.currentStepIndex());
        } catch (RuntimeException e) {
            throw handled(e, ErrorCode.SESSION_COORDINATOR_ERROR, "Failed to cancel execution: " + workflowSessionId);
        } finally {
            // 취소 상태가 된 세션은 위임 실패와 관계없이 정리
            teardown(workflowSessionId, true);
        }
    }

    // ===== Progress Tracking =====

    @Override
    public ExecutionProgress getExecutionProgress(String workflowSessionId) {
        return requireLiveSession(workflowSessionId).executionProgress();
    }

    @Override
    public List<StepExecutionSummary> getStepHistory(String workflowSessionId) {
        return requireLiveSession(workflowSessionId).stepHistory();
    }

    // ===== Session Coordination =====

    @Override
    public Optional<WorkflowSession> getWorkflowSession(String workflowSessionId) {
        SessionCoordinator coordinator = dependencies.sessionCoordinator();
        if (coordinator == null) {
            return Optional.empty();
        }
        return coordinator.getWorkflowSession(workflowSessionId);
    }

    @Override
    public List<String> listActiveWorkflowSessions() {
        SessionCoordinator coordinator = dependencies.sessionCoordinator();
        if (coordinator == null) {
            return List.of();
        }
        return coordinator.listActiveWorkflowSessions();
    }

    @Override
    public void destroyWorkflowSession(String workflowSessionId) {
        SessionCoordinator coordinator = dependencies.sessionCoordinator();
        if (coordinator == null) {
            StandardError error = WorkflowErrors.dependencyResolution("SessionCoordinator");
            errorHandler.handleError(error);
            throw new WorkflowException(error);
        }
        cleanupModulesForSession(workflowSessionId);
        destroySession(workflowSessionId);
        coordinator.destroyWorkflowSession(workflowSessionId);
        linkedSessions.remove(workflowSessionId);
    }

    @Override
    public HealthReport healthCheck() {
        List<HealthIssue> issues = new ArrayList<>();

        List<String> unresolved = dependencies.unresolved();
        if (!unresolved.isEmpty()) {
            issues.add(new HealthIssue("MISSING_DEPENDENCIES", "Dependencies not resolved: " + unresolved));
        }

        int active = registry.liveCount();
        if (active > config.maxConcurrentSessions()) {
            issues.add(new HealthIssue(ErrorCode.CONCURRENT_LIMIT_EXCEEDED.name(),
                "Too many active sessions: " + active + "/" + config.maxConcurrentSessions()));
        }

        return new HealthReport(errorHandler.getModuleId(), issues.isEmpty(), active, registry.size(),
            issues, clock.instant());
    }

    /**
     * 기본 스레드 풀 종료.
     *
     * <p>Executor를 주입한 경우에는 아무 것도 하지 않습니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        if (ownedRunner == null) {
            return;
        }
        ownedRunner.shutdown();
        if (!ownedRunner.awaitTermination(60, TimeUnit.SECONDS)) {
            ownedRunner.shutdownNow();
        }
    }

    // ===== Step Loop =====

    private void runSteps(WorkflowSession workflowSession, List<String> steps, boolean streaming) {
        String sessionId = workflowSession.sessionId();
        String streamId = streaming ? workflowSession.streamId() : null;
        long startNanos = System.nanoTime();

        for (int i = 0; i < steps.size(); i++) {
            int stepIndex = i;
            String stepContent = steps.get(i);

            // 1. 일시정지 해제 대기 + 진행 상황 갱신
            Optional<StepProcessorSession> running = registry.updateWhenRunnable(sessionId,
                s -> s.startingStep(stepIndex, stepContent, clock.instant()));
            if (running.isEmpty()) {
                log.info("Workflow {} stopped before step {}", sessionId, stepIndex);
                return;
            }
            workflowLogger.logStepStarted(sessionId, stepIndex, stepContent);

            try {
                // 2. STEP_STARTED 발행 + 실행 위임
                if (streamId != null) {
                    publisher.publishStepStarted(streamId, sessionId, stepIndex, stepContent);
                }
                taskExecutor().processStep(new TaskStepRequest(sessionId, stepIndex, stepContent, streamId));

                // 3. 성공 반영
                registry.update(sessionId, s -> s.completingStep(clock.instant()))
                    .ifPresent(s -> workflowLogger.logStepCompleted(sessionId, stepIndex, lastDurationMs(s)));
            } catch (RuntimeException e) {
                failWorkflow(workflowSession, streamId, stepIndex, e);
                return;
            } catch (Error e) {
                // 세션을 정리한 뒤 실행 스레드로 전파
                failWorkflow(workflowSession, streamId, stepIndex, e);
                throw e;
            }
        }

        completeWorkflow(workflowSession, streamId, steps.size(),
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    private void completeWorkflow(WorkflowSession workflowSession, String streamId, int totalSteps, long durationMs) {
        String sessionId = workflowSession.sessionId();
        AtomicReference<SessionStatus> previous = new AtomicReference<>();

        Optional<StepProcessorSession> completed = registry.updateWhenRunnable(sessionId, s -> {
            SessionStatusTransition.validate(s.status(), SessionStatus.COMPLETED);
            previous.set(s.status());
            Instant now = clock.instant();
            return s.finished(now).withStatus(SessionStatus.COMPLETED, now);
        });
        if (completed.isEmpty()) {
            log.info("Workflow {} finished all steps after it was stopped", sessionId);
            return;
        }
        notifyCallbacks(cb -> cb.onSessionStatusChanged(sessionId, previous.get(), SessionStatus.COMPLETED),
            "onSessionStatusChanged");

        if (streamId != null) {
            publishSafely(() -> publisher.publishWorkflowCompleted(streamId, sessionId, totalSteps),
                "WORKFLOW_COMPLETED", sessionId);
        }
        workflowLogger.logWorkflowCompleted(sessionId, totalSteps, durationMs);
        teardown(workflowSession, true);
    }

    private void failWorkflow(WorkflowSession workflowSession, String streamId, int stepIndex, Throwable cause) {
        String sessionId = workflowSession.sessionId();
        StandardError error = errorHandler.wrapError(cause, ErrorCode.STEP_PROCESSING_TIMEOUT.name(),
            "Failed to process step " + stepIndex);
        errorHandler.handleStepError(sessionId, stepIndex, error);
        workflowLogger.logStepFailed(sessionId, stepIndex, error);

        AtomicReference<SessionStatus> previous = new AtomicReference<>();
        registry.update(sessionId, s -> {
            if (s.status().isTerminal()) {
                return s;
            }
            previous.set(s.status());
            Instant now = clock.instant();
            return s.failingStep(error, now).withStatus(SessionStatus.FAILED, now);
        });
        if (previous.get() == null) {
            log.info("Workflow {} already stopped, failure of step {} not reported", sessionId, stepIndex);
            return;
        }
        notifyCallbacks(cb -> cb.onSessionStatusChanged(sessionId, previous.get(), SessionStatus.FAILED),
            "onSessionStatusChanged");

        if (streamId != null) {
            publishSafely(() -> publisher.publishWorkflowFailed(streamId, sessionId, error),
                "WORKFLOW_FAILED", sessionId);
        }
        workflowLogger.logWorkflowFailed(sessionId, error);
        teardown(workflowSession, true);
    }

    // ===== Collaborator Setup / Teardown =====

    private WorkflowSession createWorkflowSession(List<String> steps, ProcessingConfig processingConfig) {
        WorkflowSession workflowSession;
        try {
            workflowSession = dependencies.sessionCoordinator().createWorkflowSession(steps, processingConfig);
        } catch (RuntimeException e) {
            throw new WorkflowException(WorkflowErrors.sessionCreation("Failed to create workflow session", e), e);
        }
        if (workflowSession == null) {
            throw new WorkflowException(WorkflowErrors.sessionCreation("Session coordinator returned no session", null));
        }
        return workflowSession;
    }

    /**
     * 컨텍스트 → 실행 세션 → 스트림 → AI 연결 순으로 초기화.
     *
     * <p>중간에 실패하면 이미 만든 자원과 코디네이터 세션을 역순으로 정리한 뒤
     * MODULE_INITIALIZATION_FAILED를 던집니다.</p>
     */
    private void initializeModulesForSession(WorkflowSession workflowSession, List<String> steps) {
        String sessionId = workflowSession.sessionId();
        String executorSessionId = workflowSession.executorSessionId();
        Deque<Runnable> rollback = new ArrayDeque<>();
        rollback.push(() -> dependencies.sessionCoordinator().destroyWorkflowSession(sessionId));

        try {
            dependencies.contextManager().createSession(sessionId);
            rollback.push(() -> dependencies.contextManager().destroySession(sessionId));
            dependencies.contextManager().linkExecutorSession(sessionId, executorSessionId);
            dependencies.contextManager().setSteps(sessionId, steps);

            dependencies.executorSessions().createSession(executorSessionId);
            rollback.push(() -> dependencies.executorSessions().destroySession(executorSessionId));

            StreamTransport transport = dependencies.streamTransport();
            if (workflowSession.hasStream() && transport != null) {
                transport.createStream(workflowSession.streamId(), sessionId);
                rollback.push(() -> transport.destroyStream(workflowSession.streamId()));
            } else if (workflowSession.hasStream()) {
                log.debug("No stream transport configured, stream {} not created", workflowSession.streamId());
            }

            if (!dependencies.aiIntegration().validateConnection(workflowSession.aiConnectionId())) {
                throw new IllegalStateException("AI connection validation failed: " + workflowSession.aiConnectionId());
            }

            log.debug("Initialized all modules for workflow session {} (executor={}, stream={}, ai={})",
                sessionId, executorSessionId, workflowSession.streamId(), workflowSession.aiConnectionId());
        } catch (RuntimeException e) {
            while (!rollback.isEmpty()) {
                runQuietly(rollback.pop(), "rollback", sessionId);
            }
            StandardError error = WorkflowErrors.moduleInitialization("workflow-session-modules", e);
            throw new WorkflowException(error, e);
        }
    }

    private void teardown(WorkflowSession workflowSession, boolean destroyLocal) {
        String sessionId = workflowSession.sessionId();
        cleanupModules(workflowSession);
        if (destroyLocal) {
            runQuietly(() -> destroySession(sessionId), "destroySession", sessionId);
        }
        runQuietly(() -> dependencies.sessionCoordinator().destroyWorkflowSession(sessionId),
            "destroyWorkflowSession", sessionId);
        linkedSessions.remove(sessionId);
    }

    private void teardown(String sessionId, boolean destroyLocal) {
        WorkflowSession workflowSession = resolveWorkflowSession(sessionId);
        if (workflowSession == null) {
            if (destroyLocal) {
                runQuietly(() -> destroySession(sessionId), "destroySession", sessionId);
            }
            return;
        }
        teardown(workflowSession, destroyLocal);
    }

    private void cleanupModulesForSession(String sessionId) {
        WorkflowSession workflowSession = resolveWorkflowSession(sessionId);
        if (workflowSession != null) {
            cleanupModules(workflowSession);
        }
    }

    /**
     * 스트림 → 실행 세션 → 컨텍스트 순으로 정리. 개별 실패는 로그로 남기고 계속 진행합니다.
     */
    private void cleanupModules(WorkflowSession workflowSession) {
        String sessionId = workflowSession.sessionId();
        StreamTransport transport = dependencies.streamTransport();
        if (workflowSession.hasStream() && transport != null) {
            runQuietly(() -> transport.destroyStream(workflowSession.streamId()), "destroyStream", sessionId);
        }
        if (dependencies.executorSessions() != null) {
            runQuietly(() -> dependencies.executorSessions().destroySession(workflowSession.executorSessionId()),
                "destroyExecutorSession", sessionId);
        }
        if (dependencies.contextManager() != null) {
            runQuietly(() -> dependencies.contextManager().destroySession(sessionId), "destroyContext", sessionId);
        }
        log.debug("Cleaned up all modules for workflow session {}", sessionId);
    }

    private WorkflowSession resolveWorkflowSession(String sessionId) {
        WorkflowSession linked = linkedSessions.get(sessionId);
        if (linked != null) {
            return linked;
        }
        return getWorkflowSession(sessionId).orElse(null);
    }

    // ===== Helpers =====

    private void requireDependencies() {
        List<String> unresolved = dependencies.unresolved();
        if (!unresolved.isEmpty()) {
            throw new WorkflowException(WorkflowErrors.dependencyResolution(String.join(", ", unresolved)));
        }
    }

    private TaskExecutor taskExecutor() {
        TaskExecutor taskExecutor = dependencies.taskExecutor();
        if (taskExecutor == null) {
            throw new WorkflowException(WorkflowErrors.dependencyResolution("TaskExecutor"));
        }
        return taskExecutor;
    }

    private void validateRequest(StepProcessingRequest request) {
        if (request == null) {
            throw new WorkflowException(WorkflowErrors.validation("Step processing request is required"));
        }
        List<String> steps = request.steps();
        if (steps == null || steps.isEmpty()) {
            throw new WorkflowException(WorkflowErrors.validation("Steps array cannot be empty"));
        }
        if (steps.size() > config.maxStepsPerWorkflow()) {
            throw new WorkflowException(WorkflowErrors.validation(
                "Too many steps: " + steps.size() + "/" + config.maxStepsPerWorkflow(),
                Map.of("stepCount", steps.size(), "maxSteps", config.maxStepsPerWorkflow())));
        }
        for (int i = 0; i < steps.size(); i++) {
            String step = steps.get(i);
            if (step == null || step.isBlank()) {
                throw new WorkflowException(WorkflowErrors.validation(
                    "Invalid step at index " + i + ": must be a non-empty string", Map.of("stepIndex", i)));
            }
            if (step.length() > config.maxStepContentLength()) {
                throw new WorkflowException(WorkflowErrors.validation(
                    "Step content too long at index " + i + ": " + step.length() + "/"
                        + config.maxStepContentLength() + " characters",
                    Map.of("stepIndex", i, "length", step.length())));
            }
        }
        if (request.config() == null) {
            throw new WorkflowException(WorkflowErrors.validation("Processing config is required"));
        }
    }

    private StepProcessorSession requireLiveSession(String sessionId) {
        Optional<StepProcessorSession> session = registry.get(sessionId);
        if (session.isEmpty() || session.get().status().isTerminal()) {
            StandardError error = WorkflowErrors.sessionNotFound(sessionId);
            errorHandler.handleSessionError(String.valueOf(sessionId), error);
            throw new WorkflowException(error);
        }
        return session.get();
    }

    /**
     * 살아있는 세션의 상태 전이 (일시정지/재개/취소).
     *
     * <p>종료 상태 확인과 전이가 레지스트리 잠금 하나로 이루어지므로, 그 사이에 스텝 루프가
     * 세션을 종료시키면 VALIDATION_FAILED가 아니라 WORKFLOW_SESSION_NOT_FOUND가 됩니다.</p>
     *
     * @return 전이 직전의 세션
     */
    private StepProcessorSession transitionLiveSession(String sessionId, SessionStatus status) {
        Optional<StepProcessorSession> previous;
        try {
            previous = registry.transitionLive(sessionId, status, s -> s.withActivity(clock.instant()));
        } catch (IllegalStateException e) {
            StandardError error = WorkflowErrors.validation(e.getMessage(),
                Map.of("sessionId", sessionId, "targetStatus", status.name()));
            errorHandler.handleSessionError(sessionId, error);
            throw new WorkflowException(error, e);
        }
        if (previous.isEmpty()) {
            StandardError error = WorkflowErrors.sessionNotFound(sessionId);
            errorHandler.handleSessionError(String.valueOf(sessionId), error);
            throw new WorkflowException(error);
        }
        SessionStatus oldStatus = previous.get().status();
        log.debug("Session status updated: {} -> {} (session={})", oldStatus, status, sessionId);
        notifyCallbacks(cb -> cb.onSessionStatusChanged(sessionId, oldStatus, status), "onSessionStatusChanged");
        return previous.get();
    }

    private SessionStatus transitionOrThrow(String sessionId, SessionStatus status) {
        try {
            return registry.transition(sessionId, status, s -> s.withActivity(clock.instant()))
                .orElseThrow(() -> new WorkflowException(WorkflowErrors.sessionNotFound(sessionId)));
        } catch (IllegalStateException e) {
            throw new WorkflowException(WorkflowErrors.validation(e.getMessage(),
                Map.of("sessionId", sessionId, "targetStatus", status.name())), e);
        }
    }

    private Optional<String> streamOf(String sessionId) {
        WorkflowSession workflowSession = linkedSessions.get(sessionId);
        boolean streaming = registry.get(sessionId).map(StepProcessorSession::streamingEnabled).orElse(false);
        if (workflowSession == null || !streaming || !workflowSession.hasStream()) {
            return Optional.empty();
        }
        return Optional.of(workflowSession.streamId());
    }

    private long estimateDuration(List<String> steps) {
        return steps.size() * config.estimatedStepDurationMs();
    }

    private static long lastDurationMs(StepProcessorSession session) {
        List<StepExecutionSummary> history = session.stepHistory();
        if (history.isEmpty()) {
            return 0L;
        }
        Long duration = history.get(history.size() - 1).durationMs();
        return duration == null ? 0L : duration;
    }

    private WorkflowException handled(RuntimeException e, ErrorCode code, String message) {
        StandardError error = errorHandler.wrapError(e, code.name(), message);
        errorHandler.handleError(error);
        if (e instanceof WorkflowException workflowException) {
            return workflowException;
        }
        return new WorkflowException(error, e);
    }

    private static ExecutorService newStepRunner(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "stepflow-step-runner-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private void publishSafely(Runnable publish, String eventType, String sessionId) {
        try {
            publish.run();
        } catch (RuntimeException e) {
            errorHandler.handleError(errorHandler.wrapError(e, ErrorCode.EVENT_PUBLISHING_FAILED.name(),
                "Failed to publish " + eventType + " for session " + sessionId));
        }
    }

    private void runQuietly(Runnable action, String operation, String sessionId) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Failed to {} for session {}", operation, sessionId, e);
        }
    }

    private void notifyCallbacks(Consumer<SessionLifecycleCallbacks> action, String callbackName) {
        try {
            action.accept(callbacks);
        } catch (RuntimeException e) {
            log.warn("Lifecycle callback {} failed", callbackName, e);
        }
    }
}
