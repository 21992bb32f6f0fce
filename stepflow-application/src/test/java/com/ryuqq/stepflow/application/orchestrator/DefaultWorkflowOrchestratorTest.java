package com.ryuqq.stepflow.application.orchestrator;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.ryuqq.stepflow.core.error.ErrorCode;
import com.ryuqq.stepflow.core.error.ErrorHandler;
import com.ryuqq.stepflow.core.error.WorkflowException;
import com.ryuqq.stepflow.core.model.ProcessingConfig;
import com.ryuqq.stepflow.core.model.StreamEvent;
import com.ryuqq.stepflow.core.model.StreamEventType;
import com.ryuqq.stepflow.core.model.WorkflowSession;
import com.ryuqq.stepflow.core.spi.AiIntegration;
import com.ryuqq.stepflow.core.spi.ContextManager;
import com.ryuqq.stepflow.core.spi.ExecutorSessionManager;
import com.ryuqq.stepflow.core.spi.SessionCoordinator;
import com.ryuqq.stepflow.core.spi.StreamTransport;
import com.ryuqq.stepflow.core.spi.TaskEvent;
import com.ryuqq.stepflow.core.spi.TaskEventSink;
import com.ryuqq.stepflow.core.spi.TaskEventType;
import com.ryuqq.stepflow.core.spi.TaskExecutor;
import com.ryuqq.stepflow.core.spi.TaskStepRequest;
import com.ryuqq.stepflow.core.statemachine.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * DefaultWorkflowOrchestrator 유닛 테스트.
 *
 * <p>협력자는 모두 Mockito mock이며, 스텝 루프는 직접 실행(Runnable::run)하거나
 * 지연 실행(목록에 보관 후 수동 실행)하여 결정적으로 검증합니다.</p>
 *
 * <ul>
 *   <li>세션 생성/중복/동시 실행 한도</li>
 *   <li>이벤트 발행 순서와 첫 실패 시 중단</li>
 *   <li>일시정지/재개/취소 위임</li>
 *   <li>요청 검증과 초기화 실패 롤백</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultWorkflowOrchestratorTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final String SESSION_ID = "wf-1";
    private static final String STREAM_ID = "stream_wf-1";
    private static final String EXECUTOR_SESSION_ID = "executor_wf-1";

    @Mock
    private SessionCoordinator coordinator;
    @Mock
    private ContextManager contextManager;
    @Mock
    private TaskExecutor taskExecutor;
    @Mock
    private ExecutorSessionManager executorSessions;
    @Mock
    private StreamTransport transport;
    @Mock
    private AiIntegration aiIntegration;

    private final List<Runnable> deferred = new ArrayList<>();
    private final List<String> statusChanges = Collections.synchronizedList(new ArrayList<>());
    private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        lenient().when(coordinator.createWorkflowSession(anyList(), any())).thenAnswer(invocation -> {
            List<String> steps = invocation.getArgument(0);
            return new WorkflowSession(SESSION_ID, EXECUTOR_SESSION_ID, STREAM_ID, "ai_wf-1",
                SessionStatus.ACTIVE, T0, T0, steps, Map.of());
        });
        lenient().when(aiIntegration.validateConnection(anyString())).thenReturn(true);
    }

    private DefaultWorkflowOrchestrator orchestrator(Executor stepRunner) {
        return orchestrator(stepRunner, new OrchestratorConfig());
    }

    private DefaultWorkflowOrchestrator orchestrator(Executor stepRunner, OrchestratorConfig config) {
        OrchestratorDependencies dependencies = new OrchestratorDependencies(
            coordinator, contextManager, taskExecutor, executorSessions, transport, aiIntegration);
        DefaultWorkflowOrchestrator orchestrator = new DefaultWorkflowOrchestrator(
            dependencies, config, stepRunner, new ErrorHandler(), clock);
        orchestrator.setLifecycleCallbacks(new SessionLifecycleCallbacks() {
            @Override
            public void onSessionStatusChanged(String sessionId, SessionStatus oldStatus, SessionStatus newStatus) {
                statusChanges.add(oldStatus + "->" + newStatus);
            }
        });
        return orchestrator;
    }

    private List<StreamEvent> publishedEvents() {
        ArgumentCaptor<StreamEvent> captor = ArgumentCaptor.forClass(StreamEvent.class);
        verify(transport, atLeast(0)).publishEvent(eq(STREAM_ID), captor.capture());
        return captor.getAllValues();
    }

    private List<StreamEventType> publishedTypes() {
        return publishedEvents().stream().map(StreamEvent::type).toList();
    }

    // ============================================================
    // 1. 세션 관리
    // ============================================================

    @Test
    void createSession_생성_후_ACTIVE() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);

        // when
        String id = orchestrator.createSession("s-1", SessionConfig.streaming(true));

        // then
        assertThat(id).isEqualTo("s-1");
        assertThat(orchestrator.sessionExists("s-1")).isTrue();
        assertThat(orchestrator.getSessionStatus("s-1")).contains(SessionStatus.ACTIVE);
        assertThat(orchestrator.getLastActivity("s-1")).contains(T0);
        assertThat(statusChanges).containsExactly("INITIALIZING->ACTIVE");
    }

    @Test
    void createSession_중복_ID는_VALIDATION_FAILED_및_기존_세션_유지() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        orchestrator.createSession("s-1", SessionConfig.streaming(false));

        // when & then
        assertThatThrownBy(() -> orchestrator.createSession("s-1", SessionConfig.streaming(false)))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.VALIDATION_FAILED)).isTrue())
            .hasMessageContaining("Session already exists");
        assertThat(orchestrator.healthCheck().totalSessions()).isEqualTo(1);
    }

    @Test
    void createSession_동시_실행_한도_초과_시_CONCURRENT_LIMIT_EXCEEDED() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run,
            new OrchestratorConfig().withMaxConcurrentSessions(1));
        orchestrator.createSession("s-1", null);

        // when & then
        assertThatThrownBy(() -> orchestrator.createSession("s-2", null))
            .isInstanceOfSatisfying(WorkflowException.class, e -> {
                assertThat(e.hasCode(ErrorCode.CONCURRENT_LIMIT_EXCEEDED)).isTrue();
                assertThat(e.getError().retryable()).isTrue();
            });
        assertThat(orchestrator.sessionExists("s-2")).isFalse();
    }

    @Test
    void createSession_종료된_세션은_한도에_포함되지_않음() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run,
            new OrchestratorConfig().withMaxConcurrentSessions(1));
        orchestrator.createSession("s-1", null);
        orchestrator.updateSessionStatus("s-1", SessionStatus.COMPLETED);

        // when
        orchestrator.createSession("s-2", null);

        // then
        assertThat(orchestrator.healthCheck().activeSessions()).isEqualTo(1);
        assertThat(orchestrator.healthCheck().totalSessions()).isEqualTo(2);
    }

    @Test
    void createSession_콜백_예외는_생성을_막지_않음() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        orchestrator.setLifecycleCallbacks(new SessionLifecycleCallbacks() {
            @Override
            public void onSessionCreated(String sessionId) {
                throw new IllegalStateException("listener failure");
            }
        });

        // when
        orchestrator.createSession("s-1", null);

        // then
        assertThat(orchestrator.getSessionStatus("s-1")).contains(SessionStatus.ACTIVE);
    }

    @Test
    void processSteps_세션_한도_초과는_한_번만_기록() {
        // given
        Logger errorLogger = (Logger) LoggerFactory.getLogger(ErrorHandler.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        errorLogger.addAppender(appender);
        DefaultWorkflowOrchestrator orchestrator = orchestrator(deferred::add,
            new OrchestratorConfig().withMaxConcurrentSessions(1));
        orchestrator.createSession("other", null);

        try {
            // when & then
            assertThatThrownBy(() -> orchestrator.processSteps(StepProcessingRequest.of(List.of("a"))))
                .isInstanceOfSatisfying(WorkflowException.class,
                    e -> assertThat(e.hasCode(ErrorCode.CONCURRENT_LIMIT_EXCEEDED)).isTrue());
            assertThat(appender.list)
                .filteredOn(event -> event.getFormattedMessage().contains("Concurrent session limit exceeded"))
                .hasSize(1);
            verify(coordinator).destroyWorkflowSession(SESSION_ID);
            assertThat(deferred).isEmpty();
        } finally {
            errorLogger.detachAppender(appender);
        }
    }

    @Test
    void updateSessionStatus_잘못된_전이는_VALIDATION_FAILED() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        orchestrator.createSession("s-1", null);
        orchestrator.updateSessionStatus("s-1", SessionStatus.COMPLETED);

        // when & then
        assertThatThrownBy(() -> orchestrator.updateSessionStatus("s-1", SessionStatus.ACTIVE))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.VALIDATION_FAILED)).isTrue());
        assertThatThrownBy(() -> orchestrator.updateSessionStatus("missing", SessionStatus.ACTIVE))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.WORKFLOW_SESSION_NOT_FOUND)).isTrue());
    }

    @Test
    void destroySession_없는_세션은_무시() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);

        // when
        orchestrator.destroySession("missing");

        // then
        assertThat(orchestrator.sessionExists("missing")).isFalse();
    }

    @Test
    void destroySession_CLEANUP_거쳐_제거() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        orchestrator.createSession("s-1", null);

        // when
        orchestrator.destroySession("s-1");

        // then
        assertThat(orchestrator.sessionExists("s-1")).isFalse();
        assertThat(statusChanges).containsExactly("INITIALIZING->ACTIVE", "ACTIVE->CLEANUP");
    }

    // ============================================================
    // 2. 스텝 처리
    // ============================================================

    @Test
    void processSteps_성공_시_이벤트_순서와_정리() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        ArgumentCaptor<TaskEventSink> sinkCaptor = ArgumentCaptor.forClass(TaskEventSink.class);
        verify(taskExecutor).setEventSink(sinkCaptor.capture());
        TaskEventSink sink = sinkCaptor.getValue();
        doAnswer(invocation -> {
            TaskStepRequest request = invocation.getArgument(0);
            sink.onTaskEvent(TaskEvent.of(TaskEventType.STEP_COMPLETED, request.sessionId(),
                request.stepIndex(), request.streamId(), Map.of("stepContent", request.stepContent())));
            return null;
        }).when(taskExecutor).processStep(any());

        // when
        StepProcessingResult result = orchestrator.processSteps(
            StepProcessingRequest.of(List.of("open page", "click login")));

        // then
        assertThat(result.sessionId()).isEqualTo(SESSION_ID);
        assertThat(result.streamId()).isEqualTo(STREAM_ID);
        assertThat(result.estimatedDurationMs()).isEqualTo(2 * OrchestratorConfig.DEFAULT_ESTIMATED_STEP_DURATION_MS);
        assertThat(publishedTypes()).containsExactly(
            StreamEventType.WORKFLOW_STARTED,
            StreamEventType.STEP_STARTED,
            StreamEventType.STEP_COMPLETED,
            StreamEventType.STEP_STARTED,
            StreamEventType.STEP_COMPLETED,
            StreamEventType.WORKFLOW_COMPLETED
        );
        assertThat(publishedEvents().get(0).data().message()).isEqualTo("Workflow started with 2 steps");
        assertThat(statusChanges).containsExactly(
            "INITIALIZING->ACTIVE", "ACTIVE->COMPLETED", "COMPLETED->CLEANUP");

        InOrder cleanup = inOrder(transport, executorSessions, contextManager, coordinator);
        cleanup.verify(transport).destroyStream(STREAM_ID);
        cleanup.verify(executorSessions).destroySession(EXECUTOR_SESSION_ID);
        cleanup.verify(contextManager).destroySession(SESSION_ID);
        cleanup.verify(coordinator).destroyWorkflowSession(SESSION_ID);
        assertThat(orchestrator.sessionExists(SESSION_ID)).isFalse();
    }

    @Test
    void processSteps_협력자를_순서대로_초기화() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(deferred::add);
        List<String> steps = List.of("a", "b");

        // when
        orchestrator.processSteps(StepProcessingRequest.of(steps));

        // then
        InOrder init = inOrder(coordinator, contextManager, executorSessions, transport, aiIntegration);
        init.verify(coordinator).createWorkflowSession(eq(steps), any(ProcessingConfig.class));
        init.verify(contextManager).createSession(SESSION_ID);
        init.verify(contextManager).linkExecutorSession(SESSION_ID, EXECUTOR_SESSION_ID);
        init.verify(contextManager).setSteps(SESSION_ID, steps);
        init.verify(executorSessions).createSession(EXECUTOR_SESSION_ID);
        init.verify(transport).createStream(STREAM_ID, SESSION_ID);
        init.verify(aiIntegration).validateConnection("ai_wf-1");
        assertThat(orchestrator.getSessionStatus(SESSION_ID)).contains(SessionStatus.ACTIVE);
        assertThat(orchestrator.getExecutionProgress(SESSION_ID).totalSteps()).isEqualTo(2);
        assertThat(deferred).hasSize(1);
    }

    @Test
    void processSteps_첫_실패에서_중단하고_WORKFLOW_FAILED_발행() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        doNothing()
            .doThrow(new IllegalStateException("Element not found"))
            .when(taskExecutor).processStep(any());

        // when
        orchestrator.processSteps(StepProcessingRequest.of(List.of("a", "b", "c")));

        // then
        verify(taskExecutor, times(2)).processStep(any());
        verify(taskExecutor, never()).processStep(argThat(r -> r.stepIndex() == 2));
        assertThat(publishedTypes()).containsExactly(
            StreamEventType.WORKFLOW_STARTED,
            StreamEventType.STEP_STARTED,
            StreamEventType.STEP_STARTED,
            StreamEventType.WORKFLOW_FAILED
        );
        StreamEvent failed = publishedEvents().get(3);
        assertThat(failed.data().message()).isEqualTo("Workflow failed: Failed to process step 1");
        assertThat(failed.data().error().code()).isEqualTo(ErrorCode.STEP_PROCESSING_TIMEOUT.name());
        assertThat(failed.data().error().details()).containsEntry("originalError", "Element not found");
        assertThat(statusChanges).contains("ACTIVE->FAILED");
        verify(coordinator).destroyWorkflowSession(SESSION_ID);
        assertThat(orchestrator.sessionExists(SESSION_ID)).isFalse();
    }

    @Test
    void processSteps_스텝_루프의_Error는_워크플로우를_실패시킨_뒤_전파() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(deferred::add,
            new OrchestratorConfig().withMaxConcurrentSessions(1));
        doThrow(new AssertionError("executor bug")).when(taskExecutor).processStep(any());
        orchestrator.processSteps(StepProcessingRequest.of(List.of("a", "b")));

        // when & then
        assertThatThrownBy(() -> deferred.remove(0).run())
            .isInstanceOf(AssertionError.class)
            .hasMessage("executor bug");
        assertThat(publishedTypes()).containsExactly(
            StreamEventType.WORKFLOW_STARTED,
            StreamEventType.STEP_STARTED,
            StreamEventType.WORKFLOW_FAILED
        );
        assertThat(statusChanges).contains("ACTIVE->FAILED");
        verify(taskExecutor, times(1)).processStep(any());
        verify(coordinator).destroyWorkflowSession(SESSION_ID);
        assertThat(orchestrator.sessionExists(SESSION_ID)).isFalse();
        assertThat(orchestrator.healthCheck().activeSessions()).isZero();

        // 한도 1에서도 다음 세션 생성 가능
        assertThat(orchestrator.createSession("next", null)).isEqualTo("next");
    }

    @Test
    void processSteps_스트리밍_비활성화_시_이벤트_없음() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);

        // when
        orchestrator.processSteps(new StepProcessingRequest(List.of("a"),
            ProcessingConfig.defaults().withEnableStreaming(false)));

        // then
        verify(transport, never()).publishEvent(anyString(), any());
        verify(taskExecutor).processStep(new TaskStepRequest(SESSION_ID, 0, "a", null));
    }

    @Test
    void processSteps_STEP_STARTED_발행_실패는_워크플로우_실패() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        doAnswer(invocation -> {
            StreamEvent event = invocation.getArgument(1);
            if (event.type() == StreamEventType.STEP_STARTED) {
                throw new IllegalStateException("stream closed");
            }
            return null;
        }).when(transport).publishEvent(anyString(), any());

        // when
        orchestrator.processSteps(StepProcessingRequest.of(List.of("a", "b")));

        // then
        verify(taskExecutor, never()).processStep(any());
        assertThat(statusChanges).contains("ACTIVE->FAILED");
    }

    // ============================================================
    // 3. 요청 검증
    // ============================================================

    @Test
    void processSteps_빈_스텝_목록_거부() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);

        assertValidationFailure(() -> orchestrator.processSteps(StepProcessingRequest.of(List.of())),
            "Steps array cannot be empty");
        assertValidationFailure(() -> orchestrator.processSteps(null),
            "Step processing request is required");
        verifyNoInteractions(coordinator);
    }

    @Test
    void processSteps_스텝_수_초과_거부() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run,
            new OrchestratorConfig().withMaxStepsPerWorkflow(2));

        assertValidationFailure(() -> orchestrator.processSteps(StepProcessingRequest.of(List.of("a", "b", "c"))),
            "Too many steps: 3/2");
    }

    @Test
    void processSteps_빈_스텝과_긴_스텝_거부() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run,
            new OrchestratorConfig().withMaxStepContentLength(5));

        assertValidationFailure(() -> orchestrator.processSteps(StepProcessingRequest.of(List.of("a", "  "))),
            "Invalid step at index 1: must be a non-empty string");
        assertValidationFailure(() -> orchestrator.processSteps(StepProcessingRequest.of(List.of("abcdef"))),
            "Step content too long at index 0: 6/5 characters");
        assertValidationFailure(() -> orchestrator.processSteps(new StepProcessingRequest(List.of("a"), null)),
            "Processing config is required");
    }

    @Test
    void processSteps_의존성_누락_시_DEPENDENCY_RESOLUTION_FAILED() {
        // given
        DefaultWorkflowOrchestrator orchestrator = new DefaultWorkflowOrchestrator(
            new OrchestratorDependencies(coordinator, null, taskExecutor, executorSessions, null, aiIntegration),
            new OrchestratorConfig(), Runnable::run, new ErrorHandler(), clock);

        // when & then
        assertThatThrownBy(() -> orchestrator.processSteps(StepProcessingRequest.of(List.of("a"))))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.DEPENDENCY_RESOLUTION_FAILED)).isTrue())
            .hasMessageContaining("ContextManager");
        HealthReport report = orchestrator.healthCheck();
        assertThat(report.healthy()).isFalse();
        assertThat(report.errors()).extracting(HealthIssue::code).containsExactly("MISSING_DEPENDENCIES");
    }

    // ============================================================
    // 4. 초기화 실패 롤백
    // ============================================================

    @Test
    void processSteps_실행_세션_생성_실패_시_역순_롤백() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        doThrow(new IllegalStateException("executor unavailable"))
            .when(executorSessions).createSession(EXECUTOR_SESSION_ID);

        // when & then
        assertThatThrownBy(() -> orchestrator.processSteps(StepProcessingRequest.of(List.of("a"))))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.MODULE_INITIALIZATION_FAILED)).isTrue());

        InOrder rollback = inOrder(contextManager, coordinator);
        rollback.verify(contextManager).destroySession(SESSION_ID);
        rollback.verify(coordinator).destroyWorkflowSession(SESSION_ID);
        verify(executorSessions, never()).destroySession(anyString());
        verify(transport, never()).createStream(anyString(), anyString());
        assertThat(orchestrator.sessionExists(SESSION_ID)).isFalse();
    }

    @Test
    void processSteps_AI_연결_검증_실패_시_스트림까지_롤백() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        when(aiIntegration.validateConnection("ai_wf-1")).thenReturn(false);

        // when & then
        assertThatThrownBy(() -> orchestrator.processSteps(StepProcessingRequest.of(List.of("a"))))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.MODULE_INITIALIZATION_FAILED)).isTrue());

        InOrder rollback = inOrder(transport, executorSessions, contextManager, coordinator);
        rollback.verify(transport).destroyStream(STREAM_ID);
        rollback.verify(executorSessions).destroySession(EXECUTOR_SESSION_ID);
        rollback.verify(contextManager).destroySession(SESSION_ID);
        rollback.verify(coordinator).destroyWorkflowSession(SESSION_ID);
        verify(taskExecutor, never()).processStep(any());
    }

    @Test
    void processSteps_코디네이터_실패는_SESSION_CREATION_FAILED() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        doThrow(new IllegalStateException("down")).when(coordinator).createWorkflowSession(anyList(), any());

        // when & then
        assertThatThrownBy(() -> orchestrator.processSteps(StepProcessingRequest.of(List.of("a"))))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.SESSION_CREATION_FAILED)).isTrue());
        verifyNoInteractions(contextManager);
    }

    // ============================================================
    // 5. 일시정지 / 재개 / 취소
    // ============================================================

    @Test
    void pause_resume_실행기에_현재_스텝_인덱스로_각_1회_위임() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(deferred::add);
        orchestrator.processSteps(StepProcessingRequest.of(List.of("a", "b")));

        // when
        orchestrator.pauseExecution(SESSION_ID);
        assertThat(orchestrator.getSessionStatus(SESSION_ID)).contains(SessionStatus.PAUSED);
        orchestrator.resumeExecution(SESSION_ID);

        // then
        verify(taskExecutor, times(1)).pauseExecution(SESSION_ID, 0);
        verify(taskExecutor, times(1)).resumeExecution(SESSION_ID, 0);
        assertThat(orchestrator.getSessionStatus(SESSION_ID)).contains(SessionStatus.ACTIVE);
        assertThat(publishedTypes()).containsExactly(
            StreamEventType.WORKFLOW_STARTED,
            StreamEventType.WORKFLOW_PAUSED,
            StreamEventType.WORKFLOW_RESUMED
        );

        // when: 지연된 루프 실행
        deferred.remove(0).run();

        // then
        verify(taskExecutor, times(2)).processStep(any());
        assertThat(publishedTypes()).endsWith(StreamEventType.WORKFLOW_COMPLETED);
    }

    @Test
    void pause_상태에서는_다음_스텝을_시작하지_않음() throws Exception {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(deferred::add);
        orchestrator.processSteps(StepProcessingRequest.of(List.of("a", "b")));
        orchestrator.pauseExecution(SESSION_ID);

        // when
        Thread loop = new Thread(deferred.remove(0), "step-loop");
        loop.start();

        // then
        verify(taskExecutor, after(200).never()).processStep(any());

        orchestrator.resumeExecution(SESSION_ID);
        verify(taskExecutor, timeout(2_000).times(2)).processStep(any());
        loop.join(2_000);
        assertThat(loop.isAlive()).isFalse();
    }

    @Test
    void cancel_협력자_정리_후_루프가_진행하지_않음() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(deferred::add);
        orchestrator.processSteps(StepProcessingRequest.of(List.of("a", "b")));

        // when
        orchestrator.cancelExecution(SESSION_ID);
        deferred.remove(0).run();

        // then
        verify(taskExecutor).cancelExecution(SESSION_ID, 0);
        verify(taskExecutor, never()).processStep(any());
        verify(transport).destroyStream(STREAM_ID);
        verify(executorSessions).destroySession(EXECUTOR_SESSION_ID);
        verify(contextManager).destroySession(SESSION_ID);
        verify(coordinator).destroyWorkflowSession(SESSION_ID);
        assertThat(orchestrator.sessionExists(SESSION_ID)).isFalse();
        assertThat(statusChanges).contains("ACTIVE->CANCELLED", "CANCELLED->CLEANUP");

        assertThatThrownBy(() -> orchestrator.getExecutionProgress(SESSION_ID))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.WORKFLOW_SESSION_NOT_FOUND)).isTrue());
    }

    @Test
    void cancel_실행기_위임_실패에도_정리() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(deferred::add);
        orchestrator.processSteps(StepProcessingRequest.of(List.of("a")));
        doThrow(new IllegalStateException("executor gone")).when(taskExecutor).cancelExecution(SESSION_ID, 0);

        // when & then
        assertThatThrownBy(() -> orchestrator.cancelExecution(SESSION_ID))
            .isInstanceOf(WorkflowException.class);
        verify(coordinator).destroyWorkflowSession(SESSION_ID);
        assertThat(orchestrator.sessionExists(SESSION_ID)).isFalse();
    }

    @Test
    void pause_없는_세션은_WORKFLOW_SESSION_NOT_FOUND() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);

        assertThatThrownBy(() -> orchestrator.pauseExecution("missing"))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.WORKFLOW_SESSION_NOT_FOUND)).isTrue());
        verify(taskExecutor, never()).pauseExecution(anyString(), anyInt());
    }

    @Test
    void cancel_pause_이미_종료된_세션은_WORKFLOW_SESSION_NOT_FOUND() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        orchestrator.createSession("s-1", null);
        orchestrator.updateSessionStatus("s-1", SessionStatus.FAILED);

        // when & then
        assertThatThrownBy(() -> orchestrator.cancelExecution("s-1"))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.WORKFLOW_SESSION_NOT_FOUND)).isTrue());
        assertThatThrownBy(() -> orchestrator.pauseExecution("s-1"))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.WORKFLOW_SESSION_NOT_FOUND)).isTrue());
        verify(taskExecutor, never()).cancelExecution(anyString(), anyInt());
        verify(taskExecutor, never()).pauseExecution(anyString(), anyInt());
        assertThat(orchestrator.getSessionStatus("s-1")).contains(SessionStatus.FAILED);
    }

    @Test
    void resume_PAUSED가_아니면_VALIDATION_FAILED() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        orchestrator.createSession("s-1", null);

        // when & then
        assertThatThrownBy(() -> orchestrator.resumeExecution("s-1"))
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.VALIDATION_FAILED)).isTrue());
        verify(taskExecutor, never()).resumeExecution(anyString(), anyInt());
    }

    // ============================================================
    // 6. 세션 조정
    // ============================================================

    @Test
    void destroyWorkflowSession_모든_자원_정리() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(deferred::add);
        orchestrator.processSteps(StepProcessingRequest.of(List.of("a")));

        // when
        orchestrator.destroyWorkflowSession(SESSION_ID);

        // then
        verify(transport).destroyStream(STREAM_ID);
        verify(contextManager).destroySession(SESSION_ID);
        verify(coordinator).destroyWorkflowSession(SESSION_ID);
        assertThat(orchestrator.sessionExists(SESSION_ID)).isFalse();
    }

    @Test
    void 세션_조회는_코디네이터에_위임() {
        // given
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);
        when(coordinator.listActiveWorkflowSessions()).thenReturn(List.of("wf-1", "wf-2"));
        when(coordinator.getWorkflowSession("wf-9")).thenReturn(java.util.Optional.empty());

        // when & then
        assertThat(orchestrator.listActiveWorkflowSessions()).containsExactly("wf-1", "wf-2");
        assertThat(orchestrator.getWorkflowSession("wf-9")).isEmpty();
    }

    @Test
    void healthCheck_정상() {
        DefaultWorkflowOrchestrator orchestrator = orchestrator(Runnable::run);

        HealthReport report = orchestrator.healthCheck();

        assertThat(report.healthy()).isTrue();
        assertThat(report.errors()).isEmpty();
        assertThat(report.moduleId()).isEqualTo(ErrorHandler.DEFAULT_MODULE_ID);
        assertThat(report.checkedAt()).isEqualTo(T0);
    }

    @Test
    void 기본_실행자는_이름이_붙은_데몬_스레드() throws Exception {
        // given
        OrchestratorDependencies dependencies = new OrchestratorDependencies(
            coordinator, contextManager, taskExecutor, executorSessions, transport, aiIntegration);
        DefaultWorkflowOrchestrator orchestrator = new DefaultWorkflowOrchestrator(dependencies, new OrchestratorConfig());
        CompletableFuture<Thread> stepThread = new CompletableFuture<>();
        doAnswer(invocation -> {
            stepThread.complete(Thread.currentThread());
            return null;
        }).when(taskExecutor).processStep(any());

        try {
            // when
            orchestrator.processSteps(StepProcessingRequest.of(List.of("a")));

            // then
            Thread thread = stepThread.get(2, TimeUnit.SECONDS);
            assertThat(thread.isDaemon()).isTrue();
            assertThat(thread.getName()).startsWith("stepflow-step-runner-");
        } finally {
            orchestrator.shutdown();
        }
    }

    private static void assertValidationFailure(Runnable call, String message) {
        assertThatThrownBy(call::run)
            .isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.hasCode(ErrorCode.VALIDATION_FAILED)).isTrue())
            .hasMessage(message);
    }
}
