package com.ryuqq.stepflow.application.event;

import com.ryuqq.stepflow.core.error.ErrorHandler;
import com.ryuqq.stepflow.core.error.StandardError;
import com.ryuqq.stepflow.core.error.WorkflowErrors;
import com.ryuqq.stepflow.core.error.WorkflowException;
import com.ryuqq.stepflow.core.logging.WorkflowLogger;
import com.ryuqq.stepflow.core.model.ActionPayload;
import com.ryuqq.stepflow.core.model.ConfidenceLevel;
import com.ryuqq.stepflow.core.model.ExecutionProgress;
import com.ryuqq.stepflow.core.model.ReasoningPayload;
import com.ryuqq.stepflow.core.model.ScreenshotPayload;
import com.ryuqq.stepflow.core.model.StepInfo;
import com.ryuqq.stepflow.core.model.StepStatus;
import com.ryuqq.stepflow.core.model.StreamEvent;
import com.ryuqq.stepflow.core.model.StreamEventData;
import com.ryuqq.stepflow.core.model.StreamEventType;
import com.ryuqq.stepflow.core.model.StructuredPayload;
import com.ryuqq.stepflow.core.spi.StreamTransport;
import com.ryuqq.stepflow.core.spi.TaskEvent;
import com.ryuqq.stepflow.core.spi.TaskEventSink;
import com.ryuqq.stepflow.core.spi.TaskEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 스트림 이벤트 발행기.
 *
 * <p>오케스트레이션 사실(스텝/워크플로우 생명주기)을 {@link StreamEvent}로 변환해
 * {@link StreamTransport}에 전달합니다. 동시에 {@link TaskEventSink}로서
 * Task Executor가 보내는 알림을 받아 구조화 이벤트로 전달합니다.</p>
 *
 * <p><strong>발행 규칙:</strong></p>
 * <ul>
 *   <li>모든 이벤트는 새 UUID와 현재 시각으로 찍힘</li>
 *   <li>transport가 없거나 streamId가 없으면 debug 로그 후 건너뜀 (오류 아님)</li>
 *   <li>transport 오류는 EVENT_PUBLISHING_FAILED {@link WorkflowException}으로 호출자에게 전파</li>
 * </ul>
 *
 * <p><strong>Task 이벤트 처리:</strong></p>
 * <ul>
 *   <li>STEP_STARTED: 로그만 남김 (오케스트레이터가 직접 발행)</li>
 *   <li>STEP_COMPLETED / STEP_FAILED: 스텝 이벤트로 전달</li>
 *   <li>AI_REASONING_UPDATE / COMMAND_EXECUTED / SCREENSHOT_CAPTURED: 구조화 이벤트로 전달</li>
 *   <li>PROGRESS_UPDATE: WORKFLOW_PROGRESS로 전달</li>
 *   <li>알 수 없는 타입: debug 로그 후 버림</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamEventPublisher implements TaskEventSink {

    static final int STEP_MESSAGE_MAX_LENGTH = 100;

    private static final Logger log = LoggerFactory.getLogger(StreamEventPublisher.class);

    private final StreamTransport transport;
    private final ErrorHandler errorHandler;
    private final WorkflowLogger workflowLogger;
    private final Clock clock;

    public StreamEventPublisher(StreamTransport transport) {
        this(transport, new ErrorHandler(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param transport 스트림 전송 (nullable, 없으면 모든 발행을 건너뜀)
     * @param errorHandler 오류 처리기
     * @param clock 타임스탬프용 시계
     * @throws IllegalArgumentException errorHandler 또는 clock이 null인 경우
     */
    public StreamEventPublisher(StreamTransport transport, ErrorHandler errorHandler, Clock clock) {
        if (errorHandler == null) {
            throw new IllegalArgumentException("errorHandler cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.transport = transport;
        this.errorHandler = errorHandler;
        this.clock = clock;
        this.workflowLogger = new WorkflowLogger(log);
    }

    public void publishWorkflowStarted(String streamId, String sessionId, int totalSteps) {
        publish(streamId, sessionId, StreamEventType.WORKFLOW_STARTED, null,
            StreamEventData.ofMessage("Workflow started with " + totalSteps + " steps"));
    }

    /**
     * 스텝 시작 이벤트.
     *
     * <p>메시지의 스텝 내용은 100자를 넘으면 잘리고 "..."가 붙습니다.</p>
     */
    public void publishStepStarted(String streamId, String sessionId, int stepIndex, String stepContent) {
        String message = "Starting step " + (stepIndex + 1) + ": " + truncate(stepContent);
        publish(streamId, sessionId, StreamEventType.STEP_STARTED, stepIndex,
            StreamEventData.ofStep(message, new StepInfo(stepIndex, stepContent, StepStatus.IN_PROGRESS)));
    }

    public void publishStepCompleted(String streamId, String sessionId, int stepIndex, String stepContent) {
        publish(streamId, sessionId, StreamEventType.STEP_COMPLETED, stepIndex,
            StreamEventData.ofStep("Step " + (stepIndex + 1) + " completed",
                new StepInfo(stepIndex, stepContent, StepStatus.COMPLETED)));
    }

    public void publishStepFailed(String streamId, String sessionId, int stepIndex, StandardError error) {
        StreamEventData data = new StreamEventData(
            "Step " + (stepIndex + 1) + " failed: " + error.message(),
            new StepInfo(stepIndex, null, StepStatus.FAILED),
            null, error, null, null);
        publish(streamId, sessionId, StreamEventType.STEP_FAILED, stepIndex, data);
    }

    public void publishWorkflowProgress(String streamId, String sessionId, ExecutionProgress progress) {
        String message = String.format("Progress: %d/%d steps completed (%.0f%%)",
            progress.completedSteps(), progress.totalSteps(), progress.overallProgress());
        publish(streamId, sessionId, StreamEventType.WORKFLOW_PROGRESS, progress.currentStepIndex(),
            new StreamEventData(message, null, progress, null, null, null));
    }

    public void publishWorkflowCompleted(String streamId, String sessionId, int totalSteps) {
        publish(streamId, sessionId, StreamEventType.WORKFLOW_COMPLETED, null,
            StreamEventData.ofMessage("Workflow completed: " + totalSteps + " steps executed"));
    }

    public void publishWorkflowFailed(String streamId, String sessionId, StandardError error) {
        publish(streamId, sessionId, StreamEventType.WORKFLOW_FAILED, null,
            new StreamEventData("Workflow failed: " + error.message(), null, null, error, null, null));
    }

    public void publishWorkflowPaused(String streamId, String sessionId) {
        publish(streamId, sessionId, StreamEventType.WORKFLOW_PAUSED, null,
            StreamEventData.ofMessage("Workflow paused"));
    }

    public void publishWorkflowResumed(String streamId, String sessionId) {
        publish(streamId, sessionId, StreamEventType.WORKFLOW_RESUMED, null,
            StreamEventData.ofMessage("Workflow resumed"));
    }

    public void publishStructured(String streamId, String sessionId, StreamEventType type,
                                  String message, StructuredPayload payload) {
        publish(streamId, sessionId, type, payload.stepIndex(), StreamEventData.ofStructured(message, payload));
    }

    /**
     * 완성된 이벤트를 그대로 전송.
     *
     * @param streamId 대상 스트림 (nullable → 건너뜀)
     * @param event 이벤트
     * @throws WorkflowException transport가 실패한 경우 (EVENT_PUBLISHING_FAILED)
     */
    public void publishStreamEvent(String streamId, StreamEvent event) {
        if (transport == null) {
            log.debug("No stream transport configured, skipping {} for session {}", event.type(), event.sessionId());
            return;
        }
        if (streamId == null) {
            log.debug("No stream for session {}, skipping {}", event.sessionId(), event.type());
            return;
        }
        try {
            transport.publishEvent(streamId, event);
        } catch (RuntimeException e) {
            StandardError error = WorkflowErrors.eventPublishing(event.type().name(), streamId, e);
            throw new WorkflowException(error, e);
        }
        workflowLogger.logEventPublished(event.sessionId(), event.type().name(), streamId);
    }

    @Override
    public void onTaskEvent(TaskEvent event) {
        try {
            Optional<TaskEventType> type = TaskEventType.from(event.type());
            if (type.isEmpty()) {
                log.debug("Unknown task event type {}, dropped (session={})", event.type(), event.sessionId());
                return;
            }
            dispatch(type.get(), event);
        } catch (RuntimeException e) {
            StandardError error = errorHandler.wrapError(e, "EVENT_PUBLISHING_FAILED",
                "Failed to forward task event: " + event.type());
            errorHandler.handleError(error);
        }
    }

    private void dispatch(TaskEventType type, TaskEvent event) {
        String streamId = event.streamId();
        String sessionId = event.sessionId();
        int stepIndex = event.stepIndex() == null ? 0 : event.stepIndex();
        Instant at = event.timestamp();

        switch (type) {
            case STEP_STARTED -> log.debug("Task loop reported step {} started (session={})", stepIndex, sessionId);
            case STEP_COMPLETED -> publishStepCompleted(streamId, sessionId, stepIndex, event.stringValue("stepContent"));
            case STEP_FAILED -> {
                String code = Optional.ofNullable(event.stringValue("errorCode")).orElse("STEP_PROCESSING_TIMEOUT");
                String message = Optional.ofNullable(event.stringValue("error"))
                    .orElse("Step " + stepIndex + " failed");
                publishStepFailed(streamId, sessionId, stepIndex,
                    errorHandler.createStandardError(code, message, Map.of("stepIndex", stepIndex), null));
            }
            case AI_REASONING_UPDATE -> {
                String text = Optional.ofNullable(event.stringValue("content")).orElse("");
                Double score = event.numberValue("confidence");
                ConfidenceLevel confidence = ConfidenceLevel.fromScore(score == null ? 0.0 : score);
                publishStructured(streamId, sessionId, StreamEventType.AI_REASONING, text,
                    new ReasoningPayload(text, confidence, stepIndex, at));
            }
            case COMMAND_EXECUTED -> {
                String action = Optional.ofNullable(event.stringValue("action")).orElse("command");
                boolean success = event.booleanValue("success");
                String error = event.stringValue("error");
                StreamEventType eventType = success ? StreamEventType.COMMAND_COMPLETED : StreamEventType.COMMAND_FAILED;
                publishStructured(streamId, sessionId, eventType,
                    action + ": " + (success ? "Success" : "Failed"),
                    new ActionPayload(action, success, error, stepIndex, at));
            }
            case SCREENSHOT_CAPTURED -> {
                String screenshotId = event.stringValue("screenshotId");
                String action = event.stringValue("action");
                publishStructured(streamId, sessionId, StreamEventType.SCREENSHOT_CAPTURED,
                    action == null ? "Screenshot captured" : "Screenshot captured for " + action,
                    new ScreenshotPayload(screenshotId, action, stepIndex, at));
            }
            case PROGRESS_UPDATE -> publishProgressUpdate(event, stepIndex);
            default -> log.debug("Task event {} not forwarded", type);
        }
    }

    private void publishProgressUpdate(TaskEvent event, int stepIndex) {
        Map<String, Object> details = new LinkedHashMap<>(event.data());
        Double overall = event.numberValue("overallProgress");
        String message = overall == null
            ? "Step " + (stepIndex + 1) + " in progress"
            : String.format("Progress: %.0f%%", overall);
        publish(event.streamId(), event.sessionId(), StreamEventType.WORKFLOW_PROGRESS, stepIndex,
            new StreamEventData(message, null, null, null, null, details));
    }

    private void publish(String streamId, String sessionId, StreamEventType type,
                         Integer stepIndex, StreamEventData data) {
        StreamEvent event = new StreamEvent(UUID.randomUUID().toString(), type, sessionId, stepIndex,
            clock.instant(), data);
        publishStreamEvent(streamId, event);
    }

    static String truncate(String content) {
        if (content == null) {
            return "";
        }
        if (content.length() <= STEP_MESSAGE_MAX_LENGTH) {
            return content;
        }
        return content.substring(0, STEP_MESSAGE_MAX_LENGTH) + "...";
    }
}
