package com.ryuqq.stepflow.application.orchestrator;

import com.ryuqq.stepflow.core.error.WorkflowException;
import com.ryuqq.stepflow.core.model.ExecutionProgress;
import com.ryuqq.stepflow.core.model.StepExecutionSummary;
import com.ryuqq.stepflow.core.model.StepProcessorSession;
import com.ryuqq.stepflow.core.model.WorkflowSession;
import com.ryuqq.stepflow.core.statemachine.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 워크플로우 실행 조정자.
 *
 * <p>세션 생명주기를 소유하고, 스텝을 순차 실행하며, 동시성/검증 한도를 지키고,
 * 실패를 {@link com.ryuqq.stepflow.core.error.StandardError}로 분류해 전파합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StepProcessingResult result = orchestrator.processSteps(
 *     StepProcessingRequest.of(List.of("Open the login page", "Click sign in")));
 *
 * // 즉시 반환되고, 나머지 스텝은 백그라운드에서 실행됨
 * streamClient.connect(result.streamId());
 * </pre>
 *
 * <p>모든 실패는 {@link WorkflowException}으로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkflowOrchestrator {

    /**
     * 로컬 오케스트레이션 세션 생성.
     *
     * <p>INITIALIZING으로 등록한 뒤 ACTIVE로 전이하고 onSessionCreated 콜백을 호출합니다.</p>
     *
     * @param workflowSessionId 세션 ID
     * @param config 세션 옵션 (nullable → 오케스트레이터 기본값)
     * @return 세션 ID
     * @throws WorkflowException 이미 존재하면 VALIDATION_FAILED, 한도 초과면 CONCURRENT_LIMIT_EXCEEDED
     */
    String createSession(String workflowSessionId, SessionConfig config);

    /**
     * 로컬 세션 제거 (CLEANUP 후 삭제). 없는 ID는 경고만 남깁니다.
     */
    void destroySession(String workflowSessionId);

    Optional<StepProcessorSession> getSession(String workflowSessionId);

    boolean sessionExists(String workflowSessionId);

    Optional<SessionStatus> getSessionStatus(String workflowSessionId);

    /**
     * 상태 전이 (상태 머신 규칙 검증, onSessionStatusChanged 호출).
     *
     * @throws WorkflowException 세션이 없으면 WORKFLOW_SESSION_NOT_FOUND, 허용되지 않은 전이면 VALIDATION_FAILED
     */
    void updateSessionStatus(String workflowSessionId, SessionStatus status);

    void recordActivity(String workflowSessionId);

    Optional<Instant> getLastActivity(String workflowSessionId);

    void setLifecycleCallbacks(SessionLifecycleCallbacks callbacks);

    /**
     * 워크플로우 실행 시작.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>요청 검증 (빈 목록, 스텝 수/길이 한도, 설정 누락 → VALIDATION_FAILED)</li>
     *   <li>세션 코디네이터로 통합 워크플로우 세션 생성</li>
     *   <li>컨텍스트 → 실행 세션 → 스트림 → AI 연결 순으로 초기화
     *       (실패 시 역순 롤백 후 MODULE_INITIALIZATION_FAILED)</li>
     *   <li>로컬 세션 생성, 스트리밍이면 WORKFLOW_STARTED 발행</li>
     *   <li>백그라운드에서 스텝 0부터 순차 실행 시작 후 즉시 반환</li>
     * </ol>
     *
     * <p>스텝 하나가 실패하면 워크플로우 전체가 FAILED로 끝납니다 (재시도/건너뛰기 없음).</p>
     *
     * @param request 실행 요청
     * @return 설정 결과
     * @throws WorkflowException 검증, 생성, 초기화 실패 시
     */
    StepProcessingResult processSteps(StepProcessingRequest request);

    void pauseExecution(String workflowSessionId);

    void resumeExecution(String workflowSessionId);

    /**
     * 실행 취소.
     *
     * <p>CANCELLED로 전이하고 Task Executor에 취소를 위임한 뒤,
     * 스트림/실행 세션/컨텍스트를 정리하고 레지스트리에서 제거합니다.</p>
     */
    void cancelExecution(String workflowSessionId);

    ExecutionProgress getExecutionProgress(String workflowSessionId);

    List<StepExecutionSummary> getStepHistory(String workflowSessionId);

    Optional<WorkflowSession> getWorkflowSession(String workflowSessionId);

    List<String> listActiveWorkflowSessions();

    /**
     * 협력자 자원, 로컬 세션, 코디네이터 세션을 모두 정리.
     *
     * @throws WorkflowException 세션 코디네이터가 없으면 DEPENDENCY_RESOLUTION_FAILED
     */
    void destroyWorkflowSession(String workflowSessionId);

    HealthReport healthCheck();
}
