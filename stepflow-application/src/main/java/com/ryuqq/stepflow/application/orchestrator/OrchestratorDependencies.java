package com.ryuqq.stepflow.application.orchestrator;

import com.ryuqq.stepflow.core.spi.AiIntegration;
import com.ryuqq.stepflow.core.spi.ContextManager;
import com.ryuqq.stepflow.core.spi.ExecutorSessionManager;
import com.ryuqq.stepflow.core.spi.SessionCoordinator;
import com.ryuqq.stepflow.core.spi.StreamTransport;
import com.ryuqq.stepflow.core.spi.TaskExecutor;

import java.util.ArrayList;
import java.util.List;

/**
 * 오케스트레이터가 사용하는 외부 협력자 묶음.
 *
 * <p>구성 루트에서 한 번 조립해 전달합니다. {@code streamTransport}는 선택이며,
 * 나머지가 비어 있으면 {@link #unresolved()}에 이름이 나열되고
 * 워크플로우 실행은 DEPENDENCY_RESOLUTION_FAILED로 거부됩니다.</p>
 *
 * @param sessionCoordinator 워크플로우 세션 코디네이터
 * @param contextManager AI 컨텍스트 관리자
 * @param taskExecutor 스텝 실행자 (task loop)
 * @param executorSessions 브라우저 실행 세션 관리자
 * @param streamTransport 스트림 전송 (nullable)
 * @param aiIntegration AI 연결 검증
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorDependencies(
    SessionCoordinator sessionCoordinator,
    ContextManager contextManager,
    TaskExecutor taskExecutor,
    ExecutorSessionManager executorSessions,
    StreamTransport streamTransport,
    AiIntegration aiIntegration
) {

    /**
     * 비어 있는 필수 협력자 이름.
     *
     * @return 누락된 협력자 이름 목록 (모두 있으면 빈 목록)
     */
    public List<String> unresolved() {
        List<String> missing = new ArrayList<>();
        if (sessionCoordinator == null) {
            missing.add("SessionCoordinator");
        }
        if (contextManager == null) {
            missing.add("ContextManager");
        }
        if (taskExecutor == null) {
            missing.add("TaskExecutor");
        }
        if (executorSessions == null) {
            missing.add("ExecutorSessionManager");
        }
        if (aiIntegration == null) {
            missing.add("AiIntegration");
        }
        return missing;
    }

    public boolean isResolved() {
        return unresolved().isEmpty();
    }
}
