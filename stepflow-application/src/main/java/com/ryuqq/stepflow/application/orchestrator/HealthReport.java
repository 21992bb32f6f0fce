package com.ryuqq.stepflow.application.orchestrator;

import java.time.Instant;
import java.util.List;

/**
 * Workflow Orchestrator 상태 보고.
 *
 * @param moduleId 보고 모듈 ID
 * @param healthy 문제 없음 여부
 * @param activeSessions 종료되지 않은 세션 수
 * @param totalSessions 레지스트리에 있는 전체 세션 수
 * @param errors 발견된 문제 목록
 * @param checkedAt 점검 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HealthReport(
    String moduleId,
    boolean healthy,
    int activeSessions,
    int totalSessions,
    List<HealthIssue> errors,
    Instant checkedAt
) {

    public HealthReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
