package com.ryuqq.stepflow.application.orchestrator;

/**
 * Health check 항목.
 *
 * @param code 문제 코드 (예: MISSING_DEPENDENCIES)
 * @param message 설명
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HealthIssue(String code, String message) {
}
