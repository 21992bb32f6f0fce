package com.ryuqq.stepflow.core.model;

/**
 * 워크플로우 실행 설정 (불변 record).
 *
 * <p>기본값은 {@link #defaults()} 참고: maxExecutionTimeMs=300000 (5분), enableStreaming=true,
 * enableReflection=true, retryOnFailure=false, maxRetries=3, parallelExecution=false</p>
 *
 * @param maxExecutionTimeMs 최대 실행 시간 (밀리초, 양수여야 함)
 * @param enableStreaming 이벤트 스트리밍 활성화 여부
 * @param enableReflection AI 리플렉션 활성화 여부 (태스크 실행기로 전달)
 * @param retryOnFailure 실패 시 재시도 여부 (태스크 실행기로 전달)
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param parallelExecution 병렬 실행 여부 (오케스트레이터는 항상 순차 실행)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProcessingConfig(
    long maxExecutionTimeMs,
    boolean enableStreaming,
    boolean enableReflection,
    boolean retryOnFailure,
    int maxRetries,
    boolean parallelExecution
) {

    public ProcessingConfig {
        if (maxExecutionTimeMs <= 0) {
            throw new IllegalArgumentException(
                "maxExecutionTimeMs must be positive (current: " + maxExecutionTimeMs + ")"
            );
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries cannot be negative (current: " + maxRetries + ")"
            );
        }
    }

    public static ProcessingConfig defaults() {
        return new ProcessingConfig(300_000L, true, true, false, 3, false);
    }

    public ProcessingConfig withEnableStreaming(boolean enableStreaming) {
        return new ProcessingConfig(maxExecutionTimeMs, enableStreaming, enableReflection, retryOnFailure, maxRetries, parallelExecution);
    }

    public ProcessingConfig withMaxExecutionTimeMs(long maxExecutionTimeMs) {
        return new ProcessingConfig(maxExecutionTimeMs, enableStreaming, enableReflection, retryOnFailure, maxRetries, parallelExecution);
    }
}
