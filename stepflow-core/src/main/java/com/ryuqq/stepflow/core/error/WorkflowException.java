package com.ryuqq.stepflow.core.error;

/**
 * {@link StandardError}를 운반하는 비검사 예외.
 *
 * <p>오케스트레이터의 모든 실패는 이 예외로 호출자에게 전달되며,
 * 호출자는 {@link #getError()}로 구조화된 오류에 접근합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WorkflowException extends RuntimeException {

    private final StandardError error;

    public WorkflowException(StandardError error) {
        this(error, null);
    }

    public WorkflowException(StandardError error, Throwable cause) {
        super(requireError(error).message(), cause);
        this.error = error;
    }

    private static StandardError requireError(StandardError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return error;
    }

    public StandardError getError() {
        return error;
    }

    public String getCode() {
        return error.code();
    }

    public boolean hasCode(ErrorCode code) {
        return error.hasCode(code);
    }
}
