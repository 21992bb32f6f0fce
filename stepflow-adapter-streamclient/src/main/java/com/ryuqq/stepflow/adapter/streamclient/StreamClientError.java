package com.ryuqq.stepflow.adapter.streamclient;

/**
 * 오류 콜백으로 전달되는 값.
 *
 * @param code 오류 코드
 * @param message 표시용 메시지
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StreamClientError(StreamClientErrorCode code, String message) {

    public StreamClientError {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        message = message == null || message.isBlank() ? code.defaultMessage() : message;
    }

    public static StreamClientError of(StreamClientErrorCode code) {
        return new StreamClientError(code, code.defaultMessage());
    }
}
