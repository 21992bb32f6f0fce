package com.ryuqq.stepflow.adapter.streamclient;

/**
 * 스트림 클라이언트 오류 코드와 기본 메시지.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StreamClientErrorCode {
    CONNECTION_LOST("Connection lost - trying to reconnect..."),
    RECONNECTION_FAILED("Failed to reconnect to event stream"),
    PARSE_FAILED("Failed to parse stream message"),
    STREAM_ERROR("Stream error"),
    CLIENT_CLOSED("Stream client closed");

    private final String defaultMessage;

    StreamClientErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
