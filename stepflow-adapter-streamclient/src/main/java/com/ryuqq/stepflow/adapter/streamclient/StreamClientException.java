package com.ryuqq.stepflow.adapter.streamclient;

/**
 * 연결 Future를 실패시키는 예외.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamClientException extends RuntimeException {

    private final StreamClientError error;

    public StreamClientException(StreamClientError error) {
        this(error, null);
    }

    public StreamClientException(StreamClientError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public StreamClientError getError() {
        return error;
    }

    public StreamClientErrorCode getCode() {
        return error.code();
    }
}
