package com.ryuqq.stepflow.adapter.streamclient;

/**
 * 열린 스트림 연결 핸들.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StreamConnection extends AutoCloseable {

    String streamId();

    /**
     * 연결 종료. 여러 번 호출해도 안전해야 합니다.
     */
    @Override
    void close();
}
