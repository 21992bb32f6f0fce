package com.ryuqq.stepflow.adapter.streamclient;

/**
 * 전송 계층이 호출하는 연결 이벤트 수신자.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StreamListener {

    void onOpen();

    /**
     * 프레임 하나의 원문 수신.
     *
     * @param message JSON 텍스트
     */
    void onMessage(String message);

    /**
     * 연결 실패 또는 연결 끊김.
     *
     * @param error 원인
     */
    void onError(Throwable error);
}
