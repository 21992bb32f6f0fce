package com.ryuqq.stepflow.adapter.streamclient;

/**
 * 스트림 전송 계층 SPI.
 *
 * <p>구현체는 연결을 비동기로 열고, 결과를 {@link StreamListener}로 알립니다.
 * 연결 실패는 예외 대신 {@link StreamListener#onError(Throwable)}로 보고하는 것이 원칙입니다.
 * {@link #open(String, StreamListener)} 호출 스레드 안에서 listener를 호출하면 안 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.stepflow.adapter.streamclient.sse.SseStreamConnector
 */
public interface StreamConnector {

    /**
     * 스트림 연결 시작.
     *
     * @param streamId 스트림 ID
     * @param listener 연결 이벤트 수신자
     * @return 연결 핸들 (close로 연결 종료)
     */
    StreamConnection open(String streamId, StreamListener listener);
}
