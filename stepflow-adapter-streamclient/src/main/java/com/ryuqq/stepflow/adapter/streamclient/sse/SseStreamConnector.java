package com.ryuqq.stepflow.adapter.streamclient.sse;

import com.ryuqq.stepflow.adapter.streamclient.StreamClientConfig;
import com.ryuqq.stepflow.adapter.streamclient.StreamConnection;
import com.ryuqq.stepflow.adapter.streamclient.StreamConnector;
import com.ryuqq.stepflow.adapter.streamclient.StreamListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * Server-Sent Events 기반 StreamConnector.
 *
 * <p>{@code GET <baseUrl>/api/stream/ws/<streamId>} 요청을 비동기로 보내고,
 * 200 응답 헤더 수신 시 onOpen, 각 {@code data:} 프레임마다 onMessage를 호출합니다.
 * 200 이외의 응답, 전송 오류, 서버 측 스트림 종료는 모두 onError로 보고됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SseStreamConnector implements StreamConnector {

    private static final Logger log = LoggerFactory.getLogger(SseStreamConnector.class);

    private final HttpClient httpClient;
    private final StreamClientConfig config;

    public SseStreamConnector(StreamClientConfig config) {
        this(HttpClient.newHttpClient(), config);
    }

    public SseStreamConnector(HttpClient httpClient, StreamClientConfig config) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.httpClient = httpClient;
        this.config = config;
    }

    @Override
    public StreamConnection open(String streamId, StreamListener listener) {
        String url = config.streamUrl(streamId);
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Accept", "text/event-stream")
            .header("Cache-Control", "no-cache")
            .GET()
            .build();

        SseLineSubscriber subscriber = new SseLineSubscriber(listener);
        CompletableFuture<HttpResponse<Void>> response = httpClient.sendAsync(request, responseInfo -> {
            if (responseInfo.statusCode() != 200) {
                subscriber.fail(new IOException("Unexpected SSE response status: " + responseInfo.statusCode()));
                return HttpResponse.BodySubscribers.replacing(null);
            }
            subscriber.opened();
            return HttpResponse.BodySubscribers.fromLineSubscriber(subscriber);
        });
        // 이미 실패한 요청이어도 리스너는 open() 반환 후 다른 스레드에서 호출
        response.whenCompleteAsync((ignored, error) -> {
            if (error != null) {
                subscriber.fail(error);
            }
        });

        log.debug("SSE request sent: {}", url);
        return new SseConnection(streamId, subscriber, response);
    }

    private static final class SseConnection implements StreamConnection {

        private final String streamId;
        private final SseLineSubscriber subscriber;
        private final CompletableFuture<HttpResponse<Void>> response;

        private SseConnection(String streamId, SseLineSubscriber subscriber, CompletableFuture<HttpResponse<Void>> response) {
            this.streamId = streamId;
            this.subscriber = subscriber;
            this.response = response;
        }

        @Override
        public String streamId() {
            return streamId;
        }

        @Override
        public void close() {
            subscriber.cancel();
            response.cancel(true);
        }
    }
}
