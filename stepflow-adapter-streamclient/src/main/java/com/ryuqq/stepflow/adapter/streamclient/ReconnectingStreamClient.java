package com.ryuqq.stepflow.adapter.streamclient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.stepflow.adapter.streamclient.internal.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * 자동 재연결을 지원하는 스트림 소비자.
 *
 * <p>연결 상태는 {@link ConnectionState}로 명시적으로 관리되며,
 * 재연결은 {@link BackoffSchedule}의 고정 단계 대기 시간을 따릅니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>{@link #connect(String)}는 시도 횟수를 0으로 초기화합니다.</li>
 *   <li>새 연결을 열기 전에 이전 연결을 닫습니다. 닫힌 연결의 이벤트는 무시됩니다.</li>
 *   <li>재연결이 예약된 동안 들어온 오류는 무시됩니다.</li>
 *   <li>연결 성공 시 시도 횟수를 0으로 되돌리고, 재연결 중이었다면 onReconnected를 호출합니다.</li>
 *   <li>시도를 모두 소진하면 FAILED 상태가 되며 RECONNECTION_FAILED 오류를 알립니다.</li>
 *   <li>{@link #close()} 이후에는 재연결을 시도하지 않습니다.</li>
 * </ul>
 *
 * <p>콜백은 내부 잠금을 해제한 뒤 호출되므로 콜백 안에서 이 클라이언트를 호출해도 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ReconnectingStreamClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReconnectingStreamClient.class);

    private final StreamConnector connector;
    private final BackoffSchedule backoff;
    private final BackoffTimer timer;
    private final boolean ownsTimer;

    private final CallbackRegistry<DisplayEvent> eventCallbacks = new CallbackRegistry<>("event");
    private final CallbackRegistry<StreamClientError> errorCallbacks = new CallbackRegistry<>("error");
    private final CallbackRegistry<ReconnectAttempt> reconnectingCallbacks = new CallbackRegistry<>("reconnecting");
    private final CallbackRegistry<String> reconnectedCallbacks = new CallbackRegistry<>("reconnected");
    private final CallbackRegistry<String> connectedCallbacks = new CallbackRegistry<>("connected");
    private final StreamMessageDispatcher dispatcher;

    // guarded by this
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private String streamId;
    private StreamConnection connection;
    private long generation;
    private int reconnectAttempts;
    private boolean reconnecting;
    private boolean everConnected;
    private boolean closed;
    private BackoffTimer.ScheduledTask pendingReconnect;
    private CompletableFuture<StreamConnection> connectFuture;

    public ReconnectingStreamClient(StreamConnector connector, StreamClientConfig config) {
        this(connector, config, new ScheduledBackoffTimer(), true, Json.mapper(), Clock.systemUTC());
    }

    public ReconnectingStreamClient(
        StreamConnector connector,
        StreamClientConfig config,
        BackoffTimer timer,
        Clock clock
    ) {
        this(connector, config, timer, false, Json.mapper(), clock);
    }

    private ReconnectingStreamClient(
        StreamConnector connector,
        StreamClientConfig config,
        BackoffTimer timer,
        boolean ownsTimer,
        ObjectMapper mapper,
        Clock clock
    ) {
        if (connector == null) {
            throw new IllegalArgumentException("connector cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timer == null) {
            throw new IllegalArgumentException("timer cannot be null");
        }
        this.connector = connector;
        this.backoff = new BackoffSchedule(config);
        this.timer = timer;
        this.ownsTimer = ownsTimer;
        this.dispatcher = new StreamMessageDispatcher(mapper, clock, eventCallbacks, errorCallbacks);
    }

    /**
     * 스트림 연결.
     *
     * <p>첫 연결 성공 시 완료되며, 재연결 시도를 모두 소진하면
     * {@link StreamClientException}(RECONNECTION_FAILED)으로 실패합니다.</p>
     *
     * @param streamId 스트림 ID
     * @return 연결 결과
     * @throws IllegalArgumentException streamId가 비어 있는 경우
     * @throws IllegalStateException 이미 close된 경우
     */
    public CompletableFuture<StreamConnection> connect(String streamId) {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId cannot be null or blank");
        }
        List<Runnable> notifications = new ArrayList<>();
        CompletableFuture<StreamConnection> future;
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("Stream client is closed");
            }
            cancelPendingReconnect();
            if (connectFuture != null && !connectFuture.isDone()) {
                connectFuture.completeExceptionally(
                    new StreamClientException(StreamClientError.of(StreamClientErrorCode.CLIENT_CLOSED))
                );
            }
            this.streamId = streamId;
            this.reconnectAttempts = 0;
            this.reconnecting = false;
            this.everConnected = false;
            this.connectFuture = new CompletableFuture<>();
            future = connectFuture;
            state = ConnectionState.CONNECTING;
            log.info("Connecting to stream: {}", streamId);
            openConnection(notifications);
        }
        notifications.forEach(Runnable::run);
        return future;
    }

    // 호출자는 this 잠금을 보유해야 함
    private void openConnection(List<Runnable> notifications) {
        closeCurrentConnection();
        long expected = ++generation;
        try {
            connection = connector.open(streamId, new GenerationListener(expected));
        } catch (RuntimeException e) {
            log.error("Failed to open stream connection: {}", streamId, e);
            onFailure(expected, e, notifications);
        }
    }

    private void handleOpen(long expected) {
        List<Runnable> notifications = new ArrayList<>();
        synchronized (this) {
            if (isStale(expected)) {
                return;
            }
            String id = streamId;
            state = ConnectionState.OPEN;
            reconnectAttempts = 0;
            log.info("Stream connected: {}", id);
            if (reconnecting) {
                reconnecting = false;
                notifications.add(() -> reconnectedCallbacks.fire(id));
            }
            if (!everConnected) {
                everConnected = true;
                notifications.add(() -> connectedCallbacks.fire(id));
            }
            if (connectFuture != null && !connectFuture.isDone()) {
                StreamConnection current = connection;
                CompletableFuture<StreamConnection> future = connectFuture;
                notifications.add(() -> future.complete(current));
            }
        }
        notifications.forEach(Runnable::run);
    }

    private void handleMessage(long expected, String message) {
        synchronized (this) {
            if (isStale(expected)) {
                return;
            }
        }
        dispatcher.dispatch(message);
    }

    private void handleError(long expected, Throwable error) {
        List<Runnable> notifications = new ArrayList<>();
        synchronized (this) {
            onFailure(expected, error, notifications);
        }
        notifications.forEach(Runnable::run);
    }

    // 호출자는 this 잠금을 보유해야 함
    private void onFailure(long expected, Throwable error, List<Runnable> notifications) {
        if (isStale(expected)) {
            return;
        }
        if (pendingReconnect != null) {
            log.debug("Reconnection already scheduled, ignoring error for stream {}", streamId);
            return;
        }
        log.warn("Stream error on {} (state={}, attempts={}/{}): {}",
            streamId, state, reconnectAttempts, backoff.getMaxAttempts(),
            error != null ? error.getMessage() : null);

        if (state == ConnectionState.OPEN) {
            notifications.add(() -> errorCallbacks.fire(StreamClientError.of(StreamClientErrorCode.CONNECTION_LOST)));
        }
        closeCurrentConnection();
        generation++;

        if (!backoff.canAttempt(reconnectAttempts)) {
            exhausted(error, notifications);
            return;
        }

        reconnectAttempts++;
        reconnecting = true;
        state = ConnectionState.RECONNECTING;
        int attempt = reconnectAttempts;
        long delay = backoff.delayForAttempt(attempt);
        long scheduledGeneration = generation;
        log.info("Attempting to reconnect ({}/{}) in {}ms to stream {}",
            attempt, backoff.getMaxAttempts(), delay, streamId);

        ReconnectAttempt notice = new ReconnectAttempt(attempt, delay, backoff.getMaxAttempts());
        notifications.add(() -> reconnectingCallbacks.fire(notice));
        pendingReconnect = timer.schedule(delay, () -> fireReconnect(scheduledGeneration));
    }

    private void exhausted(Throwable cause, List<Runnable> notifications) {
        state = ConnectionState.FAILED;
        reconnecting = false;
        log.error("Max reconnection attempts reached for stream {}, giving up", streamId);

        StreamClientError failure = StreamClientError.of(StreamClientErrorCode.RECONNECTION_FAILED);
        notifications.add(() -> errorCallbacks.fire(failure));
        if (connectFuture != null && !connectFuture.isDone()) {
            CompletableFuture<StreamConnection> future = connectFuture;
            notifications.add(() -> future.completeExceptionally(new StreamClientException(failure, cause)));
        }
    }

    private void fireReconnect(long scheduledGeneration) {
        List<Runnable> notifications = new ArrayList<>();
        synchronized (this) {
            if (closed || scheduledGeneration != generation) {
                return;
            }
            pendingReconnect = null;
            log.info("Executing reconnection attempt {} for stream {}", reconnectAttempts, streamId);
            openConnection(notifications);
        }
        notifications.forEach(Runnable::run);
    }

    private boolean isStale(long expected) {
        return closed || expected != generation;
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel();
            pendingReconnect = null;
        }
    }

    private void closeCurrentConnection() {
        if (connection != null) {
            StreamConnection previous = connection;
            connection = null;
            try {
                previous.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close stream connection: {}", previous.streamId(), e);
            }
        }
    }

    public void onEvent(Consumer<DisplayEvent> callback) {
        eventCallbacks.add(callback);
    }

    public void removeEventCallback(Consumer<DisplayEvent> callback) {
        eventCallbacks.remove(callback);
    }

    public void onError(Consumer<StreamClientError> callback) {
        errorCallbacks.add(callback);
    }

    public void removeErrorCallback(Consumer<StreamClientError> callback) {
        errorCallbacks.remove(callback);
    }

    public void onReconnecting(Consumer<ReconnectAttempt> callback) {
        reconnectingCallbacks.add(callback);
    }

    public void onReconnected(Consumer<String> callback) {
        reconnectedCallbacks.add(callback);
    }

    public void onConnected(Consumer<String> callback) {
        connectedCallbacks.add(callback);
    }

    public synchronized ConnectionState state() {
        return state;
    }

    public synchronized int reconnectAttempts() {
        return reconnectAttempts;
    }

    public synchronized boolean isReconnecting() {
        return reconnecting;
    }

    public synchronized String currentStreamId() {
        return streamId;
    }

    /**
     * 연결 종료 및 재연결 중단.
     *
     * <p>close 이후 클라이언트는 재사용할 수 없습니다.</p>
     */
    @Override
    public void close() {
        CompletableFuture<StreamConnection> pending = null;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            cancelPendingReconnect();
            closeCurrentConnection();
            generation++;
            reconnecting = false;
            state = ConnectionState.DISCONNECTED;
            if (connectFuture != null && !connectFuture.isDone()) {
                pending = connectFuture;
            }
        }
        if (pending != null) {
            pending.completeExceptionally(
                new StreamClientException(StreamClientError.of(StreamClientErrorCode.CLIENT_CLOSED))
            );
        }
        if (ownsTimer && timer instanceof ScheduledBackoffTimer scheduled) {
            scheduled.close();
        }
        log.info("Stream client closed");
    }

    private final class GenerationListener implements StreamListener {

        private final long expected;

        private GenerationListener(long expected) {
            this.expected = expected;
        }

        @Override
        public void onOpen() {
            handleOpen(expected);
        }

        @Override
        public void onMessage(String message) {
            handleMessage(expected, message);
        }

        @Override
        public void onError(Throwable error) {
            handleError(expected, error);
        }
    }
}
