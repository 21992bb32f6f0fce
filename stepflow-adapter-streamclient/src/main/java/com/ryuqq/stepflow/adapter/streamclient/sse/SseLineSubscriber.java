package com.ryuqq.stepflow.adapter.streamclient.sse;

import com.ryuqq.stepflow.adapter.streamclient.StreamListener;

import java.io.EOFException;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SSE 텍스트 라인을 프레임 단위로 조립합니다.
 *
 * <p>{@code data:} 라인을 모아 빈 줄에서 하나의 메시지로 전달합니다.
 * 여러 data 라인은 개행으로 연결됩니다. 주석(':')과 event/id/retry 필드는 무시합니다.</p>
 *
 * <p>close 이후 또는 첫 실패 이후에는 listener를 호출하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class SseLineSubscriber implements Flow.Subscriber<String> {

    private static final String DATA_FIELD = "data:";

    private final StreamListener listener;
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final AtomicReference<Flow.Subscription> subscription = new AtomicReference<>();
    private final StringBuilder buffer = new StringBuilder();
    private boolean hasData;

    SseLineSubscriber(StreamListener listener) {
        this.listener = listener;
    }

    void opened() {
        if (!finished.get()) {
            listener.onOpen();
        }
    }

    void fail(Throwable error) {
        if (finished.compareAndSet(false, true)) {
            listener.onError(error);
        }
    }

    void cancel() {
        finished.set(true);
        Flow.Subscription current = subscription.getAndSet(null);
        if (current != null) {
            current.cancel();
        }
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        if (finished.get()) {
            subscription.cancel();
            return;
        }
        this.subscription.set(subscription);
        subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(String line) {
        if (finished.get()) {
            return;
        }
        if (line.isEmpty()) {
            flush();
            return;
        }
        if (line.startsWith(DATA_FIELD)) {
            String value = line.substring(DATA_FIELD.length());
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            if (hasData) {
                buffer.append('\n');
            }
            buffer.append(value);
            hasData = true;
        }
    }

    @Override
    public void onError(Throwable throwable) {
        fail(throwable);
    }

    @Override
    public void onComplete() {
        flush();
        fail(new EOFException("SSE stream ended by server"));
    }

    private void flush() {
        if (!hasData) {
            return;
        }
        String message = buffer.toString();
        buffer.setLength(0);
        hasData = false;
        if (!finished.get()) {
            listener.onMessage(message);
        }
    }
}
