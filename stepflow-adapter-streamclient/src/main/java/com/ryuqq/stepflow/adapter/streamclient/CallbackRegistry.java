package com.ryuqq.stepflow.adapter.streamclient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 등록 순서대로 호출되는 콜백 목록.
 *
 * <p>각 콜백은 독립적으로 호출되며, 한 콜백의 예외는 로그로 남고
 * 다음 콜백 호출을 막지 않습니다.</p>
 *
 * @param <T> 전달 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CallbackRegistry<T> {

    private static final Logger log = LoggerFactory.getLogger(CallbackRegistry.class);

    private final String name;
    private final List<Consumer<T>> callbacks = new CopyOnWriteArrayList<>();

    public CallbackRegistry(String name) {
        this.name = name;
    }

    public void add(Consumer<T> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        callbacks.add(callback);
    }

    public boolean remove(Consumer<T> callback) {
        return callbacks.remove(callback);
    }

    public void fire(T value) {
        for (Consumer<T> callback : callbacks) {
            try {
                callback.accept(value);
            } catch (RuntimeException e) {
                log.error("Error in {} callback", name, e);
            }
        }
    }

    public int size() {
        return callbacks.size();
    }
}
