package com.ryuqq.stepflow.adapter.streamclient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link ScheduledExecutorService} 기반 BackoffTimer.
 *
 * <p>단일 데몬 스레드를 사용합니다. 예약된 작업의 예외는 로그로만 남깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScheduledBackoffTimer implements BackoffTimer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledBackoffTimer.class);

    private final ScheduledExecutorService scheduler;

    public ScheduledBackoffTimer() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "stream-client-backoff");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public ScheduledBackoffTimer(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
    }

    @Override
    public ScheduledTask schedule(long delayMs, Runnable task) {
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled reconnection task failed", e);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
