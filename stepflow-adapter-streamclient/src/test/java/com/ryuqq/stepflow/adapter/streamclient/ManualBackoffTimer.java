package com.ryuqq.stepflow.adapter.streamclient;

import java.util.ArrayList;
import java.util.List;

/**
 * 테스트용 수동 타이머. {@link #runNext()} 호출 시에만 예약 작업을 실행합니다.
 */
class ManualBackoffTimer implements BackoffTimer {

    private final List<Entry> scheduled = new ArrayList<>();
    private final List<Long> requestedDelays = new ArrayList<>();

    @Override
    public synchronized ScheduledTask schedule(long delayMs, Runnable task) {
        Entry entry = new Entry(task);
        scheduled.add(entry);
        requestedDelays.add(delayMs);
        return () -> entry.cancelled = true;
    }

    /**
     * 가장 먼저 예약된 (취소되지 않은) 작업 실행.
     *
     * @return 실행 여부
     */
    boolean runNext() {
        Entry next;
        synchronized (this) {
            next = scheduled.stream().filter(e -> !e.cancelled && !e.ran).findFirst().orElse(null);
            if (next == null) {
                return false;
            }
            next.ran = true;
        }
        next.task.run();
        return true;
    }

    synchronized int pendingCount() {
        return (int) scheduled.stream().filter(e -> !e.cancelled && !e.ran).count();
    }

    synchronized List<Long> requestedDelays() {
        return List.copyOf(requestedDelays);
    }

    private static final class Entry {
        private final Runnable task;
        private boolean cancelled;
        private boolean ran;

        private Entry(Runnable task) {
            this.task = task;
        }
    }
}
