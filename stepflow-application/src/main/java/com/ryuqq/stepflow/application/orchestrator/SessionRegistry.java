package com.ryuqq.stepflow.application.orchestrator;

import com.ryuqq.stepflow.core.error.WorkflowErrors;
import com.ryuqq.stepflow.core.error.WorkflowException;
import com.ryuqq.stepflow.core.model.StepProcessorSession;
import com.ryuqq.stepflow.core.statemachine.SessionStatus;
import com.ryuqq.stepflow.core.statemachine.SessionStatusTransition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * 오케스트레이션 세션 레지스트리.
 *
 * <p>세션 Map을 외부에 노출하지 않고, 하나의 {@link ReentrantLock} 아래에서
 * 원자적 연산만 제공합니다. 포그라운드 호출(생성/일시정지/취소/조회)과
 * 백그라운드 스텝 루프가 같은 레지스트리를 공유합니다.</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>같은 ID로 동시에 생성해도 하나만 성공</li>
 *   <li>동시 세션 한도는 검사와 삽입이 한 번에 이루어져 정확히 지켜짐</li>
 *   <li>상태 전이는 {@link SessionStatusTransition} 규칙으로 검증</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SessionRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition statusChanged = lock.newCondition();
    private final Map<String, StepProcessorSession> sessions = new HashMap<>();

    /**
     * 없을 때만 생성.
     *
     * @param sessionId 세션 ID
     * @param maxLiveSessions 살아있는 세션 한도
     * @param factory 세션 생성 함수 (잠금 안에서 호출)
     * @return 등록된 세션
     * @throws WorkflowException 이미 존재하면 VALIDATION_FAILED, 한도 초과면 CONCURRENT_LIMIT_EXCEEDED
     */
    public StepProcessorSession createIfAbsent(String sessionId, int maxLiveSessions,
                                               Supplier<StepProcessorSession> factory) {
        lock.lock();
        try {
            if (sessions.containsKey(sessionId)) {
                throw new WorkflowException(WorkflowErrors.validation(
                    "Session already exists: " + sessionId, Map.of("sessionId", sessionId)));
            }
            int live = liveCountLocked();
            if (live >= maxLiveSessions) {
                throw new WorkflowException(WorkflowErrors.concurrentLimit(live, maxLiveSessions));
            }
            StepProcessorSession session = factory.get();
            sessions.put(sessionId, session);
            return session;
        } finally {
            lock.unlock();
        }
    }

    public Optional<StepProcessorSession> get(String sessionId) {
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String sessionId) {
        lock.lock();
        try {
            return sessions.containsKey(sessionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 세션 갱신.
     *
     * @param sessionId 세션 ID
     * @param updater 현재 세션 → 새 세션 (잠금 안에서 호출)
     * @return 갱신된 세션 (없으면 empty)
     */
    public Optional<StepProcessorSession> update(String sessionId, UnaryOperator<StepProcessorSession> updater) {
        lock.lock();
        try {
            StepProcessorSession current = sessions.get(sessionId);
            if (current == null) {
                return Optional.empty();
            }
            StepProcessorSession updated = updater.apply(current);
            sessions.put(sessionId, updated);
            statusChanged.signalAll();
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 검증된 상태 전이.
     *
     * @param sessionId 세션 ID
     * @param target 목표 상태
     * @param updater 전이와 함께 적용할 갱신 (상태 변경 전 세션에 적용)
     * @return 이전 상태 (세션이 없으면 empty)
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public Optional<SessionStatus> transition(String sessionId, SessionStatus target,
                                              UnaryOperator<StepProcessorSession> updater) {
        lock.lock();
        try {
            StepProcessorSession current = sessions.get(sessionId);
            if (current == null) {
                return Optional.empty();
            }
            SessionStatusTransition.validate(current.status(), target);
            StepProcessorSession updated = updater.apply(current);
            sessions.put(sessionId, updated.withStatus(target, updated.lastActivity()));
            statusChanged.signalAll();
            return Optional.of(current.status());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 살아있는 세션에 대해서만 검증된 상태 전이.
     *
     * <p>종료 상태 확인, 전이 검증, 갱신이 하나의 잠금 구간에서 이루어집니다.
     * 반환된 세션의 {@code currentStepIndex}는 전이 시점의 값입니다.</p>
     *
     * @param sessionId 세션 ID
     * @param target 목표 상태
     * @param updater 전이와 함께 적용할 갱신
     * @return 전이 직전의 세션 (없거나 종료 상태면 empty)
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public Optional<StepProcessorSession> transitionLive(String sessionId, SessionStatus target,
                                                        UnaryOperator<StepProcessorSession> updater) {
        lock.lock();
        try {
            StepProcessorSession current = sessions.get(sessionId);
            if (current == null || current.status().isTerminal()) {
                return Optional.empty();
            }
            SessionStatusTransition.validate(current.status(), target);
            StepProcessorSession updated = updater.apply(current);
            sessions.put(sessionId, updated.withStatus(target, updated.lastActivity()));
            statusChanged.signalAll();
            return Optional.of(current);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 세션이 PAUSED가 아닐 때까지 대기한 뒤 갱신.
     *
     * <p>대기 후 세션이 제거되었거나 종료 상태이면 갱신하지 않고 empty를 반환합니다.
     * 대기와 갱신이 같은 잠금 구간에서 일어나므로 그 사이에 일시정지가 끼어들 수 없습니다.</p>
     *
     * @param sessionId 세션 ID
     * @param updater 갱신 함수
     * @return 갱신된 세션, 또는 더 진행할 수 없으면 empty
     */
    public Optional<StepProcessorSession> updateWhenRunnable(String sessionId,
                                                             UnaryOperator<StepProcessorSession> updater) {
        lock.lock();
        try {
            StepProcessorSession current = sessions.get(sessionId);
            while (current != null && current.status() == SessionStatus.PAUSED) {
                statusChanged.await();
                current = sessions.get(sessionId);
            }
            if (current == null || current.status().isTerminal()) {
                return Optional.empty();
            }
            StepProcessorSession updated = updater.apply(current);
            sessions.put(sessionId, updated);
            return Optional.of(updated);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public Optional<StepProcessorSession> remove(String sessionId) {
        lock.lock();
        try {
            StepProcessorSession removed = sessions.remove(sessionId);
            statusChanged.signalAll();
            return Optional.ofNullable(removed);
        } finally {
            lock.unlock();
        }
    }

    public List<StepProcessorSession> list() {
        lock.lock();
        try {
            return new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 종료 상태가 아닌 세션 수.
     */
    public int liveCount() {
        lock.lock();
        try {
            return liveCountLocked();
        } finally {
            lock.unlock();
        }
    }

    private int liveCountLocked() {
        int count = 0;
        for (StepProcessorSession session : sessions.values()) {
            if (!session.status().isTerminal()) {
                count++;
            }
        }
        return count;
    }
}
