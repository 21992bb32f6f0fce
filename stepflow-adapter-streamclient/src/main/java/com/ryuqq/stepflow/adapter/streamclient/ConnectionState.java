package com.ryuqq.stepflow.adapter.streamclient;

/**
 * 스트림 연결 상태.
 *
 * <pre>
 * DISCONNECTED → CONNECTING → OPEN
 *                    │          │
 *                    └── 오류 ──┴→ RECONNECTING → OPEN
 *                                     │
 *                                     └→ FAILED (시도 소진, 종료 상태)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    OPEN,
    RECONNECTING,
    FAILED
}
