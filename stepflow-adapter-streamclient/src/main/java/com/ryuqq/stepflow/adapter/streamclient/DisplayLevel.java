package com.ryuqq.stepflow.adapter.streamclient;

/**
 * 이벤트 표시 수준.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DisplayLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
