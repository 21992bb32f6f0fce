package com.ryuqq.stepflow.core.model;

import java.util.Locale;

/**
 * AI 추론 신뢰도 등급.
 *
 * <p>점수(0.0~1.0)는 0.8 이상이면 HIGH, 0.5 이상이면 MEDIUM, 그 외 LOW로 변환됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static ConfidenceLevel fromScore(double score) {
        if (score >= 0.8) {
            return HIGH;
        }
        if (score >= 0.5) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * 와이어 포맷 값 ("high", "medium", "low").
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
