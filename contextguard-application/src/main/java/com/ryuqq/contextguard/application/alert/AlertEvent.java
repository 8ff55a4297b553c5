package com.ryuqq.contextguard.application.alert;

import com.ryuqq.contextguard.core.model.ConstraintSeverity;

/**
 * 단일 규칙 평가 결과.
 *
 * @param ruleId 규칙 식별자
 * @param firing 발생 여부
 * @param severity 심각도
 * @param metric 지표
 * @param actualValue 실제 값
 * @param threshold 임계값
 * @param operator 연산자
 * @param message 발생 시 메시지 (미발생 시 빈 문자열)
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record AlertEvent(
    String ruleId,
    boolean firing,
    ConstraintSeverity severity,
    AlertMetric metric,
    double actualValue,
    double threshold,
    AlertOperator operator,
    String message
) {

    public AlertEvent {
        if (ruleId == null || severity == null || metric == null || operator == null) {
            throw new IllegalArgumentException("ruleId, severity, metric and operator cannot be null");
        }
        if (message == null) {
            message = "";
        }
    }
}
