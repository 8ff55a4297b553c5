package com.ryuqq.contextguard.application.alert;

import com.ryuqq.contextguard.core.model.ConstraintSeverity;

import java.util.List;

/**
 * 알림 규칙.
 *
 * @param ruleId 규칙 식별자
 * @param description 설명
 * @param severity 심각도 (기본 WARNING)
 * @param metric 평가 지표
 * @param operator 비교 연산자
 * @param threshold 임계값
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record AlertRule(
    String ruleId,
    String description,
    ConstraintSeverity severity,
    AlertMetric metric,
    AlertOperator operator,
    double threshold
) {

    /**
     * 기본 규칙.
     */
    public static final List<AlertRule> DEFAULT_RULES = List.of(
        new AlertRule("propagation.completeness.critical",
            "Propagation chain completeness below critical threshold",
            ConstraintSeverity.BLOCKING, AlertMetric.COMPLETENESS_PCT, AlertOperator.LT, 50.0),
        new AlertRule("propagation.completeness.warning",
            "Propagation chain completeness below warning threshold",
            ConstraintSeverity.WARNING, AlertMetric.COMPLETENESS_PCT, AlertOperator.LT, 80.0),
        new AlertRule("runtime.blocking_failures",
            "Runtime blocking failures exceed threshold",
            ConstraintSeverity.BLOCKING, AlertMetric.BLOCKING_FAILURES, AlertOperator.GT, 0.0),
        new AlertRule("runtime.defaults_applied",
            "Too many fields defaulted during workflow",
            ConstraintSeverity.WARNING, AlertMetric.DEFAULTS_APPLIED, AlertOperator.GT, 5.0),
        new AlertRule("preflight.critical_violations",
            "Pre-flight critical violations detected",
            ConstraintSeverity.BLOCKING, AlertMetric.PREFLIGHT_VIOLATIONS, AlertOperator.GT, 0.0)
    );

    public AlertRule {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId cannot be null or blank");
        }
        if (metric == null) {
            throw new IllegalArgumentException("metric cannot be null");
        }
        if (operator == null) {
            throw new IllegalArgumentException("operator cannot be null");
        }
        if (Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold cannot be NaN");
        }
        if (description == null) {
            description = "";
        }
        if (severity == null) {
            severity = ConstraintSeverity.WARNING;
        }
    }
}
