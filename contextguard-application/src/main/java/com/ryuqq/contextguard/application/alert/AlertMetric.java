package com.ryuqq.contextguard.application.alert;

/**
 * 알림 규칙이 평가하는 지표.
 *
 * <ul>
 *   <li>사후 검증 보고서: COMPLETENESS_PCT, CHAINS_BROKEN, CHAINS_DEGRADED</li>
 *   <li>runtime 요약: BLOCKING_FAILURES, DEFAULTS_APPLIED, FAILED_PHASES</li>
 *   <li>pre-flight 결과: PREFLIGHT_VIOLATIONS (BLOCKING 수), PREFLIGHT_WARNINGS (WARNING 수)</li>
 * </ul>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum AlertMetric {

    COMPLETENESS_PCT("completeness_pct"),
    CHAINS_BROKEN("chains_broken"),
    CHAINS_DEGRADED("chains_degraded"),
    BLOCKING_FAILURES("blocking_failures"),
    DEFAULTS_APPLIED("defaults_applied"),
    FAILED_PHASES("failed_phases"),
    PREFLIGHT_VIOLATIONS("preflight_violations"),
    PREFLIGHT_WARNINGS("preflight_warnings");

    private final String value;

    AlertMetric(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 문자열로부터 지표 조회.
     *
     * @param value snake_case 지표 이름
     * @return AlertMetric
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static AlertMetric fromValue(String value) {
        for (AlertMetric metric : values()) {
            if (metric.value.equals(value)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown alert metric: '" + value + "'");
    }
}
