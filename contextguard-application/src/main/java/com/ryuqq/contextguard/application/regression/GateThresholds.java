package com.ryuqq.contextguard.application.regression;

import java.util.Map;
import java.util.Set;

/**
 * 회귀 게이트 임계값 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>minHealthScore: 허용 최소 건강 점수 (기본 70.0)</li>
 *   <li>maxCompletenessDrop: 완전성 및 건강 점수의 허용 최대 하락폭 (기본 5.0)</li>
 *   <li>maxBlockingFailureIncrease: BROKEN 체인 수의 허용 최대 증가 (기본 0)</li>
 * </ul>
 *
 * <p>maxCompletenessDrop은 건강 점수 하락폭 검사에도 그대로 사용됩니다 (별도 설정 없음).</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 * @param minHealthScore 최소 건강 점수 (0-100)
 * @param maxCompletenessDrop 최대 하락폭 (0 이상)
 * @param maxBlockingFailureIncrease 최대 증가 수 (0 이상)
 */
public record GateThresholds(double minHealthScore, double maxCompletenessDrop, int maxBlockingFailureIncrease) {

    /**
     * override 맵에서 허용되는 키.
     */
    public static final Set<String> KEYS = Set.of(
        "min_health_score", "max_completeness_drop", "max_blocking_failure_increase");

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: minHealthScore=70.0, maxCompletenessDrop=5.0, maxBlockingFailureIncrease=0</p>
     */
    public GateThresholds() {
        this(70.0, 5.0, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public GateThresholds {
        if (Double.isNaN(minHealthScore) || minHealthScore < 0 || minHealthScore > 100) {
            throw new IllegalArgumentException(
                "minHealthScore must be between 0 and 100 (current: " + minHealthScore + ")");
        }
        if (Double.isNaN(maxCompletenessDrop) || maxCompletenessDrop < 0) {
            throw new IllegalArgumentException(
                "maxCompletenessDrop must be non-negative (current: " + maxCompletenessDrop + ")");
        }
        if (maxBlockingFailureIncrease < 0) {
            throw new IllegalArgumentException(
                "maxBlockingFailureIncrease must be non-negative (current: " + maxBlockingFailureIncrease + ")");
        }
    }

    /**
     * 기본값에 일부 항목만 덮어쓴 설정 생성.
     *
     * @param overrides 키(snake_case) → 값
     * @return GateThresholds
     * @throws IllegalArgumentException 알 수 없는 키가 있는 경우
     */
    public static GateThresholds fromMap(Map<String, ? extends Number> overrides) {
        GateThresholds thresholds = new GateThresholds();
        if (overrides == null) {
            return thresholds;
        }
        for (Map.Entry<String, ? extends Number> entry : overrides.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("threshold cannot be null (key: " + entry.getKey() + ")");
            }
            Number value = entry.getValue();
            switch (entry.getKey()) {
                case "min_health_score":
                    thresholds = thresholds.withMinHealthScore(value.doubleValue());
                    break;
                case "max_completeness_drop":
                    thresholds = thresholds.withMaxCompletenessDrop(value.doubleValue());
                    break;
                case "max_blocking_failure_increase":
                    thresholds = thresholds.withMaxBlockingFailureIncrease(value.intValue());
                    break;
                default:
                    throw new IllegalArgumentException(
                        "Unknown gate threshold: '" + entry.getKey() + "' (expected one of " + KEYS + ")");
            }
        }
        return thresholds;
    }

    public GateThresholds withMinHealthScore(double minHealthScore) {
        return new GateThresholds(minHealthScore, this.maxCompletenessDrop, this.maxBlockingFailureIncrease);
    }

    public GateThresholds withMaxCompletenessDrop(double maxCompletenessDrop) {
        return new GateThresholds(this.minHealthScore, maxCompletenessDrop, this.maxBlockingFailureIncrease);
    }

    public GateThresholds withMaxBlockingFailureIncrease(int maxBlockingFailureIncrease) {
        return new GateThresholds(this.minHealthScore, this.maxCompletenessDrop, maxBlockingFailureIncrease);
    }
}
