package com.ryuqq.contextguard.application.health;

import java.util.Map;
import java.util.Set;

/**
 * 건강 점수 가중치 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>completeness: 체인 완전성 가중치 (기본 0.4)</li>
 *   <li>boundary: runtime 경계 통과율 가중치 (기본 0.3)</li>
 *   <li>preflight: pre-flight 통과 가중치 (기본 0.2)</li>
 *   <li>discrepancy: 불일치 감점 가중치 (기본 0.1)</li>
 * </ul>
 *
 * <p>가중치 합이 1이 아니어도 허용되며, 최종 점수는 [0, 100] 으로 제한됩니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 * @param completeness 완전성 가중치 (0 이상)
 * @param boundary 경계 가중치 (0 이상)
 * @param preflight pre-flight 가중치 (0 이상)
 * @param discrepancy 불일치 가중치 (0 이상)
 */
public record HealthWeights(double completeness, double boundary, double preflight, double discrepancy) {

    /**
     * override 맵에서 허용되는 키.
     */
    public static final Set<String> KEYS = Set.of("completeness", "boundary", "preflight", "discrepancy");

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: completeness=0.4, boundary=0.3, preflight=0.2, discrepancy=0.1</p>
     */
    public HealthWeights() {
        this(0.4, 0.3, 0.2, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 음수이거나 유한하지 않은 가중치인 경우
     */
    public HealthWeights {
        requireWeight("completeness", completeness);
        requireWeight("boundary", boundary);
        requireWeight("preflight", preflight);
        requireWeight("discrepancy", discrepancy);
    }

    /**
     * 기본값에 일부 항목만 덮어쓴 설정 생성.
     *
     * @param overrides 키(snake_case) → 가중치
     * @return HealthWeights
     * @throws IllegalArgumentException 알 수 없는 키가 있는 경우
     */
    public static HealthWeights fromMap(Map<String, ? extends Number> overrides) {
        HealthWeights weights = new HealthWeights();
        if (overrides == null) {
            return weights;
        }
        for (Map.Entry<String, ? extends Number> entry : overrides.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("weight cannot be null (key: " + entry.getKey() + ")");
            }
            double value = entry.getValue().doubleValue();
            switch (entry.getKey()) {
                case "completeness":
                    weights = weights.withCompleteness(value);
                    break;
                case "boundary":
                    weights = weights.withBoundary(value);
                    break;
                case "preflight":
                    weights = weights.withPreflight(value);
                    break;
                case "discrepancy":
                    weights = weights.withDiscrepancy(value);
                    break;
                default:
                    throw new IllegalArgumentException(
                        "Unknown health weight: '" + entry.getKey() + "' (expected one of " + KEYS + ")");
            }
        }
        return weights;
    }

    public HealthWeights withCompleteness(double completeness) {
        return new HealthWeights(completeness, this.boundary, this.preflight, this.discrepancy);
    }

    public HealthWeights withBoundary(double boundary) {
        return new HealthWeights(this.completeness, boundary, this.preflight, this.discrepancy);
    }

    public HealthWeights withPreflight(double preflight) {
        return new HealthWeights(this.completeness, this.boundary, preflight, this.discrepancy);
    }

    public HealthWeights withDiscrepancy(double discrepancy) {
        return new HealthWeights(this.completeness, this.boundary, this.preflight, discrepancy);
    }

    private static void requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(name + " weight must be a non-negative number (current: " + value + ")");
        }
    }
}
