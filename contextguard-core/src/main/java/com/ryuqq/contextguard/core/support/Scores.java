package com.ryuqq.contextguard.core.support;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 점수/백분율 계산 유틸리티.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class Scores {

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    // Utility class - prevent instantiation
    private Scores() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 소수점 첫째 자리로 반올림 (이진 double 값 기준 half-even).
     *
     * @param value 값
     * @return 반올림된 값
     */
    public static double round1(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * 비율을 백분율로 변환 (분모는 최소 1).
     *
     * <p>분모가 0이면 0.0을 반환합니다 (100.0이 아님).</p>
     *
     * @param numerator 분자
     * @param denominator 분모
     * @return 소수점 첫째 자리로 반올림된 백분율
     */
    public static double percentOf(int numerator, int denominator) {
        return round1((double) numerator / Math.max(denominator, 1) * 100);
    }

    /**
     * [0, 100] 범위로 제한.
     *
     * @param value 값
     * @return 제한된 값
     */
    public static double clamp(double value) {
        return Math.max(MIN, Math.min(MAX, value));
    }

    /**
     * [0, 100] 범위 검증.
     *
     * @param name 값 이름 (오류 메시지용)
     * @param value 값
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public static void requireInRange(String name, double value) {
        if (Double.isNaN(value) || value < MIN || value > MAX) {
            throw new IllegalArgumentException(name + " must be between 0 and 100 (current: " + value + ")");
        }
    }
}
