package com.ryuqq.contextguard.application.alert;

import java.util.Locale;

/**
 * 알림 규칙 비교 연산자.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum AlertOperator {

    LT("lt", "<"),
    GT("gt", ">"),
    LTE("lte", "<="),
    GTE("gte", ">="),
    EQ("eq", "==");

    private final String value;
    private final String symbol;

    AlertOperator(String value, String symbol) {
        this.value = value;
        this.symbol = symbol;
    }

    public String value() {
        return value;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * 실제 값과 임계값 비교.
     *
     * @param actual 실제 값
     * @param threshold 임계값
     * @return 조건을 만족하면 true
     */
    public boolean test(double actual, double threshold) {
        switch (this) {
            case LT:
                return actual < threshold;
            case GT:
                return actual > threshold;
            case LTE:
                return actual <= threshold;
            case GTE:
                return actual >= threshold;
            case EQ:
                return actual == threshold;
            default:
                throw new IllegalStateException("Unknown operator: " + this);
        }
    }

    /**
     * 문자열로부터 연산자 조회.
     *
     * @param value lt, gt, lte, gte, eq
     * @return AlertOperator
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static AlertOperator fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("operator cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AlertOperator operator : values()) {
            if (operator.value.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown operator: '" + value + "' (expected lt, gt, lte, gte or eq)");
    }
}
