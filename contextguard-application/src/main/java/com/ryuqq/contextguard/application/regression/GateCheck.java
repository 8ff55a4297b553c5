package com.ryuqq.contextguard.application.regression;

/**
 * 단일 게이트 검사 결과.
 *
 * @param checkId 검사 식별자
 * @param passed 통과 여부
 * @param message 메시지
 * @param baselineValue 기준 값 (nullable)
 * @param currentValue 현재 값 (nullable)
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record GateCheck(String checkId, boolean passed, String message, Double baselineValue, Double currentValue) {

    public static final String COMPLETENESS_REGRESSION = "completeness_regression";
    public static final String HEALTH_MINIMUM = "health_minimum";
    public static final String HEALTH_REGRESSION = "health_regression";
    public static final String CONTRACT_DRIFT = "contract_drift";
    public static final String BLOCKING_FAILURES = "blocking_failures";

    public GateCheck {
        if (checkId == null || checkId.isBlank()) {
            throw new IllegalArgumentException("checkId cannot be null or blank");
        }
        if (message == null) {
            message = "";
        }
    }
}
