package com.ryuqq.contextguard.application.postexec;

/**
 * Runtime 기록과 사후 검증 결과의 불일치 종류.
 *
 * <ul>
 *   <li><strong>LATE_CORRUPTION:</strong> runtime 경계 검사는 통과했지만 체인이 나중에 BROKEN</li>
 *   <li><strong>LATE_HEALING:</strong> runtime 경계 검사는 실패했지만 연결된 체인이 BROKEN이 아님</li>
 * </ul>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum DiscrepancyType {

    LATE_CORRUPTION("late_corruption"),
    LATE_HEALING("late_healing");

    private final String value;

    DiscrepancyType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
