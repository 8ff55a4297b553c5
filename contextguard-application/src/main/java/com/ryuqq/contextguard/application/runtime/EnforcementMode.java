package com.ryuqq.contextguard.application.runtime;

import java.util.Locale;

/**
 * 경계 위반 처리 모드.
 *
 * <ul>
 *   <li><strong>STRICT:</strong> BLOCKING 실패 시 {@link BoundaryViolationException} 발생</li>
 *   <li><strong>PERMISSIVE:</strong> 기록 후 WARN 로그, 실행 계속</li>
 *   <li><strong>AUDIT:</strong> 기록 후 INFO 로그, 실행 계속</li>
 * </ul>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum EnforcementMode {

    STRICT("strict"),
    PERMISSIVE("permissive"),
    AUDIT("audit");

    private final String value;

    EnforcementMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 문자열로부터 모드 조회 (대소문자 무시).
     *
     * @param value 모드 이름
     * @return EnforcementMode
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static EnforcementMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("mode cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EnforcementMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown enforcement mode: '" + value + "'");
    }
}
