package com.ryuqq.contextguard.core.model;

import java.util.Locale;

/**
 * 계약 위반 시 처리 강도.
 *
 * <ul>
 *   <li>BLOCKING: 반드시 충족되어야 함 (위반 시 실패)</li>
 *   <li>WARNING: 충족되어야 하지만 실패로 처리하지 않음</li>
 *   <li>ADVISORY: 정보 제공용</li>
 * </ul>
 *
 * <p>YAML 등 직렬화 형식에서는 소문자 문자열({@code blocking}, {@code warning},
 * {@code advisory})로 표현됩니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum ConstraintSeverity {

    BLOCKING("blocking"),
    WARNING("warning"),
    ADVISORY("advisory");

    private final String value;

    ConstraintSeverity(String value) {
        this.value = value;
    }

    /**
     * 직렬화 값 조회.
     *
     * @return 소문자 문자열 값
     */
    public String value() {
        return value;
    }

    /**
     * 직렬화 값으로부터 Severity 조회 (대소문자 무시).
     *
     * @param value 문자열 값
     * @return ConstraintSeverity
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static ConstraintSeverity fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("severity cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConstraintSeverity severity : values()) {
            if (severity.value.equals(normalized)) {
                return severity;
            }
        }
        throw new IllegalArgumentException(
            "Unknown severity: '" + value + "' (expected blocking, warning or advisory)"
        );
    }
}
