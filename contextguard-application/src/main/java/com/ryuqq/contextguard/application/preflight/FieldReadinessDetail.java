package com.ryuqq.contextguard.application.preflight;

import com.ryuqq.contextguard.core.model.ConstraintSeverity;

/**
 * 단일 필드 준비 상태.
 *
 * @param field 필드명
 * @param phase 필드를 요구하는 Phase
 * @param ready 준비 여부
 * @param hasValue 초기 컨텍스트에 null이 아닌 값이 있는지
 * @param isDefault 값이 없거나 placeholder인지
 * @param severity 필드 심각도
 * @param message 준비되지 않은 경우의 사유 (준비된 경우 빈 문자열)
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record FieldReadinessDetail(
    String field,
    String phase,
    boolean ready,
    boolean hasValue,
    boolean isDefault,
    ConstraintSeverity severity,
    String message
) {

    public FieldReadinessDetail {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (message == null) {
            message = "";
        }
    }
}
