package com.ryuqq.contextguard.core.boundary;

import com.ryuqq.contextguard.core.model.ConstraintSeverity;
import com.ryuqq.contextguard.core.model.PropagationStatus;

/**
 * 경계에서 단일 필드를 검증한 결과.
 *
 * @param field dot-path 필드명
 * @param status 전파 상태
 * @param severity 필드 선언 severity
 * @param message 결과 메시지 (정상 전파 시 빈 문자열)
 * @param defaultApplied 기본값이 컨텍스트에 적용되었는지 여부
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record FieldValidationResult(
    String field,
    PropagationStatus status,
    ConstraintSeverity severity,
    String message,
    boolean defaultApplied
) {

    public FieldValidationResult {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (message == null) {
            message = "";
        }
    }
}
