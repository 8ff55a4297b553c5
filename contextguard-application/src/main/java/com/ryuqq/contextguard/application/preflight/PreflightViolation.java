package com.ryuqq.contextguard.application.preflight;

import com.ryuqq.contextguard.core.model.ConstraintSeverity;

/**
 * Pre-flight 위반 항목.
 *
 * @param checkType 검사 종류
 * @param phase Phase 이름
 * @param field 필드명
 * @param severity 심각도
 * @param message 메시지
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record PreflightViolation(
    PreflightCheckType checkType,
    String phase,
    String field,
    ConstraintSeverity severity,
    String message
) {

    public PreflightViolation {
        if (checkType == null) {
            throw new IllegalArgumentException("checkType cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (phase == null) {
            phase = "";
        }
        if (message == null) {
            message = "";
        }
    }

    public boolean isBlocking() {
        return severity == ConstraintSeverity.BLOCKING;
    }
}
