package com.ryuqq.contextguard.application.postexec;

/**
 * Runtime 불일치 항목.
 *
 * @param phase Phase 이름
 * @param discrepancyType 불일치 종류
 * @param message 메시지
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record RuntimeDiscrepancy(String phase, DiscrepancyType discrepancyType, String message) {

    public RuntimeDiscrepancy {
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("phase cannot be null or blank");
        }
        if (discrepancyType == null) {
            throw new IllegalArgumentException("discrepancyType cannot be null");
        }
        if (message == null) {
            message = "";
        }
    }
}
