package com.ryuqq.contextguard.application.preflight;

/**
 * Phase 그래프 이슈 (dangling read / dead write).
 *
 * @param issueType 이슈 종류
 * @param phase Phase 이름
 * @param field 필드명
 * @param message 메시지
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record PhaseGraphIssue(
    PhaseGraphIssueType issueType,
    String phase,
    String field,
    String message
) {

    public PhaseGraphIssue {
        if (issueType == null) {
            throw new IllegalArgumentException("issueType cannot be null");
        }
        if (phase == null || field == null) {
            throw new IllegalArgumentException("phase and field cannot be null");
        }
        if (message == null) {
            message = "";
        }
    }
}
