package com.ryuqq.contextguard.application.preflight;

/**
 * Phase 그래프 이슈 종류.
 *
 * <ul>
 *   <li><strong>DANGLING_READ:</strong> 요구되지만 초기 컨텍스트에도, 앞선 Phase 산출물에도 없는 필드</li>
 *   <li><strong>DEAD_WRITE:</strong> 산출되지만 어떤 Phase도 요구하지 않는 필드</li>
 * </ul>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum PhaseGraphIssueType {

    DANGLING_READ("dangling_read"),
    DEAD_WRITE("dead_write");

    private final String value;

    PhaseGraphIssueType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
