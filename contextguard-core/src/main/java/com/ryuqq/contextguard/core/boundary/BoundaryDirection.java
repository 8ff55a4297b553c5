package com.ryuqq.contextguard.core.boundary;

/**
 * 검증 경계 방향.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum BoundaryDirection {

    /**
     * Phase 시작 (entry.required).
     */
    ENTRY("entry"),

    /**
     * Phase 종료 (exit.required).
     */
    EXIT("exit"),

    /**
     * Phase 시작 시 enrichment 필드 (entry.enrichment).
     */
    ENRICHMENT("enrichment");

    private final String value;

    BoundaryDirection(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
