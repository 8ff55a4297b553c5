package com.ryuqq.contextguard.application.regression;

/**
 * 변경이 일어난 위치.
 *
 * <ul>
 *   <li>ENTRY / ENRICHMENT: entry required / enrichment 필드 (소비 측)</li>
 *   <li>EXIT / EXIT_OPTIONAL: exit required / optional 필드 (생산 측)</li>
 *   <li>CHAIN / PHASE: 체인 또는 Phase 자체</li>
 * </ul>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum DriftDirection {

    ENTRY("entry"),
    ENRICHMENT("enrichment"),
    EXIT("exit"),
    EXIT_OPTIONAL("exit_optional"),
    CHAIN("chain"),
    PHASE("phase");

    private final String value;

    DriftDirection(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 필드를 소비하는 위치인지 확인.
     *
     * @return ENTRY 또는 ENRICHMENT이면 true
     */
    public boolean isConsuming() {
        return this == ENTRY || this == ENRICHMENT;
    }

    /**
     * 필드를 생산하는 위치인지 확인.
     *
     * @return EXIT 또는 EXIT_OPTIONAL이면 true
     */
    public boolean isProducing() {
        return this == EXIT || this == EXIT_OPTIONAL;
    }
}
