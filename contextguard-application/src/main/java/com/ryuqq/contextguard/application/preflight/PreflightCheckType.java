package com.ryuqq.contextguard.application.preflight;

/**
 * Pre-flight 검사 종류.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum PreflightCheckType {

    FIELD_READINESS("field_readiness"),
    SEED_ENRICHMENT("seed_enrichment"),
    PHASE_GRAPH("phase_graph");

    private final String value;

    PreflightCheckType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
