package com.ryuqq.contextguard.application.regression;

/**
 * 계약 변경 종류.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum DriftChangeType {

    PHASE_ADDED("phase_added"),
    PHASE_REMOVED("phase_removed"),
    FIELD_ADDED("field_added"),
    FIELD_REMOVED("field_removed"),
    SEVERITY_CHANGED("severity_changed"),
    CHAIN_ADDED("chain_added"),
    CHAIN_REMOVED("chain_removed");

    private final String value;

    DriftChangeType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
