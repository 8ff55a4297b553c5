package com.ryuqq.contextguard.core.model;

/**
 * 전파 체인의 끝점 (Phase + 필드).
 *
 * @param phase Phase 이름
 * @param field dot-path 필드명
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record ChainEndpoint(String phase, String field) {

    public ChainEndpoint {
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("endpoint phase cannot be null or blank");
        }
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("endpoint field cannot be null or blank");
        }
    }

    public static ChainEndpoint of(String phase, String field) {
        return new ChainEndpoint(phase, field);
    }

    @Override
    public String toString() {
        return phase + "." + field;
    }
}
