package com.ryuqq.contextguard.adapter.yaml.document;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 단일 Phase 문서.
 *
 * @param description 설명
 * @param entry entry 경계 문서 (없으면 빈 계약)
 * @param exit exit 경계 문서 (없으면 빈 계약)
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record PhaseDocument(
    @JsonProperty("description") String description,
    @JsonProperty("entry") EntryDocument entry,
    @JsonProperty("exit") ExitDocument exit
) {
}
