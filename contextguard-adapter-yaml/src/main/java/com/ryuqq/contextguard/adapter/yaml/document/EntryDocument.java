package com.ryuqq.contextguard.adapter.yaml.document;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Phase entry 경계 문서.
 *
 * @param required 필수 입력 필드
 * @param enrichment 보강 필드
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record EntryDocument(
    @JsonProperty("required") List<FieldDocument> required,
    @JsonProperty("enrichment") List<FieldDocument> enrichment
) {
}
