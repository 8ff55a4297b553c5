package com.ryuqq.contextguard.adapter.yaml.document;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Phase exit 경계 문서.
 *
 * @param required 필수 산출 필드
 * @param optional 선택 산출 필드
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record ExitDocument(
    @JsonProperty("required") List<FieldDocument> required,
    @JsonProperty("optional") List<FieldDocument> optional
) {
}
