package com.ryuqq.contextguard.adapter.yaml.document;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 체인 끝점 문서 ({@code {phase, field}}).
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record EndpointDocument(
    @JsonProperty("phase") String phase,
    @JsonProperty("field") String field
) {
}
