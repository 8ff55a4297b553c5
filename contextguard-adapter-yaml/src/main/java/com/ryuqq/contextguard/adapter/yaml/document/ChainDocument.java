package com.ryuqq.contextguard.adapter.yaml.document;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 전파 체인 문서.
 *
 * @param chainId 체인 식별자 (필수)
 * @param description 설명
 * @param source 출발점 (필수)
 * @param waypoints 경유지
 * @param destination 도착점 (필수)
 * @param severity blocking | warning | advisory (기본 warning)
 * @param verification 검증식
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record ChainDocument(
    @JsonProperty("chain_id") String chainId,
    @JsonProperty("description") String description,
    @JsonProperty("source") EndpointDocument source,
    @JsonProperty("waypoints") List<EndpointDocument> waypoints,
    @JsonProperty("destination") EndpointDocument destination,
    @JsonProperty("severity") String severity,
    @JsonProperty("verification") String verification
) {
}
