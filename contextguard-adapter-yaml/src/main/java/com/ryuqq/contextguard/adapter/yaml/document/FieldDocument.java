package com.ryuqq.contextguard.adapter.yaml.document;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 필드 명세 문서.
 *
 * <p>{@code default}는 YAML 스칼라, 시퀀스, 매핑 모두 허용되며 Jackson의 기본 타입
 * (String, Integer, Double, Boolean, List, Map)으로 역직렬화됩니다.</p>
 *
 * @param name dot-path 필드명 (필수)
 * @param type 기대 타입 이름
 * @param severity blocking | warning | advisory (기본 blocking)
 * @param defaultValue 기본값
 * @param description 설명
 * @param sourcePhase 생성 Phase
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record FieldDocument(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("severity") String severity,
    @JsonProperty("default") Object defaultValue,
    @JsonProperty("description") String description,
    @JsonProperty("source_phase") String sourcePhase
) {
}
