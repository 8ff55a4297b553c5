package com.ryuqq.contextguard.adapter.yaml.document;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 계약 파일 루트 문서.
 *
 * <p>YAML 키는 snake_case이며, 선언되지 않은 키는 로딩 시 거부됩니다.</p>
 *
 * @param schemaVersion 스키마 버전 (필수)
 * @param pipelineId 파이프라인 식별자 (필수)
 * @param description 설명
 * @param phases Phase 이름 → Phase 문서 (선언 순서 유지)
 * @param propagationChains 전파 체인 문서 목록
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record ContractDocument(
    @JsonProperty("schema_version") String schemaVersion,
    @JsonProperty("pipeline_id") String pipelineId,
    @JsonProperty("description") String description,
    @JsonProperty("phases") Map<String, PhaseDocument> phases,
    @JsonProperty("propagation_chains") List<ChainDocument> propagationChains
) {
}
