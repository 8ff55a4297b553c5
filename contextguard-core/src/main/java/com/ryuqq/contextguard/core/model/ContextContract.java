package com.ryuqq.contextguard.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 컨텍스트 전파 계약 (Contract Model 루트).
 *
 * <p>파이프라인의 Phase별 entry/exit 요구사항과 end-to-end 전파 체인을 선언합니다.
 * 파이프라인 버전마다 한 번 생성되며 이후 읽기 전용입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>phases의 삽입 순서가 기본 실행 순서</li>
 *   <li>chainId는 계약 내에서 유일</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ContextContract contract = ContextContract.builder("artisan", "0.1.0")
 *     .phase("seed", PhaseContract.of(PhaseEntryContract.empty(), exit))
 *     .phase("plan", planContract)
 *     .chain(PropagationChainSpec.of("domain_flow",
 *         ChainEndpoint.of("seed", "domain"), ChainEndpoint.of("plan", "domain")))
 *     .build();
 * </pre>
 *
 * @param schemaVersion 계약 스키마 버전
 * @param pipelineId 대상 파이프라인 식별자
 * @param description 설명 (null 허용)
 * @param phases Phase 이름 → PhaseContract (삽입 순서 유지)
 * @param propagationChains 전파 체인 목록
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record ContextContract(
    String schemaVersion,
    String pipelineId,
    String description,
    Map<String, PhaseContract> phases,
    List<PropagationChainSpec> propagationChains
) {

    public ContextContract {
        if (schemaVersion == null || schemaVersion.isBlank()) {
            throw new IllegalArgumentException("schemaVersion cannot be null or blank");
        }
        if (pipelineId == null || pipelineId.isBlank()) {
            throw new IllegalArgumentException("pipelineId cannot be null or blank");
        }
        if (phases == null) {
            throw new IllegalArgumentException("phases cannot be null");
        }
        for (Map.Entry<String, PhaseContract> entry : phases.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("phase name cannot be null or blank");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("phase contract cannot be null (phase: " + entry.getKey() + ")");
            }
        }
        phases = Collections.unmodifiableMap(new LinkedHashMap<>(phases));
        propagationChains = propagationChains == null ? List.of() : List.copyOf(propagationChains);

        Set<String> chainIds = new HashSet<>();
        for (PropagationChainSpec chain : propagationChains) {
            if (!chainIds.add(chain.chainId())) {
                throw new IllegalArgumentException("Duplicate chainId: " + chain.chainId());
            }
        }
    }

    /**
     * Phase 계약 조회.
     *
     * @param phase Phase 이름
     * @return PhaseContract (없으면 empty)
     */
    public Optional<PhaseContract> phase(String phase) {
        return Optional.ofNullable(phases.get(phase));
    }

    public boolean hasPhase(String phase) {
        return phases.containsKey(phase);
    }

    /**
     * 기본 실행 순서 (phases 삽입 순서).
     *
     * @return Phase 이름 목록
     */
    public List<String> phaseOrder() {
        return List.copyOf(phases.keySet());
    }

    public static Builder builder(String pipelineId, String schemaVersion) {
        return new Builder(pipelineId, schemaVersion);
    }

    /**
     * ContextContract 빌더.
     */
    public static final class Builder {

        private final String pipelineId;
        private final String schemaVersion;
        private String description;
        private final Map<String, PhaseContract> phases = new LinkedHashMap<>();
        private final List<PropagationChainSpec> chains = new ArrayList<>();

        private Builder(String pipelineId, String schemaVersion) {
            this.pipelineId = pipelineId;
            this.schemaVersion = schemaVersion;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder phase(String name, PhaseContract contract) {
            phases.put(name, contract);
            return this;
        }

        public Builder chain(PropagationChainSpec chain) {
            chains.add(chain);
            return this;
        }

        public ContextContract build() {
            return new ContextContract(schemaVersion, pipelineId, description, phases, chains);
        }
    }
}
