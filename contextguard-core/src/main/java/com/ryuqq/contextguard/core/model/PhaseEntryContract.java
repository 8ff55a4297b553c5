package com.ryuqq.contextguard.core.model;

import java.util.List;

/**
 * Phase 시작 조건 (entry boundary).
 *
 * <ul>
 *   <li><strong>required:</strong> 반드시 존재해야 하는 필드</li>
 *   <li><strong>enrichment:</strong> 전파되어야 하지만 누락 시 점진적으로 품질이 저하되는 필드</li>
 * </ul>
 *
 * @param required 필수 필드 목록
 * @param enrichment enrichment 필드 목록
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record PhaseEntryContract(
    List<FieldSpec> required,
    List<FieldSpec> enrichment
) {

    public PhaseEntryContract {
        required = required == null ? List.of() : List.copyOf(required);
        enrichment = enrichment == null ? List.of() : List.copyOf(enrichment);
    }

    /**
     * 빈 entry 계약.
     *
     * @return 필드가 없는 PhaseEntryContract
     */
    public static PhaseEntryContract empty() {
        return new PhaseEntryContract(List.of(), List.of());
    }
}
