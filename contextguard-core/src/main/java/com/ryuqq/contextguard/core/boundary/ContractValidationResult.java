package com.ryuqq.contextguard.core.boundary;

import com.ryuqq.contextguard.core.model.PropagationStatus;

import java.util.List;

/**
 * 한 Phase 경계(entry/exit/enrichment) 검증의 집계 결과.
 *
 * <p><strong>불변식:</strong> {@code passed == blockingFailures.isEmpty()}</p>
 *
 * @param passed BLOCKING 실패가 없으면 true
 * @param phase Phase 이름
 * @param direction 경계 방향
 * @param fieldResults 필드별 결과
 * @param blockingFailures BLOCKING 실패 필드명
 * @param warnings 경고 메시지 ({@code "<field>: <message>"})
 * @param propagationStatus 경계 상태 (BLOCKING 실패 시 FAILED, 경고 시 PARTIAL, 그 외 PROPAGATED)
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record ContractValidationResult(
    boolean passed,
    String phase,
    BoundaryDirection direction,
    List<FieldValidationResult> fieldResults,
    List<String> blockingFailures,
    List<String> warnings,
    PropagationStatus propagationStatus
) {

    public ContractValidationResult {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction cannot be null");
        }
        fieldResults = fieldResults == null ? List.of() : List.copyOf(fieldResults);
        blockingFailures = blockingFailures == null ? List.of() : List.copyOf(blockingFailures);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (propagationStatus == null) {
            propagationStatus = PropagationStatus.PROPAGATED;
        }
        if (passed != blockingFailures.isEmpty()) {
            throw new IllegalArgumentException(
                "passed must match blockingFailures (passed: " + passed + ", blocking: " + blockingFailures + ")"
            );
        }
    }

    /**
     * 검증 대상 필드가 없는 통과 결과 (계약에 없는 Phase 등).
     *
     * @param phase Phase 이름
     * @param direction 경계 방향
     * @return 통과 결과
     */
    public static ContractValidationResult empty(String phase, BoundaryDirection direction) {
        return new ContractValidationResult(true, phase, direction, List.of(), List.of(), List.of(),
            PropagationStatus.PROPAGATED);
    }

    /**
     * 기본값이 적용된 필드 수.
     *
     * @return defaultApplied 필드 수
     */
    public int defaultsApplied() {
        int count = 0;
        for (FieldValidationResult result : fieldResults) {
            if (result.defaultApplied()) {
                count++;
            }
        }
        return count;
    }
}
