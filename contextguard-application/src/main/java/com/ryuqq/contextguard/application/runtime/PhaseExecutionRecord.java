package com.ryuqq.contextguard.application.runtime;

import com.ryuqq.contextguard.core.boundary.ContractValidationResult;
import com.ryuqq.contextguard.core.model.PropagationStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 Phase 실행의 경계 검증 기록.
 *
 * <p>각 결과는 해당 경계가 검사되지 않은 경우 null입니다
 * (예: entry 없이 exit만 호출된 경우).</p>
 *
 * @param phase Phase 이름
 * @param entryResult entry 결과 (nullable)
 * @param exitResult exit 결과 (nullable)
 * @param enrichmentResult enrichment 결과 (nullable)
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record PhaseExecutionRecord(
    String phase,
    ContractValidationResult entryResult,
    ContractValidationResult exitResult,
    ContractValidationResult enrichmentResult
) {

    public PhaseExecutionRecord {
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("phase cannot be null or blank");
        }
    }

    /**
     * exit 결과만 있는 기록.
     *
     * @param phase Phase 이름
     * @param exitResult exit 결과
     * @return PhaseExecutionRecord
     */
    public static PhaseExecutionRecord exitOnly(String phase, ContractValidationResult exitResult) {
        return new PhaseExecutionRecord(phase, null, exitResult, null);
    }

    /**
     * exit 결과를 추가한 새 기록.
     *
     * @param exitResult exit 결과
     * @return 새 PhaseExecutionRecord
     */
    public PhaseExecutionRecord withExitResult(ContractValidationResult exitResult) {
        return new PhaseExecutionRecord(phase, entryResult, exitResult, enrichmentResult);
    }

    /**
     * 존재하는 결과 목록 (entry, exit, enrichment 순).
     *
     * @return 결과 목록
     */
    public List<ContractValidationResult> results() {
        List<ContractValidationResult> results = new ArrayList<>(3);
        if (entryResult != null) {
            results.add(entryResult);
        }
        if (exitResult != null) {
            results.add(exitResult);
        }
        if (enrichmentResult != null) {
            results.add(enrichmentResult);
        }
        return results;
    }

    /**
     * 존재하는 모든 결과가 통과했는지 확인.
     *
     * @return BLOCKING 실패가 없으면 true
     */
    public boolean passed() {
        return results().stream().allMatch(ContractValidationResult::passed);
    }

    /**
     * 존재하는 결과 중 가장 나쁜 전파 상태.
     *
     * @return 결과가 없으면 PROPAGATED
     */
    public PropagationStatus propagationStatus() {
        List<PropagationStatus> statuses = new ArrayList<>(3);
        for (ContractValidationResult result : results()) {
            statuses.add(result.propagationStatus());
        }
        return PropagationStatus.worst(statuses);
    }
}
