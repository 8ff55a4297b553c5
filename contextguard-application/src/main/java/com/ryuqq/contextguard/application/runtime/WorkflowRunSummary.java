package com.ryuqq.contextguard.application.runtime;

import com.ryuqq.contextguard.core.boundary.ContractValidationResult;
import com.ryuqq.contextguard.core.model.PropagationStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 워크플로우 실행 전체의 경계 검증 요약.
 *
 * @param mode 사용된 처리 모드
 * @param phases Phase 기록 (기록 순서)
 * @param totalPhases 기록 수
 * @param passedPhases 통과한 기록 수
 * @param failedPhases 실패한 기록 수
 * @param totalFieldsChecked 검사한 필드 수 (모든 경계 합계)
 * @param totalBlockingFailures BLOCKING 실패 수
 * @param totalWarnings 경고 수
 * @param totalDefaultsApplied 적용된 기본값 수
 * @param overallPassed 모든 기록이 통과했으면 true
 * @param overallStatus 기록 중 가장 나쁜 전파 상태
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record WorkflowRunSummary(
    EnforcementMode mode,
    List<PhaseExecutionRecord> phases,
    int totalPhases,
    int passedPhases,
    int failedPhases,
    int totalFieldsChecked,
    int totalBlockingFailures,
    int totalWarnings,
    int totalDefaultsApplied,
    boolean overallPassed,
    PropagationStatus overallStatus
) {

    public WorkflowRunSummary {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        phases = phases == null ? List.of() : List.copyOf(phases);
        if (overallStatus == null) {
            overallStatus = PropagationStatus.PROPAGATED;
        }
    }

    /**
     * 기록 목록을 집계하여 요약 생성.
     *
     * @param mode 처리 모드
     * @param records Phase 기록
     * @return 요약
     */
    public static WorkflowRunSummary of(EnforcementMode mode, List<PhaseExecutionRecord> records) {
        int fields = 0;
        int blocking = 0;
        int warnings = 0;
        int defaults = 0;
        int passed = 0;
        List<PropagationStatus> statuses = new ArrayList<>(records.size());

        for (PhaseExecutionRecord record : records) {
            for (ContractValidationResult result : record.results()) {
                fields += result.fieldResults().size();
                blocking += result.blockingFailures().size();
                warnings += result.warnings().size();
                defaults += result.defaultsApplied();
            }
            if (record.passed()) {
                passed++;
            }
            statuses.add(record.propagationStatus());
        }

        int failed = records.size() - passed;
        return new WorkflowRunSummary(mode, records, records.size(), passed, failed, fields, blocking,
            warnings, defaults, failed == 0, PropagationStatus.worst(statuses));
    }

    /**
     * Phase의 마지막 기록 조회.
     *
     * @param phase Phase 이름
     * @return 마지막 기록 (없으면 empty)
     */
    public Optional<PhaseExecutionRecord> lastRecord(String phase) {
        PhaseExecutionRecord found = null;
        for (PhaseExecutionRecord record : phases) {
            if (record.phase().equals(phase)) {
                found = record;
            }
        }
        return Optional.ofNullable(found);
    }
}
