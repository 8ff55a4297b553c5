package com.ryuqq.contextguard.application.preflight;

import com.ryuqq.contextguard.core.model.ConstraintSeverity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Pre-flight 검사 집계 결과.
 *
 * <p><strong>불변식:</strong> {@code passed == criticalViolations().isEmpty()}</p>
 *
 * @param passed BLOCKING 위반이 없으면 true
 * @param violations 모든 위반 (검사 순서)
 * @param fieldReadinessDetails 필드 준비 상태 (field readiness + seed enrichment)
 * @param phaseGraphIssues Phase 그래프 이슈
 * @param phasesChecked 검사한 phase order 길이
 * @param fieldsChecked 필드 준비 상태 항목 수
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record PreflightResult(
    boolean passed,
    List<PreflightViolation> violations,
    List<FieldReadinessDetail> fieldReadinessDetails,
    List<PhaseGraphIssue> phaseGraphIssues,
    int phasesChecked,
    int fieldsChecked
) {

    public PreflightResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
        fieldReadinessDetails = fieldReadinessDetails == null ? List.of() : List.copyOf(fieldReadinessDetails);
        phaseGraphIssues = phaseGraphIssues == null ? List.of() : List.copyOf(phaseGraphIssues);
        if (phasesChecked < 0 || fieldsChecked < 0) {
            throw new IllegalArgumentException("counts cannot be negative");
        }
    }

    /**
     * 위반 목록으로부터 결과 생성 ({@code passed} 는 BLOCKING 위반 유무로 결정).
     *
     * @param violations 위반 목록
     * @param details 필드 준비 상태
     * @param issues Phase 그래프 이슈
     * @param phasesChecked 검사한 Phase 수
     * @return PreflightResult
     */
    public static PreflightResult of(List<PreflightViolation> violations, List<FieldReadinessDetail> details,
                                     List<PhaseGraphIssue> issues, int phasesChecked) {
        boolean passed = violations.stream().noneMatch(PreflightViolation::isBlocking);
        return new PreflightResult(passed, violations, details, issues, phasesChecked, details.size());
    }

    public List<PreflightViolation> criticalViolations() {
        return bySeverity(ConstraintSeverity.BLOCKING);
    }

    public List<PreflightViolation> warnings() {
        return bySeverity(ConstraintSeverity.WARNING);
    }

    public List<PreflightViolation> advisories() {
        return bySeverity(ConstraintSeverity.ADVISORY);
    }

    private List<PreflightViolation> bySeverity(ConstraintSeverity severity) {
        return violations.stream()
            .filter(v -> v.severity() == severity)
            .collect(Collectors.toUnmodifiableList());
    }
}
