package com.ryuqq.contextguard.application.regression;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 계약 drift 보고서.
 *
 * <p><strong>불변식:</strong> {@code totalChanges == breakingCount + nonBreakingCount == changes.size()}</p>
 *
 * @param changes 변경 목록
 * @param totalChanges 변경 수
 * @param breakingCount breaking 변경 수
 * @param nonBreakingCount non-breaking 변경 수
 * @param oldPipelineId 이전 계약 pipeline ID
 * @param newPipelineId 새 계약 pipeline ID
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record DriftReport(
    List<DriftChange> changes,
    int totalChanges,
    int breakingCount,
    int nonBreakingCount,
    String oldPipelineId,
    String newPipelineId
) {

    public DriftReport {
        changes = changes == null ? List.of() : List.copyOf(changes);
        long breaking = changes.stream().filter(DriftChange::breaking).count();
        if (totalChanges != changes.size() || breakingCount != breaking
            || nonBreakingCount != changes.size() - breaking) {
            throw new IllegalArgumentException("drift counts do not match changes");
        }
        if (oldPipelineId == null) {
            oldPipelineId = "";
        }
        if (newPipelineId == null) {
            newPipelineId = "";
        }
    }

    /**
     * 변경 목록으로부터 보고서 생성 (카운트 자동 계산).
     *
     * @param changes 변경 목록
     * @param oldPipelineId 이전 pipeline ID
     * @param newPipelineId 새 pipeline ID
     * @return DriftReport
     */
    public static DriftReport of(List<DriftChange> changes, String oldPipelineId, String newPipelineId) {
        int breaking = (int) changes.stream().filter(DriftChange::breaking).count();
        return new DriftReport(changes, changes.size(), breaking, changes.size() - breaking,
            oldPipelineId, newPipelineId);
    }

    public boolean hasBreakingChanges() {
        return breakingCount > 0;
    }

    public List<DriftChange> breakingChanges() {
        return changes.stream().filter(DriftChange::breaking).collect(Collectors.toUnmodifiableList());
    }

    public List<DriftChange> nonBreakingChanges() {
        return changes.stream().filter(c -> !c.breaking()).collect(Collectors.toUnmodifiableList());
    }
}
