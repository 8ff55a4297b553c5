package com.ryuqq.contextguard.application.regression;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 회귀 게이트 집계 결과.
 *
 * @param passed 모든 검사가 통과했으면 true (검사가 없어도 true)
 * @param checks 검사 결과 목록
 * @param totalChecks 검사 수
 * @param failedChecks 실패한 검사 수
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record GateResult(boolean passed, List<GateCheck> checks, int totalChecks, int failedChecks) {

    public GateResult {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    /**
     * 검사 목록으로부터 결과 생성.
     *
     * @param checks 검사 결과
     * @return GateResult
     */
    public static GateResult of(List<GateCheck> checks) {
        int failed = (int) checks.stream().filter(c -> !c.passed()).count();
        return new GateResult(failed == 0, checks, checks.size(), failed);
    }

    public List<GateCheck> failures() {
        return checks.stream().filter(c -> !c.passed()).collect(Collectors.toUnmodifiableList());
    }

    public List<GateCheck> passedChecks() {
        return checks.stream().filter(GateCheck::passed).collect(Collectors.toUnmodifiableList());
    }

    /**
     * ID로 검사 조회.
     *
     * @param checkId 검사 식별자
     * @return 검사 결과 (없으면 empty)
     */
    public Optional<GateCheck> check(String checkId) {
        return checks.stream().filter(c -> c.checkId().equals(checkId)).findFirst();
    }
}
