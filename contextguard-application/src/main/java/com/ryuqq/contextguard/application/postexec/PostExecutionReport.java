package com.ryuqq.contextguard.application.postexec;

import com.ryuqq.contextguard.core.boundary.ContractValidationResult;
import com.ryuqq.contextguard.core.chain.PropagationChainResult;

import java.util.List;
import java.util.Optional;

/**
 * 사후 검증 보고서 (Layer 5).
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code chainsIntact + chainsDegraded + chainsBroken == chainsTotal}</li>
 *   <li>{@code passed == (chainsBroken == 0 && finalExit 통과)}</li>
 * </ul>
 *
 * @param passed 통과 여부
 * @param chainResults 체인별 결과
 * @param chainsTotal 체인 수
 * @param chainsIntact INTACT 체인 수
 * @param chainsDegraded DEGRADED 체인 수
 * @param chainsBroken BROKEN 체인 수
 * @param completenessPct INTACT 비율 (체인이 없으면 0.0)
 * @param finalExitResult 마지막 Phase exit 재검증 결과 (nullable)
 * @param runtimeDiscrepancies runtime 불일치 목록
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record PostExecutionReport(
    boolean passed,
    List<PropagationChainResult> chainResults,
    int chainsTotal,
    int chainsIntact,
    int chainsDegraded,
    int chainsBroken,
    double completenessPct,
    ContractValidationResult finalExitResult,
    List<RuntimeDiscrepancy> runtimeDiscrepancies
) {

    public PostExecutionReport {
        chainResults = chainResults == null ? List.of() : List.copyOf(chainResults);
        runtimeDiscrepancies = runtimeDiscrepancies == null ? List.of() : List.copyOf(runtimeDiscrepancies);
        if (chainsIntact + chainsDegraded + chainsBroken != chainsTotal) {
            throw new IllegalArgumentException(String.format(
                "chain counts do not add up (total: %d, intact: %d, degraded: %d, broken: %d)",
                chainsTotal, chainsIntact, chainsDegraded, chainsBroken));
        }
        if (completenessPct < 0.0 || completenessPct > 100.0) {
            throw new IllegalArgumentException("completenessPct must be between 0 and 100 (current: "
                + completenessPct + ")");
        }
    }

    /**
     * 체인 카운터만 지정한 보고서 (회귀 비교용 baseline 등).
     *
     * @param chainsTotal 체인 수
     * @param chainsIntact INTACT 수
     * @param chainsDegraded DEGRADED 수
     * @param chainsBroken BROKEN 수
     * @param completenessPct 완전성 백분율
     * @return PostExecutionReport
     */
    public static PostExecutionReport ofCounts(int chainsTotal, int chainsIntact, int chainsDegraded,
                                               int chainsBroken, double completenessPct) {
        return new PostExecutionReport(chainsBroken == 0, List.of(), chainsTotal, chainsIntact,
            chainsDegraded, chainsBroken, completenessPct, null, List.of());
    }

    public Optional<ContractValidationResult> finalExit() {
        return Optional.ofNullable(finalExitResult);
    }
}
