package com.ryuqq.contextguard.application.postexec;

import com.ryuqq.contextguard.application.runtime.PhaseExecutionRecord;
import com.ryuqq.contextguard.application.runtime.WorkflowRunSummary;
import com.ryuqq.contextguard.core.boundary.BoundaryValidator;
import com.ryuqq.contextguard.core.boundary.ContractValidationResult;
import com.ryuqq.contextguard.core.chain.PropagationChainChecker;
import com.ryuqq.contextguard.core.chain.PropagationChainResult;
import com.ryuqq.contextguard.core.context.ExecutionContext;
import com.ryuqq.contextguard.core.model.ChainStatus;
import com.ryuqq.contextguard.core.model.ContextContract;
import com.ryuqq.contextguard.core.support.Scores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 사후 검증기 (Layer 5).
 *
 * <p>모든 Phase가 끝난 뒤 최종 컨텍스트를 계약 전체에 대해 다시 검사합니다.</p>
 *
 * <p><strong>검사 항목:</strong></p>
 * <ol>
 *   <li>체인 무결성: 각 전파 체인을 INTACT / DEGRADED / BROKEN 으로 분류</li>
 *   <li>최종 exit: 마지막 Phase의 exit required 재검증</li>
 *   <li>Runtime 교차 검증: Layer 4 요약이 주어진 경우 late corruption / late healing 탐지</li>
 * </ol>
 *
 * <p>최종 컨텍스트는 복사본으로 검사하므로 호출자의 Map은 변경되지 않습니다.
 * 같은 입력에 대해 항상 같은 보고서를 반환합니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class PostExecutionValidator {

    private static final Logger log = LoggerFactory.getLogger(PostExecutionValidator.class);

    private final PropagationChainChecker chainChecker;
    private final BoundaryValidator boundaryValidator;

    public PostExecutionValidator() {
        this(new PropagationChainChecker(), new BoundaryValidator());
    }

    /**
     * 생성자.
     *
     * @param chainChecker 체인 검사기
     * @param boundaryValidator 경계 검증기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PostExecutionValidator(PropagationChainChecker chainChecker, BoundaryValidator boundaryValidator) {
        if (chainChecker == null) {
            throw new IllegalArgumentException("chainChecker cannot be null");
        }
        if (boundaryValidator == null) {
            throw new IllegalArgumentException("boundaryValidator cannot be null");
        }
        this.chainChecker = chainChecker;
        this.boundaryValidator = boundaryValidator;
    }

    public PostExecutionReport validate(ContextContract contract, Map<String, ?> finalContext) {
        return validate(contract, finalContext, null, null);
    }

    /**
     * 모든 사후 검사 실행.
     *
     * @param contract 계약
     * @param finalContext 최종 컨텍스트
     * @param phaseOrder 실행된 Phase 순서 (null이면 계약 선언 순서)
     * @param runtimeSummary Layer 4 요약 (nullable)
     * @return 보고서
     * @throws IllegalArgumentException contract 또는 finalContext가 null인 경우
     */
    public PostExecutionReport validate(ContextContract contract, Map<String, ?> finalContext,
                                        List<String> phaseOrder, WorkflowRunSummary runtimeSummary) {
        ExecutionContext context = snapshot(contract, finalContext);
        List<String> order = phaseOrder == null ? contract.phaseOrder() : phaseOrder;

        List<PropagationChainResult> chainResults = chainChecker.checkAll(contract, context);
        ContractValidationResult finalExit = checkFinalExit(contract, context, order);
        List<RuntimeDiscrepancy> discrepancies = runtimeSummary == null
            ? List.of()
            : crossReference(runtimeSummary, chainResults);

        PostExecutionReport report = report(chainResults, finalExit, discrepancies);
        if (!report.passed()) {
            log.warn("Post-execution FAILED: chains={}/{} intact, broken={}, discrepancies={}",
                report.chainsIntact(), report.chainsTotal(), report.chainsBroken(), discrepancies.size());
        } else if (report.chainsDegraded() > 0 || !discrepancies.isEmpty()) {
            log.info("Post-execution passed with issues: degraded={}, discrepancies={}",
                report.chainsDegraded(), discrepancies.size());
        } else {
            log.debug("Post-execution passed: completeness={}%", report.completenessPct());
        }
        return report;
    }

    /**
     * 체인 무결성 검사만 실행.
     *
     * @param contract 계약
     * @param finalContext 최종 컨텍스트
     * @return 보고서 (finalExitResult 없음, 불일치 없음)
     */
    public PostExecutionReport validateChains(ContextContract contract, Map<String, ?> finalContext) {
        ExecutionContext context = snapshot(contract, finalContext);
        return report(chainChecker.checkAll(contract, context), null, List.of());
    }

    // ============================================================
    // Internal
    // ============================================================

    private ContractValidationResult checkFinalExit(ContextContract contract, ExecutionContext context,
                                                    List<String> order) {
        if (order.isEmpty()) {
            return null;
        }
        String lastPhase = order.get(order.size() - 1);
        if (!contract.hasPhase(lastPhase)) {
            return null;
        }
        return boundaryValidator.validateExit(lastPhase, context, contract);
    }

    private List<RuntimeDiscrepancy> crossReference(WorkflowRunSummary summary,
                                                    List<PropagationChainResult> chainResults) {
        // Last record wins for a phase recorded more than once
        Map<String, Boolean> runtimePassed = new LinkedHashMap<>();
        for (PhaseExecutionRecord record : summary.phases()) {
            runtimePassed.put(record.phase(), record.passed());
        }

        List<RuntimeDiscrepancy> discrepancies = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : runtimePassed.entrySet()) {
            String phase = entry.getKey();
            List<String> brokenChains = chainResults.stream()
                .filter(r -> r.status() == ChainStatus.BROKEN && r.touches(phase))
                .map(PropagationChainResult::chainId)
                .collect(Collectors.toList());

            if (entry.getValue() && !brokenChains.isEmpty()) {
                discrepancies.add(new RuntimeDiscrepancy(phase, DiscrepancyType.LATE_CORRUPTION,
                    "Phase '" + phase + "' passed runtime boundary checks but propagation chain(s) "
                        + brokenChains + " are now broken"));
            } else if (!entry.getValue() && brokenChains.isEmpty() && !chainResults.isEmpty()) {
                discrepancies.add(new RuntimeDiscrepancy(phase, DiscrepancyType.LATE_HEALING,
                    "Phase '" + phase + "' failed runtime boundary checks but no propagation chain "
                        + "touching it is broken"));
            }
        }
        return discrepancies;
    }

    private static PostExecutionReport report(List<PropagationChainResult> chainResults,
                                              ContractValidationResult finalExit,
                                              List<RuntimeDiscrepancy> discrepancies) {
        int intact = 0;
        int degraded = 0;
        int broken = 0;
        for (PropagationChainResult result : chainResults) {
            switch (result.status()) {
                case INTACT:
                    intact++;
                    break;
                case DEGRADED:
                    degraded++;
                    break;
                case BROKEN:
                    broken++;
                    break;
                default:
                    throw new IllegalStateException("Unknown chain status: " + result.status());
            }
        }

        int total = chainResults.size();
        boolean passed = broken == 0 && (finalExit == null || finalExit.passed());
        return new PostExecutionReport(passed, chainResults, total, intact, degraded, broken,
            Scores.percentOf(intact, total), finalExit, discrepancies);
    }

    private static ExecutionContext snapshot(ContextContract contract, Map<String, ?> finalContext) {
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }
        if (finalContext == null) {
            throw new IllegalArgumentException("finalContext cannot be null");
        }
        return ExecutionContext.copyOf(finalContext);
    }
}
