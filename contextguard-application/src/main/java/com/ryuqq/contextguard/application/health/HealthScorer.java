package com.ryuqq.contextguard.application.health;

import com.ryuqq.contextguard.application.postexec.PostExecutionReport;
import com.ryuqq.contextguard.application.preflight.PreflightResult;
import com.ryuqq.contextguard.application.runtime.WorkflowRunSummary;
import com.ryuqq.contextguard.core.support.Scores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 전파 건강 점수 계산기 (Layer 6).
 *
 * <p>Layer 3-5 결과를 하나의 0-100 점수로 합산합니다. 주어지지 않은 입력은 해당 구성 요소를
 * 만점으로 취급합니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>completeness: 사후 검증 보고서의 completenessPct (없으면 100)</li>
 *   <li>boundary: passedPhases / totalPhases * 100 (Phase가 없으면 100)</li>
 *   <li>preflight: 통과 100, 실패 0 (없으면 100)</li>
 *   <li>discrepancy penalty: 불일치 1건당 25점, 최대 100 (보고서 없으면 0)</li>
 * </ul>
 *
 * <pre>
 * overall = round1(clamp(c*wc + b*wb + p*wp + (100 - penalty)*wd))
 * </pre>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class HealthScorer {

    private static final Logger log = LoggerFactory.getLogger(HealthScorer.class);

    static final double PENALTY_PER_DISCREPANCY = 25.0;

    private final HealthWeights weights;

    public HealthScorer() {
        this(new HealthWeights());
    }

    /**
     * 기본 가중치에 일부를 덮어써서 생성.
     *
     * @param overrides 키(snake_case) → 가중치
     */
    public HealthScorer(Map<String, ? extends Number> overrides) {
        this(HealthWeights.fromMap(overrides));
    }

    /**
     * 생성자.
     *
     * @param weights 가중치
     * @throws IllegalArgumentException weights가 null인 경우
     */
    public HealthScorer(HealthWeights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("weights cannot be null");
        }
        this.weights = weights;
    }

    public HealthWeights weights() {
        return weights;
    }

    /**
     * 건강 점수 계산.
     *
     * @param preflightResult Layer 3 결과 (nullable)
     * @param runtimeSummary Layer 4 요약 (nullable)
     * @param postexecReport Layer 5 보고서 (nullable)
     * @return 건강 점수
     */
    public HealthScore score(PreflightResult preflightResult, WorkflowRunSummary runtimeSummary,
                             PostExecutionReport postexecReport) {
        double completeness = postexecReport == null ? Scores.MAX : postexecReport.completenessPct();
        double boundary = boundaryScore(runtimeSummary);
        double preflight = preflightResult == null || preflightResult.passed() ? Scores.MAX : Scores.MIN;
        double penalty = postexecReport == null
            ? 0.0
            : Math.min(postexecReport.runtimeDiscrepancies().size() * PENALTY_PER_DISCREPANCY, Scores.MAX);

        double overall = completeness * weights.completeness()
            + boundary * weights.boundary()
            + preflight * weights.preflight()
            + (Scores.MAX - penalty) * weights.discrepancy();

        HealthScore score = new HealthScore(Scores.round1(Scores.clamp(overall)), completeness, boundary,
            preflight, penalty);
        log.info("Propagation health: {}/100 (completeness={}, boundary={}, preflight={}, discrepancy_penalty={})",
            score.overall(), completeness, boundary, preflight, penalty);
        return score;
    }

    private static double boundaryScore(WorkflowRunSummary summary) {
        if (summary == null || summary.totalPhases() == 0) {
            return Scores.MAX;
        }
        return Scores.percentOf(summary.passedPhases(), summary.totalPhases());
    }
}
