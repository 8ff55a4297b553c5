package com.ryuqq.contextguard.application.health;

import com.ryuqq.contextguard.core.support.Scores;

/**
 * 전파 건강 점수.
 *
 * <p>모든 값은 [0, 100] 범위입니다.</p>
 *
 * @param overall 가중 합산 점수
 * @param completenessScore 체인 완전성 점수
 * @param boundaryScore runtime 경계 통과율 점수
 * @param preflightScore pre-flight 점수 (0 또는 100)
 * @param discrepancyPenalty 불일치 감점
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record HealthScore(
    double overall,
    double completenessScore,
    double boundaryScore,
    double preflightScore,
    double discrepancyPenalty
) {

    public HealthScore {
        Scores.requireInRange("overall", overall);
        Scores.requireInRange("completenessScore", completenessScore);
        Scores.requireInRange("boundaryScore", boundaryScore);
        Scores.requireInRange("preflightScore", preflightScore);
        Scores.requireInRange("discrepancyPenalty", discrepancyPenalty);
    }

    /**
     * overall 점수만 지정한 점수 (회귀 비교용 baseline 등).
     *
     * @param overall 점수
     * @return 구성 요소가 모두 만점인 HealthScore
     */
    public static HealthScore ofOverall(double overall) {
        return new HealthScore(overall, Scores.MAX, Scores.MAX, Scores.MAX, 0.0);
    }
}
