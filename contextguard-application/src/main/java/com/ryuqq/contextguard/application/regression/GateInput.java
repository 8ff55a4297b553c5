package com.ryuqq.contextguard.application.regression;

import com.ryuqq.contextguard.application.health.HealthScore;
import com.ryuqq.contextguard.application.postexec.PostExecutionReport;

/**
 * 회귀 게이트 입력. 모든 항목은 선택입니다.
 *
 * @param baselineReport 기준 실행의 사후 검증 보고서
 * @param currentReport 현재 실행의 사후 검증 보고서
 * @param baselineHealth 기준 건강 점수
 * @param currentHealth 현재 건강 점수
 * @param driftReport 계약 drift 보고서
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record GateInput(
    PostExecutionReport baselineReport,
    PostExecutionReport currentReport,
    HealthScore baselineHealth,
    HealthScore currentHealth,
    DriftReport driftReport
) {

    public static GateInput empty() {
        return new GateInput(null, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * GateInput 빌더.
     */
    public static final class Builder {

        private PostExecutionReport baselineReport;
        private PostExecutionReport currentReport;
        private HealthScore baselineHealth;
        private HealthScore currentHealth;
        private DriftReport driftReport;

        private Builder() {
        }

        public Builder baselineReport(PostExecutionReport baselineReport) {
            this.baselineReport = baselineReport;
            return this;
        }

        public Builder currentReport(PostExecutionReport currentReport) {
            this.currentReport = currentReport;
            return this;
        }

        public Builder baselineHealth(HealthScore baselineHealth) {
            this.baselineHealth = baselineHealth;
            return this;
        }

        public Builder currentHealth(HealthScore currentHealth) {
            this.currentHealth = currentHealth;
            return this;
        }

        public Builder driftReport(DriftReport driftReport) {
            this.driftReport = driftReport;
            return this;
        }

        public GateInput build() {
            return new GateInput(baselineReport, currentReport, baselineHealth, currentHealth, driftReport);
        }
    }
}
