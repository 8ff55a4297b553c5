package com.ryuqq.contextguard.application.alert;

import com.ryuqq.contextguard.application.postexec.PostExecutionReport;
import com.ryuqq.contextguard.application.preflight.PreflightResult;
import com.ryuqq.contextguard.application.runtime.WorkflowRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 알림 규칙 평가기 (Layer 6).
 *
 * <p>주어진 Layer 3-5 결과에서 지표를 추출하여 규칙을 평가합니다.
 * 지표를 계산할 수 없는 규칙은 건너뛰며 {@code rulesEvaluated} 에 포함하지 않습니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class AlertEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AlertEvaluator.class);

    private final List<AlertRule> rules;

    public AlertEvaluator() {
        this(AlertRule.DEFAULT_RULES);
    }

    /**
     * 생성자.
     *
     * @param rules 평가할 규칙
     * @throws IllegalArgumentException rules가 null인 경우
     */
    public AlertEvaluator(List<AlertRule> rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        this.rules = List.copyOf(rules);
    }

    public List<AlertRule> rules() {
        return rules;
    }

    /**
     * 규칙 평가.
     *
     * @param preflightResult Layer 3 결과 (nullable)
     * @param runtimeSummary Layer 4 요약 (nullable)
     * @param postexecReport Layer 5 보고서 (nullable)
     * @return 평가 결과
     */
    public AlertEvaluationResult evaluate(PreflightResult preflightResult, WorkflowRunSummary runtimeSummary,
                                          PostExecutionReport postexecReport) {
        Map<AlertMetric, Double> metrics = extractMetrics(preflightResult, runtimeSummary, postexecReport);

        List<AlertEvent> events = new ArrayList<>();
        int firingCount = 0;
        for (AlertRule rule : rules) {
            Double actual = metrics.get(rule.metric());
            if (actual == null) {
                continue;
            }
            boolean firing = rule.operator().test(actual, rule.threshold());
            String message = firing
                ? rule.description() + ": " + rule.metric().value() + "=" + actual + " "
                    + rule.operator().symbol() + " " + rule.threshold()
                : "";
            events.add(new AlertEvent(rule.ruleId(), firing, rule.severity(), rule.metric(), actual,
                rule.threshold(), rule.operator(), message));
            if (firing) {
                firingCount++;
            }
        }

        if (firingCount > 0) {
            log.warn("Alert evaluation: {}/{} rules firing", firingCount, events.size());
        }
        return new AlertEvaluationResult(events, events.size(), firingCount);
    }

    private static Map<AlertMetric, Double> extractMetrics(PreflightResult preflight, WorkflowRunSummary summary,
                                                           PostExecutionReport report) {
        Map<AlertMetric, Double> metrics = new EnumMap<>(AlertMetric.class);
        if (report != null) {
            metrics.put(AlertMetric.COMPLETENESS_PCT, report.completenessPct());
            metrics.put(AlertMetric.CHAINS_BROKEN, (double) report.chainsBroken());
            metrics.put(AlertMetric.CHAINS_DEGRADED, (double) report.chainsDegraded());
        }
        if (summary != null) {
            metrics.put(AlertMetric.BLOCKING_FAILURES, (double) summary.totalBlockingFailures());
            metrics.put(AlertMetric.DEFAULTS_APPLIED, (double) summary.totalDefaultsApplied());
            metrics.put(AlertMetric.FAILED_PHASES, (double) summary.failedPhases());
        }
        if (preflight != null) {
            metrics.put(AlertMetric.PREFLIGHT_VIOLATIONS, (double) preflight.criticalViolations().size());
            metrics.put(AlertMetric.PREFLIGHT_WARNINGS, (double) preflight.warnings().size());
        }
        return metrics;
    }
}
