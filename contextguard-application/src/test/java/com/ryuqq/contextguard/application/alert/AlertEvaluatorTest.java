package com.ryuqq.contextguard.application.alert;

import com.ryuqq.contextguard.application.postexec.PostExecutionReport;
import com.ryuqq.contextguard.application.preflight.PreflightResult;
import com.ryuqq.contextguard.application.runtime.EnforcementMode;
import com.ryuqq.contextguard.application.runtime.WorkflowRunSummary;
import com.ryuqq.contextguard.core.model.ConstraintSeverity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AlertEvaluator 테스트.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
class AlertEvaluatorTest {

    private final AlertEvaluator evaluator = new AlertEvaluator();

    @Test
    void evaluate_NoInputs_NoRulesEvaluated() {
        // When
        AlertEvaluationResult result = evaluator.evaluate(null, null, null);

        // Then
        assertThat(result.rulesEvaluated()).isZero();
        assertThat(result.hasFiringAlerts()).isFalse();
    }

    @Test
    void evaluate_LowCompleteness_CriticalAndWarningFire() {
        // Given
        PostExecutionReport report = PostExecutionReport.ofCounts(5, 2, 0, 3, 40.0);

        // When
        AlertEvaluationResult result = evaluator.evaluate(null, null, report);

        // Then
        assertThat(result.rulesEvaluated()).isEqualTo(2);
        assertThat(result.alertsFiring()).isEqualTo(2);
        assertThat(result.criticalAlerts()).singleElement().satisfies(event -> {
            assertThat(event.ruleId()).isEqualTo("propagation.completeness.critical");
            assertThat(event.message()).isEqualTo(
                "Propagation chain completeness below critical threshold: completeness_pct=40.0 < 50.0");
        });
        assertThat(result.warningAlerts()).hasSize(1);
    }

    @Test
    void evaluate_HealthyRun_NothingFires() {
        // Given
        PostExecutionReport report = PostExecutionReport.ofCounts(2, 2, 0, 0, 100.0);
        WorkflowRunSummary summary = WorkflowRunSummary.of(EnforcementMode.STRICT, List.of());
        PreflightResult preflight = PreflightResult.of(List.of(), List.of(), List.of(), 3);

        // When
        AlertEvaluationResult result = evaluator.evaluate(preflight, summary, report);

        // Then
        assertThat(result.rulesEvaluated()).isEqualTo(5);
        assertThat(result.alertsFiring()).isZero();
        assertThat(result.events()).allMatch(event -> event.message().isEmpty());
    }

    @Test
    void evaluate_CustomRule_UsesGivenOperator() {
        // Given
        AlertEvaluator custom = new AlertEvaluator(List.of(
            new AlertRule("chains.degraded", "Degraded chains present", null,
                AlertMetric.CHAINS_DEGRADED, AlertOperator.GTE, 1.0)));

        // When
        AlertEvaluationResult result = custom.evaluate(null, null, PostExecutionReport.ofCounts(2, 1, 1, 0, 50.0));

        // Then
        assertThat(result.events()).singleElement().satisfies(event -> {
            assertThat(event.firing()).isTrue();
            assertThat(event.severity()).isEqualTo(ConstraintSeverity.WARNING);
            assertThat(event.message()).isEqualTo("Degraded chains present: chains_degraded=1.0 >= 1.0");
        });
    }

    @ParameterizedTest
    @CsvSource({
        "lt, 1.0, 2.0, true",
        "gt, 1.0, 2.0, false",
        "lte, 2.0, 2.0, true",
        "GTE, 1.0, 2.0, false",
        "eq, 2.0, 2.0, true"
    })
    void operator_FromValue_Compares(String value, double actual, double threshold, boolean expected) {
        // When & Then
        assertThat(AlertOperator.fromValue(value).test(actual, threshold)).isEqualTo(expected);
    }

    @Test
    void operator_UnknownValue_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> AlertOperator.fromValue("ne"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown operator");
    }
}
