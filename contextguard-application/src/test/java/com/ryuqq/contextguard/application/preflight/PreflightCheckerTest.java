package com.ryuqq.contextguard.application.preflight;

import com.ryuqq.contextguard.application.SampleContracts;
import com.ryuqq.contextguard.core.model.ConstraintSeverity;
import com.ryuqq.contextguard.core.model.ContextContract;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PreflightChecker 테스트.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
class PreflightCheckerTest {

    private final PreflightChecker checker = new PreflightChecker();
    private final ContextContract contract = SampleContracts.pipeline();

    // ============================================================
    // Field readiness
    // ============================================================

    @Test
    void check_SeededContext_Passes() {
        // When
        PreflightResult result = checker.check(contract, SampleContracts.seedContext());

        // Then
        assertThat(result.passed()).isTrue();
        assertThat(result.criticalViolations()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.phasesChecked()).isEqualTo(3);
        assertThat(result.fieldsChecked()).isEqualTo(5);
        assertThat(result.fieldReadinessDetails()).allMatch(FieldReadinessDetail::ready);
    }

    @Test
    void check_EmptyContext_BlockingFieldsNotReady() {
        // When
        PreflightResult result = checker.check(contract, Map.of());

        // Then
        assertThat(result.passed()).isFalse();
        assertThat(result.criticalViolations()).hasSize(4);
        assertThat(result.criticalViolations())
            .extracting(PreflightViolation::message)
            .contains("Field 'domain' required by phase 'plan' is not ready (missing from initial context)");
        assertThat(result.warnings())
            .singleElement()
            .satisfies(v -> {
                assertThat(v.checkType()).isEqualTo(PreflightCheckType.SEED_ENRICHMENT);
                assertThat(v.message()).isEqualTo("Enrichment field 'language' for phase 'plan' has default/missing value");
            });
    }

    @Test
    void check_SentinelValue_ReportsDefaultValue() {
        // Given
        Map<String, Object> initial = Map.of("domain", "unknown", "language", "java");

        // When
        PreflightResult result = checker.check(contract, initial);

        // Then
        assertThat(result.passed()).isFalse();
        assertThat(result.criticalViolations())
            .extracting(PreflightViolation::message)
            .containsExactly(
                "Field 'domain' required by phase 'plan' is not ready (has default value: 'unknown')",
                "Field 'domain' required by phase 'implement' is not ready (has default value: 'unknown')");
        assertThat(result.phaseGraphIssues())
            .noneMatch(issue -> issue.issueType() == PhaseGraphIssueType.DANGLING_READ);
    }

    @Test
    void check_FieldProducedByEarlierPhase_IsReady() {
        // When
        PreflightResult result = checker.checkFieldReadiness(contract, SampleContracts.seedContext(), null);

        // Then
        assertThat(result.fieldReadinessDetails())
            .filteredOn(d -> d.field().equals("plan_summary"))
            .singleElement()
            .satisfies(d -> {
                assertThat(d.ready()).isTrue();
                assertThat(d.hasValue()).isFalse();
            });
    }

    @Test
    void check_CustomPhaseOrder_ProducerRunsTooLate() {
        // When
        PreflightResult result = checker.check(contract, SampleContracts.seedContext(),
            List.of(SampleContracts.IMPLEMENT, SampleContracts.PLAN, SampleContracts.VERIFY));

        // Then
        assertThat(result.passed()).isTrue();
        assertThat(result.warnings())
            .extracting(PreflightViolation::checkType)
            .containsExactly(PreflightCheckType.FIELD_READINESS, PreflightCheckType.PHASE_GRAPH);
        assertThat(result.warnings()).allMatch(v -> v.field().equals("plan_summary"));
    }

    @Test
    void check_DoesNotMutateInput() {
        // Given
        Map<String, Object> initial = new HashMap<>(Map.of("domain", "web"));

        // When
        checker.check(contract, initial);

        // Then
        assertThat(initial).containsOnlyKeys("domain");
    }

    @Test
    void check_NullContract_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> checker.check(null, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("contract cannot be null");
    }

    // ============================================================
    // Phase graph
    // ============================================================

    @Test
    void checkPhaseGraph_MissingSeed_DanglingReadsUseFieldSeverity() {
        // When
        PreflightResult result = checker.checkPhaseGraph(contract, Map.of(), null);

        // Then
        assertThat(result.phaseGraphIssues())
            .filteredOn(issue -> issue.issueType() == PhaseGraphIssueType.DANGLING_READ)
            .extracting(PhaseGraphIssue::phase)
            .containsExactly("plan", "implement");
        assertThat(result.criticalViolations()).hasSize(2);
        assertThat(result.criticalViolations().get(0).message())
            .isEqualTo("Phase 'plan' requires 'domain' but no earlier phase produces it and it's not in the initial context");
    }

    @Test
    void checkPhaseGraph_UnconsumedOutput_DeadWriteAdvisory() {
        // When
        PreflightResult result = checker.checkPhaseGraph(contract, SampleContracts.seedContext(), null);

        // Then
        assertThat(result.passed()).isTrue();
        assertThat(result.advisories())
            .singleElement()
            .satisfies(v -> {
                assertThat(v.severity()).isEqualTo(ConstraintSeverity.ADVISORY);
                assertThat(v.message()).isEqualTo("Phase 'verify' produces 'verdict' but no phase requires it");
            });
    }
}
