package com.ryuqq.contextguard.testkit.contract;

import com.ryuqq.contextguard.application.runtime.BoundaryViolationException;
import com.ryuqq.contextguard.application.runtime.EnforcementMode;
import com.ryuqq.contextguard.application.runtime.RuntimeBoundaryGuard;
import com.ryuqq.contextguard.application.runtime.WorkflowRunSummary;
import com.ryuqq.contextguard.core.boundary.ContractValidationResult;
import com.ryuqq.contextguard.core.model.ContextContract;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test: runtime boundary enforcement per mode.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>STRICT: missing BLOCKING entry field raises</li>
 *   <li>PERMISSIVE: same input returns a failed result naming the field</li>
 *   <li>AUDIT: never raises, failures still summarized</li>
 * </ul>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
class BoundaryEnforcementContractTest extends AbstractContractTest {

    private final ContextContract contract = ContractFixtures.planOnlyContract();

    @Test
    void strict_MissingDomain_Raises() {
        // Given
        RuntimeBoundaryGuard guard = new RuntimeBoundaryGuard(contract, EnforcementMode.STRICT);

        // When & Then
        assertThatThrownBy(() -> guard.enterPhase("plan", context()))
            .isInstanceOf(BoundaryViolationException.class)
            .hasMessageContaining("domain");
    }

    @Test
    void permissive_MissingDomain_ReturnsFailedResult() {
        // Given
        RuntimeBoundaryGuard guard = new RuntimeBoundaryGuard(contract, EnforcementMode.PERMISSIVE);

        // When
        ContractValidationResult result = guard.enterPhase("plan", context());

        // Then
        assertThat(result.passed()).isFalse();
        assertThat(result.blockingFailures()).contains("domain");
    }

    @Test
    void strict_MissingPlanOutput_RaisesOnExit() {
        // Given
        RuntimeBoundaryGuard guard = new RuntimeBoundaryGuard(contract, EnforcementMode.STRICT);

        // When & Then
        assertThatThrownBy(() -> guard.runPhase("plan", context("domain", "web_app"), () -> { }))
            .isInstanceOf(BoundaryViolationException.class)
            .hasMessage("Boundary violation in phase 'plan' (exit): blocking fields: [plan_output]");
        assertThat(guard.summarize().failedPhases()).isEqualTo(1);
    }

    @Test
    void audit_BrokenRun_SummarizedWithoutRaising() {
        // When
        WorkflowRunSummary summary = runPipeline(contract, EnforcementMode.AUDIT, context(), Map.of());

        // Then
        assertThat(summary.overallPassed()).isFalse();
        assertThat(summary.totalBlockingFailures()).isEqualTo(2);
    }
}
