package com.ryuqq.contextguard.testkit.contract;

import com.ryuqq.contextguard.application.health.HealthScore;
import com.ryuqq.contextguard.application.regression.DriftReport;
import com.ryuqq.contextguard.application.regression.GateCheck;
import com.ryuqq.contextguard.application.regression.GateResult;
import com.ryuqq.contextguard.core.model.ContextContract;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: regression gate defaults and drift accounting.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
class RegressionGateContractTest extends AbstractContractTest {

    @Test
    void gate_NoInputs_Passes() {
        // When
        GateResult result = regressionGate.check();

        // Then
        assertGatePassed(result);
        assertThat(result.totalChecks()).isZero();
    }

    @Test
    void gate_HealthNinetyToEighty_HealthRegressionFails() {
        // When
        GateResult result = regressionGate.check(null, null, HealthScore.ofOverall(90.0),
            HealthScore.ofOverall(80.0), null);

        // Then
        GateCheck check = assertGateCheckFailed(result, GateCheck.HEALTH_REGRESSION);
        assertThat(check.message()).contains("dropped by 10.0");
    }

    @Test
    void drift_SameContract_NoChanges() {
        // When
        DriftReport report = driftDetector.compare(ContractFixtures.sdlcContract(), ContractFixtures.sdlcContract());

        // Then
        assertThat(report.totalChanges()).isZero();
    }

    @Test
    void drift_ChainsDropped_CountsAddUpAndGateFails() {
        // Given
        ContextContract contract = ContractFixtures.sdlcContract();
        ContextContract withoutChains = new ContextContract(contract.schemaVersion(), contract.pipelineId(),
            contract.description(), contract.phases(), List.of());

        // When
        DriftReport report = driftDetector.compare(contract, withoutChains);
        GateResult result = regressionGate.check(null, null, null, null, report);

        // Then
        assertThat(report.totalChanges())
            .isEqualTo(report.breakingCount() + report.nonBreakingCount())
            .isEqualTo(report.changes().size())
            .isEqualTo(2);
        assertThat(assertGateCheckFailed(result, GateCheck.CONTRACT_DRIFT).message()).isEqualTo(
            "2 breaking contract changes: "
                + "Propagation chain 'domain_seed_to_plan' removed (end-to-end verification lost); "
                + "Propagation chain 'plan_output_to_verify' removed (end-to-end verification lost)");
    }
}
