package com.ryuqq.contextguard.testkit.contract;

import com.ryuqq.contextguard.application.postexec.PostExecutionReport;
import com.ryuqq.contextguard.core.model.ChainStatus;
import com.ryuqq.contextguard.core.model.ContextContract;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: end-to-end propagation completeness.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>single intact chain → 100.0 completeness</li>
 *   <li>source field absent → chain broken, report fails</li>
 *   <li>no chains → 0.0 completeness</li>
 *   <li>repeated validation → identical reports</li>
 * </ul>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
class PropagationCompletenessContractTest extends AbstractContractTest {

    private final ContextContract contract = ContractFixtures.singleChainContract();

    @Test
    void singleChain_AllOutputsPresent_FullyComplete() {
        // When
        PostExecutionReport report = postExecutionValidator.validate(contract,
            ContractFixtures.singleChainFinalContext());

        // Then
        assertThat(report.chainsIntact()).isEqualTo(1);
        assertThat(report.completenessPct()).isEqualTo(100.0);
        assertThat(report.passed()).isTrue();
        assertReportConsistent(report);
    }

    @Test
    void singleChain_DomainAbsent_Broken() {
        // Given
        Map<String, Object> finalContext = ContractFixtures.singleChainFinalContext();
        finalContext.remove("domain");

        // When
        PostExecutionReport report = postExecutionValidator.validate(contract, finalContext);

        // Then
        assertThat(report.chainsBroken()).isEqualTo(1);
        assertThat(report.passed()).isFalse();
        assertChainStatus(report, ContractFixtures.SINGLE_CHAIN_ID, ChainStatus.BROKEN);
        assertReportConsistent(report);
    }

    @Test
    void noChains_CompletenessIsZero() {
        // When
        PostExecutionReport report = postExecutionValidator.validate(ContractFixtures.noChainContract(),
            ContractFixtures.singleChainFinalContext());

        // Then
        assertThat(report.chainsTotal()).isZero();
        assertThat(report.completenessPct()).isEqualTo(0.0);
        assertReportConsistent(report);
    }

    @Test
    void validate_Twice_IdenticalReports() {
        // Given
        Map<String, Object> finalContext = context("domain", "unknown", "plan_output", "p");

        // When
        PostExecutionReport first = postExecutionValidator.validate(contract, finalContext);
        PostExecutionReport second = postExecutionValidator.validate(contract, finalContext);

        // Then
        assertThat(second).isEqualTo(first);
        assertReportConsistent(first);
    }
}
