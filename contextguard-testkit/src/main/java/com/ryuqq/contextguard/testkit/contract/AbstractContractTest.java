package com.ryuqq.contextguard.testkit.contract;

import com.ryuqq.contextguard.adapter.yaml.YamlContractLoader;
import com.ryuqq.contextguard.application.alert.AlertEvaluator;
import com.ryuqq.contextguard.application.health.HealthScore;
import com.ryuqq.contextguard.application.health.HealthScorer;
import com.ryuqq.contextguard.application.postexec.PostExecutionReport;
import com.ryuqq.contextguard.application.postexec.PostExecutionValidator;
import com.ryuqq.contextguard.application.preflight.PreflightChecker;
import com.ryuqq.contextguard.application.preflight.PreflightResult;
import com.ryuqq.contextguard.application.regression.ContractDriftDetector;
import com.ryuqq.contextguard.application.regression.GateCheck;
import com.ryuqq.contextguard.application.regression.GateResult;
import com.ryuqq.contextguard.application.regression.RegressionGate;
import com.ryuqq.contextguard.application.runtime.EnforcementMode;
import com.ryuqq.contextguard.application.runtime.RuntimeBoundaryGuard;
import com.ryuqq.contextguard.application.runtime.WorkflowRunSummary;
import com.ryuqq.contextguard.core.chain.PropagationChainResult;
import com.ryuqq.contextguard.core.model.ChainStatus;
import com.ryuqq.contextguard.core.model.ContextContract;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Abstract base class for contract tests.
 *
 * <p>Provides fresh engine components per test and assertion helpers for the
 * reports they produce.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>PreflightChecker, PostExecutionValidator: static and post-run analysis</li>
 *   <li>HealthScorer, AlertEvaluator: scoring with default weights and rules</li>
 *   <li>ContractDriftDetector, RegressionGate: regression prevention with default thresholds</li>
 *   <li>YamlContractLoader: contract files (cache cleared after each test)</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyPipelineContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void pipelineKeepsDomain() {
 *         ContextContract contract = ContractFixtures.sdlcContract();
 *         Map&lt;String, Object&gt; context = context();
 *
 *         WorkflowRunSummary summary = runPipeline(contract, EnforcementMode.PERMISSIVE, context,
 *             Map.of("seed", ctx -&gt; ctx.put("domain", "web_app")));
 *
 *         assertChainStatus(postExecutionValidator.validate(contract, context),
 *             "domain_seed_to_plan", ChainStatus.INTACT);
 *     }
 * }
 * </pre>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected PreflightChecker preflightChecker;
    protected PostExecutionValidator postExecutionValidator;
    protected HealthScorer healthScorer;
    protected AlertEvaluator alertEvaluator;
    protected ContractDriftDetector driftDetector;
    protected RegressionGate regressionGate;
    protected YamlContractLoader contractLoader;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh instances of all engine components.</p>
     */
    @BeforeEach
    void setUp() {
        preflightChecker = new PreflightChecker();
        postExecutionValidator = new PostExecutionValidator();
        healthScorer = new HealthScorer();
        alertEvaluator = new AlertEvaluator();
        driftDetector = new ContractDriftDetector();
        regressionGate = new RegressionGate();
        contractLoader = new YamlContractLoader();
    }

    /**
     * Cleans up test fixtures after each test.
     */
    @AfterEach
    void tearDown() {
        if (contractLoader != null) {
            contractLoader.clearCache();
        }
    }

    /**
     * Creates a mutable context from alternating keys and values.
     *
     * @param keyValues key1, value1, key2, value2, ...
     * @return mutable context
     */
    protected Map<String, Object> context(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        Map<String, Object> context = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            context.put((String) keyValues[i], keyValues[i + 1]);
        }
        return context;
    }

    /**
     * Runs every phase of the contract in declaration order under a new guard.
     *
     * <p>A phase without a body only has its boundaries validated.</p>
     *
     * @param contract the contract
     * @param mode the enforcement mode
     * @param context the shared mutable context
     * @param bodies phase name to phase body
     * @return the runtime summary
     */
    protected WorkflowRunSummary runPipeline(ContextContract contract, EnforcementMode mode,
                                             Map<String, Object> context,
                                             Map<String, Consumer<Map<String, Object>>> bodies) {
        RuntimeBoundaryGuard guard = new RuntimeBoundaryGuard(contract, mode);
        for (String phase : contract.phaseOrder()) {
            Consumer<Map<String, Object>> body = bodies.get(phase);
            guard.runPhase(phase, context, () -> {
                if (body != null) {
                    body.accept(context);
                }
            });
        }
        return guard.summarize();
    }

    /**
     * Asserts that pre-flight found no BLOCKING violation.
     *
     * @param result the pre-flight result
     */
    protected void assertPreflightPassed(PreflightResult result) {
        assertTrue(result.passed(),
            String.format("Expected pre-flight to pass but found critical violations: %s",
                result.criticalViolations()));
    }

    /**
     * Asserts the status of one chain in the report.
     *
     * @param report the post-execution report
     * @param chainId the chain ID
     * @param expected the expected status
     */
    protected void assertChainStatus(PostExecutionReport report, String chainId, ChainStatus expected) {
        for (PropagationChainResult result : report.chainResults()) {
            if (result.chainId().equals(chainId)) {
                assertEquals(expected, result.status(),
                    String.format("Expected chain %s to be %s but was %s (%s)",
                        chainId, expected, result.status(), result.message()));
                return;
            }
        }
        fail("No result for chain: " + chainId);
    }

    /**
     * Asserts that the chain counts add up and {@code passed} follows from them.
     *
     * @param report the post-execution report
     */
    protected void assertReportConsistent(PostExecutionReport report) {
        assertEquals(report.chainsTotal(),
            report.chainsIntact() + report.chainsDegraded() + report.chainsBroken(),
            "Chain counts do not add up");
        boolean finalExitPassed = report.finalExit().map(exit -> exit.passed()).orElse(true);
        assertEquals(report.chainsBroken() == 0 && finalExitPassed, report.passed(),
            "passed does not follow from broken chains and final exit");
    }

    /**
     * Asserts that the health score and its components are within [0, 100].
     *
     * @param score the health score
     */
    protected void assertHealthInRange(HealthScore score) {
        assertTrue(score.overall() >= 0.0 && score.overall() <= 100.0,
            "Health score out of range: " + score.overall());
    }

    /**
     * Asserts that the gate passed.
     *
     * @param result the gate result
     */
    protected void assertGatePassed(GateResult result) {
        assertTrue(result.passed(), String.format("Expected gate to pass but failed: %s", result.failures()));
    }

    /**
     * Asserts that the given gate check ran and failed.
     *
     * @param result the gate result
     * @param checkId the check ID
     * @return the failed check
     */
    protected GateCheck assertGateCheckFailed(GateResult result, String checkId) {
        GateCheck check = result.check(checkId)
            .orElseThrow(() -> new AssertionError("Gate check not run: " + checkId));
        assertFalse(check.passed(), String.format("Expected %s to fail: %s", checkId, check.message()));
        return check;
    }
}
