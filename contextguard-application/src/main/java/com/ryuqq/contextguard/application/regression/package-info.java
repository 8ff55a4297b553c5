/**
 * Regression prevention (Layer 7).
 *
 * <h2>Contract drift</h2>
 * <p>{@link com.ryuqq.contextguard.application.regression.ContractDriftDetector} diffs two contract
 * versions and flags breaking changes.</p>
 *
 * <h2>Regression gate</h2>
 * <p>{@link com.ryuqq.contextguard.application.regression.RegressionGate} compares two runs' reports and
 * health scores against {@link com.ryuqq.contextguard.application.regression.GateThresholds}.
 * Failures are returned as failed checks, never thrown.</p>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.application.regression;
