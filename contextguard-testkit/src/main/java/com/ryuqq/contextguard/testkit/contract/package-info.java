/**
 * Contract test support.
 *
 * <p>{@link com.ryuqq.contextguard.testkit.contract.AbstractContractTest} gives each test fresh engine
 * components and report assertions. {@link com.ryuqq.contextguard.testkit.contract.ContractFixtures}
 * supplies contracts and contexts, including a four-phase pipeline loaded from YAML.</p>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.testkit.contract;
