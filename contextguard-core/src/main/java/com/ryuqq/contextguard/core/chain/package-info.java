/**
 * End-to-end propagation chain integrity.
 *
 * <p>{@link com.ryuqq.contextguard.core.chain.PropagationChainChecker} classifies each declared
 * chain as INTACT, DEGRADED or BROKEN against a final context.</p>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.core.chain;
