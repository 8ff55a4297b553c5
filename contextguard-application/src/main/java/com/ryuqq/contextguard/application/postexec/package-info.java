/**
 * Post-execution validation (Layer 5).
 *
 * <p>Re-checks the final context after a run: chain integrity end to end, the last phase's exit
 * requirements, and discrepancies against the runtime guard's records.</p>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.application.postexec;
