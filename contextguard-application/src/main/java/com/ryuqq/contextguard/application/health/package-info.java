/**
 * Propagation health scoring (Layer 6).
 *
 * <p>{@link com.ryuqq.contextguard.application.health.HealthScorer} folds pre-flight, runtime and
 * post-execution outputs into one weighted score in [0, 100]. Missing inputs count as perfect.</p>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.application.health;
