/**
 * Threshold alerting over validation results.
 *
 * <p>{@link com.ryuqq.contextguard.application.alert.AlertEvaluator} evaluates
 * {@link com.ryuqq.contextguard.application.alert.AlertRule}s against metrics extracted from
 * pre-flight, runtime and post-execution outputs.</p>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.application.alert;
