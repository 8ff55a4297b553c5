/**
 * Runtime boundary enforcement (Layer 4).
 *
 * <p>{@link com.ryuqq.contextguard.application.runtime.RuntimeBoundaryGuard} validates each
 * phase's entry and exit against the contract while the pipeline runs, and records every check.</p>
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li>STRICT: blocking failures raise {@link com.ryuqq.contextguard.application.runtime.BoundaryViolationException}</li>
 *   <li>PERMISSIVE: blocking failures are recorded and logged at WARN</li>
 *   <li>AUDIT: blocking failures are recorded and logged at INFO</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>A guard is single-threaded. Use one guard per concurrent execution lineage.</p>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.application.runtime;
