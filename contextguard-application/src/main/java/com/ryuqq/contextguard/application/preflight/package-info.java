/**
 * Pre-flight verification (Layer 3).
 *
 * <p>Validates an initial context and intended phase order against a contract before any
 * phase executes.</p>
 *
 * <h2>Checks</h2>
 * <ul>
 *   <li>Field readiness: every entry requirement is seeded or produced by an earlier phase</li>
 *   <li>Seed enrichment: enrichment fields carry real values up front</li>
 *   <li>Phase graph: dangling reads and dead writes</li>
 * </ul>
 *
 * <p>{@code passed} is false iff at least one BLOCKING violation exists.</p>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.application.preflight;
