/**
 * Field-level boundary validation shared by the runtime guard and post-execution layers.
 *
 * <ul>
 *   <li>{@link com.ryuqq.contextguard.core.boundary.BoundaryValidator} - Validates entry, exit and enrichment fields</li>
 *   <li>{@link com.ryuqq.contextguard.core.boundary.ContractValidationResult} - Aggregated result for one boundary</li>
 *   <li>{@link com.ryuqq.contextguard.core.boundary.FieldValidationResult} - Result for one field</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.core.boundary;
