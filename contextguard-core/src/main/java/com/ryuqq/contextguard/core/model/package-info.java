/**
 * Context propagation contract model.
 *
 * <p>This package defines the declarative, immutable schema that every validation
 * layer reads:</p>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.contextguard.core.model.ContextContract} - Root contract (phases + propagation chains)</li>
 *   <li>{@link com.ryuqq.contextguard.core.model.PhaseContract} - Entry and exit boundary of one phase</li>
 *   <li>{@link com.ryuqq.contextguard.core.model.FieldSpec} - A single dot-path field with severity and default</li>
 *   <li>{@link com.ryuqq.contextguard.core.model.PropagationChainSpec} - End-to-end source → destination declaration</li>
 * </ul>
 *
 * <h2>Enums</h2>
 * <ul>
 *   <li>{@link com.ryuqq.contextguard.core.model.ConstraintSeverity} - BLOCKING / WARNING / ADVISORY</li>
 *   <li>{@link com.ryuqq.contextguard.core.model.PropagationStatus} - Field and boundary status, ordered worst to best</li>
 *   <li>{@link com.ryuqq.contextguard.core.model.ChainStatus} - INTACT / DEGRADED / BROKEN</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Collections are copied on construction</li>
 *   <li><strong>Validation:</strong> Compact constructors enforce invariants</li>
 *   <li><strong>Ordering:</strong> Phase insertion order is the default execution order</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.core.model;
