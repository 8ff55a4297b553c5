/**
 * Closed grammar for propagation chain verification expressions.
 *
 * <p>Only equality, inequality, presence ({@code is None} / truthiness) and boolean
 * connectives over {@code source}, {@code dest} and {@code context.<path>} are supported.
 * No general-purpose evaluator is embedded.</p>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.core.verification;
