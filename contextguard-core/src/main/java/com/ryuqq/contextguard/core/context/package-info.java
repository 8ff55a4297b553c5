/**
 * Mutable execution context with dot-path field access.
 *
 * <ul>
 *   <li>{@link com.ryuqq.contextguard.core.context.ExecutionContext} - Caller-owned nested key/value store</li>
 *   <li>{@link com.ryuqq.contextguard.core.context.FieldLookup} - Absent / null / value distinction</li>
 *   <li>{@link com.ryuqq.contextguard.core.context.DefaultValues} - Placeholder sentinel set</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.core.context;
