/**
 * Jackson-bound documents mirroring the YAML contract file layout.
 *
 * <p>These records carry raw, unvalidated values. Conversion into the
 * {@link com.ryuqq.contextguard.core.model} types happens in
 * {@code ContractDocumentMapper}.</p>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.adapter.yaml.document;
