/**
 * YAML contract loading adapter.
 *
 * <h2>Main Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.contextguard.adapter.yaml.YamlContractLoader}: reads contract files with
 *       Jackson's YAML data format and converts them into {@link com.ryuqq.contextguard.core.model.ContextContract}</li>
 *   <li>{@link com.ryuqq.contextguard.adapter.yaml.ContractLoadException}: every authoring error
 *       (unknown key, missing key, bad severity, unparsable verification)</li>
 * </ul>
 *
 * <h2>File Layout</h2>
 * <pre>
 * schema_version: "1.0"
 * pipeline_id: sdlc
 * phases:
 *   plan:
 *     entry:
 *       required:
 *         - name: domain
 *           severity: blocking
 *       enrichment:
 *         - name: language
 *           severity: warning
 *           default: python
 *     exit:
 *       required:
 *         - name: plan_summary
 * propagation_chains:
 *   - chain_id: domain_flow
 *     source: { phase: plan, field: domain }
 *     destination: { phase: implement, field: domain }
 *     verification: "source == dest"
 * </pre>
 *
 * @since 1.0.0
 * @author ContextGuard Team
 */
package com.ryuqq.contextguard.adapter.yaml;
