package com.ryuqq.contextguard.application.preflight;

import com.ryuqq.contextguard.core.context.ExecutionContext;
import com.ryuqq.contextguard.core.context.FieldLookup;
import com.ryuqq.contextguard.core.model.ConstraintSeverity;
import com.ryuqq.contextguard.core.model.ContextContract;
import com.ryuqq.contextguard.core.model.FieldSpec;
import com.ryuqq.contextguard.core.model.PhaseContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pre-flight 검사기 (Layer 3).
 *
 * <p>Phase가 실행되기 전에 초기 컨텍스트와 실행 순서를 계약에 대해 검사합니다.</p>
 *
 * <p><strong>검사 항목:</strong></p>
 * <ol>
 *   <li><strong>Field readiness:</strong> 각 Phase의 entry required 필드가 초기 컨텍스트에
 *       실제 값으로 있거나 앞선 Phase가 산출하는지</li>
 *   <li><strong>Seed enrichment:</strong> enrichment 필드가 초기 컨텍스트에 실제 값으로 있는지
 *       (ADVISORY는 위반 제외)</li>
 *   <li><strong>Phase graph:</strong> dangling read / dead write 탐지</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PreflightResult result = new PreflightChecker().check(contract, initialContext, phaseOrder);
 * if (!result.passed()) {
 *     result.criticalViolations().forEach(v -&gt; log.error("Pre-flight: {}", v.message()));
 * }
 * </pre>
 *
 * <p>Stateless이며 스레드 안전합니다. 초기 컨텍스트는 수정하지 않습니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class PreflightChecker {

    private static final Logger log = LoggerFactory.getLogger(PreflightChecker.class);

    /**
     * 계약의 Phase 순서로 모든 검사 실행.
     *
     * @param contract 계약
     * @param initialContext 초기 컨텍스트
     * @return 검사 결과
     */
    public PreflightResult check(ContextContract contract, Map<String, ?> initialContext) {
        return check(contract, initialContext, null);
    }

    /**
     * 모든 검사 실행.
     *
     * @param contract 계약
     * @param initialContext 초기 컨텍스트
     * @param phaseOrder 실행 순서 (null이면 계약 선언 순서)
     * @return 검사 결과
     * @throws IllegalArgumentException contract 또는 initialContext가 null인 경우
     */
    public PreflightResult check(ContextContract contract, Map<String, ?> initialContext, List<String> phaseOrder) {
        ExecutionContext context = snapshot(contract, initialContext);
        List<String> order = resolveOrder(contract, phaseOrder);

        List<PreflightViolation> violations = new ArrayList<>();
        List<FieldReadinessDetail> details = new ArrayList<>();
        List<PhaseGraphIssue> issues = new ArrayList<>();

        checkFieldReadiness(contract, context, order, violations, details);
        checkSeedEnrichment(contract, context, violations, details);
        checkPhaseGraph(contract, context, order, violations, issues);

        PreflightResult result = PreflightResult.of(violations, details, issues, order.size());
        if (!result.passed()) {
            log.warn("Pre-flight FAILED: {} critical, {} warning, {} advisory",
                result.criticalViolations().size(), result.warnings().size(), result.advisories().size());
        } else if (!violations.isEmpty()) {
            log.info("Pre-flight passed with {} finding(s)", violations.size());
        } else {
            log.debug("Pre-flight passed: {} phases, {} fields", order.size(), details.size());
        }
        return result;
    }

    /**
     * Field readiness 검사만 실행.
     *
     * @param contract 계약
     * @param initialContext 초기 컨텍스트
     * @param phaseOrder 실행 순서 (null이면 계약 선언 순서)
     * @return 검사 결과
     */
    public PreflightResult checkFieldReadiness(ContextContract contract, Map<String, ?> initialContext,
                                               List<String> phaseOrder) {
        ExecutionContext context = snapshot(contract, initialContext);
        List<String> order = resolveOrder(contract, phaseOrder);

        List<PreflightViolation> violations = new ArrayList<>();
        List<FieldReadinessDetail> details = new ArrayList<>();
        checkFieldReadiness(contract, context, order, violations, details);
        return PreflightResult.of(violations, details, List.of(), order.size());
    }

    /**
     * Phase graph 검사만 실행.
     *
     * @param contract 계약
     * @param initialContext 초기 컨텍스트
     * @param phaseOrder 실행 순서 (null이면 계약 선언 순서)
     * @return 검사 결과
     */
    public PreflightResult checkPhaseGraph(ContextContract contract, Map<String, ?> initialContext,
                                           List<String> phaseOrder) {
        ExecutionContext context = snapshot(contract, initialContext);
        List<String> order = resolveOrder(contract, phaseOrder);

        List<PreflightViolation> violations = new ArrayList<>();
        List<PhaseGraphIssue> issues = new ArrayList<>();
        checkPhaseGraph(contract, context, order, violations, issues);
        return PreflightResult.of(violations, List.of(), issues, order.size());
    }

    // ============================================================
    // Field readiness
    // ============================================================

    private void checkFieldReadiness(ContextContract contract, ExecutionContext context, List<String> order,
                                     List<PreflightViolation> violations, List<FieldReadinessDetail> details) {
        Set<String> produced = new HashSet<>();
        for (String phase : order) {
            PhaseContract phaseContract = contract.phases().get(phase);
            if (phaseContract == null) {
                continue;
            }

            for (FieldSpec spec : phaseContract.entry().required()) {
                FieldLookup lookup = context.lookup(spec.name());
                boolean hasValue = lookup.hasValue();
                boolean isDefault = lookup.isDefault();
                boolean ready = !isDefault || produced.contains(spec.name());

                String message = "";
                if (!ready) {
                    message = "Field '" + spec.name() + "' required by phase '" + phase + "' is not ready"
                        + (hasValue
                            ? " (has default value: " + describe(lookup.value()) + ")"
                            : " (missing from initial context)");
                    violations.add(new PreflightViolation(PreflightCheckType.FIELD_READINESS, phase,
                        spec.name(), spec.severity(), message));
                }
                details.add(new FieldReadinessDetail(spec.name(), phase, ready, hasValue, isDefault,
                    spec.severity(), message));
            }

            produced.addAll(phaseContract.exit().producedFieldNames());
        }
    }

    // ============================================================
    // Seed enrichment
    // ============================================================

    private void checkSeedEnrichment(ContextContract contract, ExecutionContext context,
                                     List<PreflightViolation> violations, List<FieldReadinessDetail> details) {
        for (Map.Entry<String, PhaseContract> entry : contract.phases().entrySet()) {
            String phase = entry.getKey();
            for (FieldSpec spec : entry.getValue().entry().enrichment()) {
                FieldLookup lookup = context.lookup(spec.name());
                boolean ready = !lookup.isDefault();

                String message = "";
                if (!ready && spec.severity() != ConstraintSeverity.ADVISORY) {
                    message = "Enrichment field '" + spec.name() + "' for phase '" + phase
                        + "' has default/missing value";
                    violations.add(new PreflightViolation(PreflightCheckType.SEED_ENRICHMENT, phase,
                        spec.name(), spec.severity(), message));
                }
                details.add(new FieldReadinessDetail(spec.name(), phase, ready, lookup.hasValue(),
                    lookup.isDefault(), spec.severity(), message));
            }
        }
    }

    // ============================================================
    // Phase graph
    // ============================================================

    private void checkPhaseGraph(ContextContract contract, ExecutionContext context, List<String> order,
                                 List<PreflightViolation> violations, List<PhaseGraphIssue> issues) {
        Map<String, Set<String>> requires = new LinkedHashMap<>();
        Map<String, Set<String>> produces = new LinkedHashMap<>();
        for (String phase : order) {
            PhaseContract phaseContract = contract.phases().get(phase);
            if (phaseContract == null) {
                continue;
            }
            Set<String> required = new TreeSet<>();
            for (FieldSpec spec : phaseContract.entry().required()) {
                required.add(spec.name());
            }
            requires.put(phase, required);
            produces.put(phase, new TreeSet<>(phaseContract.exit().producedFieldNames()));
        }

        // Dangling reads: presence in the initial context is enough, even with a placeholder value
        Set<String> available = new HashSet<>(context.flattenedKeys());
        for (String phase : order) {
            for (String field : requires.getOrDefault(phase, Set.of())) {
                if (available.contains(field)) {
                    continue;
                }
                String message = "Phase '" + phase + "' requires '" + field
                    + "' but no earlier phase produces it and it's not in the initial context";
                issues.add(new PhaseGraphIssue(PhaseGraphIssueType.DANGLING_READ, phase, field, message));
                violations.add(new PreflightViolation(PreflightCheckType.PHASE_GRAPH, phase, field,
                    requiredSeverity(contract, phase, field), message));
            }
            available.addAll(produces.getOrDefault(phase, Set.of()));
        }

        Set<String> allRequired = new HashSet<>();
        for (Set<String> required : requires.values()) {
            allRequired.addAll(required);
        }
        for (String phase : order) {
            for (String field : produces.getOrDefault(phase, Set.of())) {
                if (allRequired.contains(field)) {
                    continue;
                }
                String message = "Phase '" + phase + "' produces '" + field + "' but no phase requires it";
                issues.add(new PhaseGraphIssue(PhaseGraphIssueType.DEAD_WRITE, phase, field, message));
                violations.add(new PreflightViolation(PreflightCheckType.PHASE_GRAPH, phase, field,
                    ConstraintSeverity.ADVISORY, message));
            }
        }
    }

    private static ConstraintSeverity requiredSeverity(ContextContract contract, String phase, String field) {
        return contract.phase(phase)
            .flatMap(pc -> pc.entry().required().stream().filter(f -> f.name().equals(field)).findFirst())
            .map(FieldSpec::severity)
            .orElse(ConstraintSeverity.WARNING);
    }

    // ============================================================
    // Helpers
    // ============================================================

    private static ExecutionContext snapshot(ContextContract contract, Map<String, ?> initialContext) {
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }
        if (initialContext == null) {
            throw new IllegalArgumentException("initialContext cannot be null");
        }
        return ExecutionContext.copyOf(initialContext);
    }

    private static List<String> resolveOrder(ContextContract contract, List<String> phaseOrder) {
        return phaseOrder == null ? contract.phaseOrder() : List.copyOf(phaseOrder);
    }

    private static String describe(Object value) {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
