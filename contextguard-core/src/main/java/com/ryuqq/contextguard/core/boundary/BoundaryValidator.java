package com.ryuqq.contextguard.core.boundary;

import com.ryuqq.contextguard.core.context.ExecutionContext;
import com.ryuqq.contextguard.core.context.FieldLookup;
import com.ryuqq.contextguard.core.model.ConstraintSeverity;
import com.ryuqq.contextguard.core.model.ContextContract;
import com.ryuqq.contextguard.core.model.FieldSpec;
import com.ryuqq.contextguard.core.model.PhaseContract;
import com.ryuqq.contextguard.core.model.PropagationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Phase 경계 검증기.
 *
 * <p>컨텍스트가 계약의 entry/exit/enrichment 요구사항을 만족하는지 검증합니다.
 * Runtime Guard(Layer 4)와 Post-Execution Validator(Layer 5)가 공유합니다.</p>
 *
 * <p><strong>필드 판정 규칙 (값이 없거나 null인 경우):</strong></p>
 * <ul>
 *   <li>BLOCKING: FAILED (기본값이 선언되어 있어도 적용하지 않음)</li>
 *   <li>WARNING + 기본값 선언: 컨텍스트에 기본값 기록, DEFAULTED</li>
 *   <li>WARNING + 기본값 없음: DEFAULTED</li>
 *   <li>ADVISORY: PARTIAL (기본값이 선언되어 있어도 기록하지 않음)</li>
 * </ul>
 *
 * <p>결과 상태: BLOCKING 실패가 있으면 FAILED, 경고가 있으면 PARTIAL, 그 외 PROPAGATED.</p>
 *
 * <p>계약에 없는 Phase는 필드 없이 통과합니다.</p>
 *
 * <p><strong>Stateless:</strong> 인스턴스 간 상태 공유 없음 (thread-safe).
 * 단, 기본값 적용 시 전달된 컨텍스트를 변경합니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class BoundaryValidator {

    private static final Logger log = LoggerFactory.getLogger(BoundaryValidator.class);

    /**
     * entry.required 검증.
     *
     * @param phase Phase 이름
     * @param context 실행 컨텍스트
     * @param contract 계약
     * @return 검증 결과
     */
    public ContractValidationResult validateEntry(String phase, ExecutionContext context, ContextContract contract) {
        return validate(phase, BoundaryDirection.ENTRY, context, contract);
    }

    /**
     * exit.required 검증.
     *
     * @param phase Phase 이름
     * @param context 실행 컨텍스트 (Phase 실행 후)
     * @param contract 계약
     * @return 검증 결과
     */
    public ContractValidationResult validateExit(String phase, ExecutionContext context, ContextContract contract) {
        return validate(phase, BoundaryDirection.EXIT, context, contract);
    }

    /**
     * entry.enrichment 검증.
     *
     * @param phase Phase 이름
     * @param context 실행 컨텍스트
     * @param contract 계약
     * @return 검증 결과
     */
    public ContractValidationResult validateEnrichment(String phase, ExecutionContext context, ContextContract contract) {
        return validate(phase, BoundaryDirection.ENRICHMENT, context, contract);
    }

    /**
     * 방향에 따른 경계 검증.
     *
     * @param phase Phase 이름
     * @param direction 경계 방향
     * @param context 실행 컨텍스트
     * @param contract 계약
     * @return 검증 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ContractValidationResult validate(String phase, BoundaryDirection direction,
                                             ExecutionContext context, ContextContract contract) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }

        Optional<PhaseContract> phaseContract = contract.phase(phase);
        if (phaseContract.isEmpty()) {
            return ContractValidationResult.empty(phase, direction);
        }
        return validateFields(phase, direction, fieldsOf(phaseContract.get(), direction), context);
    }

    private static List<FieldSpec> fieldsOf(PhaseContract phaseContract, BoundaryDirection direction) {
        switch (direction) {
            case ENTRY:
                return phaseContract.entry().required();
            case ENRICHMENT:
                return phaseContract.entry().enrichment();
            case EXIT:
                return phaseContract.exit().required();
            default:
                throw new IllegalStateException("Unknown direction: " + direction);
        }
    }

    private ContractValidationResult validateFields(String phase, BoundaryDirection direction,
                                                    List<FieldSpec> fields, ExecutionContext context) {
        List<FieldValidationResult> fieldResults = new ArrayList<>(fields.size());
        List<String> blockingFailures = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (FieldSpec spec : fields) {
            FieldValidationResult result = validateField(spec, context);
            fieldResults.add(result);

            if (result.status() == PropagationStatus.FAILED) {
                blockingFailures.add(result.field());
            } else if (result.status() != PropagationStatus.PROPAGATED) {
                warnings.add(result.field() + ": " + result.message());
            }
        }

        boolean passed = blockingFailures.isEmpty();
        if (!passed) {
            log.warn("Boundary validation failed: phase={} direction={} blocking={}",
                phase, direction.value(), blockingFailures);
        } else if (!warnings.isEmpty()) {
            log.info("Boundary validation passed with warnings: phase={} direction={} warnings={}",
                phase, direction.value(), warnings.size());
        }

        return new ContractValidationResult(passed, phase, direction, fieldResults, blockingFailures,
            warnings, overallStatus(blockingFailures, warnings));
    }

    private static PropagationStatus overallStatus(List<String> blockingFailures, List<String> warnings) {
        if (!blockingFailures.isEmpty()) {
            return PropagationStatus.FAILED;
        }
        return warnings.isEmpty() ? PropagationStatus.PROPAGATED : PropagationStatus.PARTIAL;
    }

    private FieldValidationResult validateField(FieldSpec spec, ExecutionContext context) {
        FieldLookup lookup = context.lookup(spec.name());
        if (lookup.hasValue()) {
            return new FieldValidationResult(spec.name(), PropagationStatus.PROPAGATED, spec.severity(), "", false);
        }

        if (spec.severity() == ConstraintSeverity.BLOCKING) {
            return new FieldValidationResult(spec.name(), PropagationStatus.FAILED, spec.severity(),
                "Required field '" + spec.name() + "' is missing", false);
        }

        if (spec.severity() == ConstraintSeverity.WARNING) {
            if (spec.hasDefault()) {
                context.set(spec.name(), spec.defaultValue());
                return new FieldValidationResult(spec.name(), PropagationStatus.DEFAULTED, spec.severity(),
                    "Field '" + spec.name() + "' defaulted to " + describe(spec.defaultValue()), true);
            }
            return new FieldValidationResult(spec.name(), PropagationStatus.DEFAULTED, spec.severity(),
                "Field '" + spec.name() + "' is missing (no default)", false);
        }

        return new FieldValidationResult(spec.name(), PropagationStatus.PARTIAL, spec.severity(),
            "Advisory: field '" + spec.name() + "' is absent", false);
    }

    private static String describe(Object value) {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
