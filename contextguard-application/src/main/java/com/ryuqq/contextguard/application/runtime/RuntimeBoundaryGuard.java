package com.ryuqq.contextguard.application.runtime;

import com.ryuqq.contextguard.core.boundary.BoundaryDirection;
import com.ryuqq.contextguard.core.boundary.BoundaryValidator;
import com.ryuqq.contextguard.core.boundary.ContractValidationResult;
import com.ryuqq.contextguard.core.context.ExecutionContext;
import com.ryuqq.contextguard.core.model.ContextContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runtime 경계 가드 (Layer 4).
 *
 * <p>각 Phase의 entry/exit 시점에 컨텍스트를 검증하고, 처리 모드에 따라 위반을 처리하며,
 * 실행 전체의 기록을 수집합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RuntimeBoundaryGuard guard = new RuntimeBoundaryGuard(contract, EnforcementMode.STRICT);
 *
 * // try-with-resources
 * try (PhaseScope scope = guard.phase("implement", context)) {
 *     runImplement(context);
 * }
 *
 * // 함수형
 * guard.runPhase("verify", context, () -&gt; runVerify(context));
 *
 * WorkflowRunSummary summary = guard.summarize();
 * </pre>
 *
 * <p><strong>처리 모드:</strong></p>
 * <ul>
 *   <li>STRICT: entry/exit BLOCKING 실패 시 기록 후 {@link BoundaryViolationException}</li>
 *   <li>PERMISSIVE / AUDIT: 기록만 하고 예외 없음</li>
 *   <li>enrichment 실패는 모든 모드에서 예외 없음</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 내부 동기화가 없습니다.
 * 동시에 실행되는 실행 계보마다 별도의 가드를 사용해야 합니다.</p>
 *
 * <p>컨텍스트 Map은 그대로 감싸서 사용하므로 기본값 적용이 호출자의 Map에 반영됩니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class RuntimeBoundaryGuard {

    private static final Logger log = LoggerFactory.getLogger(RuntimeBoundaryGuard.class);

    private final ContextContract contract;
    private final EnforcementMode mode;
    private final BoundaryValidator validator;
    private final List<PhaseExecutionRecord> records = new ArrayList<>();
    private PhaseExecutionRecord pending;

    /**
     * STRICT 모드 가드 생성.
     *
     * @param contract 계약
     */
    public RuntimeBoundaryGuard(ContextContract contract) {
        this(contract, EnforcementMode.STRICT);
    }

    public RuntimeBoundaryGuard(ContextContract contract, EnforcementMode mode) {
        this(contract, mode, new BoundaryValidator());
    }

    /**
     * 생성자.
     *
     * @param contract 계약
     * @param mode 처리 모드
     * @param validator 경계 검증기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RuntimeBoundaryGuard(ContextContract contract, EnforcementMode mode, BoundaryValidator validator) {
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        this.contract = contract;
        this.mode = mode;
        this.validator = validator;
    }

    public EnforcementMode mode() {
        return mode;
    }

    /**
     * 지금까지의 기록 (복사본).
     *
     * @return Phase 기록 목록
     */
    public List<PhaseExecutionRecord> records() {
        return List.copyOf(records);
    }

    /**
     * Phase entry 검증 (required + enrichment).
     *
     * <p>STRICT 모드에서 entry가 실패하면 entry/enrichment 결과를 담은 기록을 남긴 뒤 예외를 던집니다.</p>
     *
     * @param phase Phase 이름
     * @param context 실행 컨텍스트 (기본값이 기록됨)
     * @return entry 검증 결과
     * @throws BoundaryViolationException STRICT 모드에서 BLOCKING 필드가 없는 경우
     */
    public ContractValidationResult enterPhase(String phase, Map<String, Object> context) {
        ExecutionContext executionContext = wrap(context);
        if (pending != null) {
            log.warn("Phase '{}' entered before '{}' exited; recording '{}' without exit",
                phase, pending.phase(), pending.phase());
            records.add(pending);
        }

        ContractValidationResult entry = validator.validateEntry(phase, executionContext, contract);
        ContractValidationResult enrichment = validator.validateEnrichment(phase, executionContext, contract);
        PhaseExecutionRecord record = new PhaseExecutionRecord(phase, entry, null, enrichment);

        logResult(phase, BoundaryDirection.ENTRY, entry);
        logResult(phase, BoundaryDirection.ENRICHMENT, enrichment);

        if (!entry.passed() && mode == EnforcementMode.STRICT) {
            pending = null;
            records.add(record);
            throw new BoundaryViolationException(phase, BoundaryDirection.ENTRY, entry);
        }
        pending = record;
        return entry;
    }

    /**
     * Phase exit 검증.
     *
     * <p>대응하는 {@link #enterPhase} 가 없으면 exit 결과만 담은 기록을 남깁니다.</p>
     *
     * @param phase Phase 이름
     * @param context 실행 컨텍스트
     * @return exit 검증 결과
     * @throws BoundaryViolationException STRICT 모드에서 BLOCKING 필드가 없는 경우
     */
    public ContractValidationResult exitPhase(String phase, Map<String, Object> context) {
        ContractValidationResult exit = validator.validateExit(phase, wrap(context), contract);

        if (pending != null && pending.phase().equals(phase)) {
            records.add(pending.withExitResult(exit));
            pending = null;
        } else {
            records.add(PhaseExecutionRecord.exitOnly(phase, exit));
        }

        logResult(phase, BoundaryDirection.EXIT, exit);
        if (!exit.passed() && mode == EnforcementMode.STRICT) {
            throw new BoundaryViolationException(phase, BoundaryDirection.EXIT, exit);
        }
        return exit;
    }

    /**
     * Phase 스코프 시작 (try-with-resources 용).
     *
     * @param phase Phase 이름
     * @param context 실행 컨텍스트
     * @return close() 시 exit 검증을 수행하는 스코프
     * @throws BoundaryViolationException STRICT 모드에서 entry가 실패한 경우 (본문 실행 전)
     */
    public PhaseScope phase(String phase, Map<String, Object> context) {
        ContractValidationResult entry = enterPhase(phase, context);
        return new PhaseScope(this, phase, context, entry);
    }

    /**
     * Phase 본문을 entry/exit 검증으로 감싸서 실행.
     *
     * @param phase Phase 이름
     * @param context 실행 컨텍스트
     * @param body Phase 본문
     * @throws BoundaryViolationException STRICT 모드에서 BLOCKING 위반이 있는 경우
     */
    public void runPhase(String phase, Map<String, Object> context, Runnable body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        try (PhaseScope scope = phase(phase, context)) {
            body.run();
        }
    }

    /**
     * 값을 반환하는 Phase 본문을 entry/exit 검증으로 감싸서 실행.
     *
     * @param phase Phase 이름
     * @param context 실행 컨텍스트
     * @param body Phase 본문
     * @param <T> 반환 타입
     * @return 본문 반환값
     * @throws BoundaryViolationException STRICT 모드에서 BLOCKING 위반이 있는 경우
     */
    public <T> T callPhase(String phase, Map<String, Object> context, Supplier<T> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        try (PhaseScope scope = phase(phase, context)) {
            return body.get();
        }
    }

    /**
     * 기록 집계.
     *
     * @return 실행 요약
     */
    public WorkflowRunSummary summarize() {
        WorkflowRunSummary summary = WorkflowRunSummary.of(mode, records);
        log.info("Runtime boundary summary [{}]: {}/{} phases passed, blocking={}, defaults={}, status={}",
            mode.value(), summary.passedPhases(), summary.totalPhases(), summary.totalBlockingFailures(),
            summary.totalDefaultsApplied(), summary.overallStatus());
        return summary;
    }

    /**
     * 다음 실행을 위해 기록 초기화.
     */
    public void reset() {
        records.clear();
        pending = null;
    }

    private static ExecutionContext wrap(Map<String, Object> context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        return ExecutionContext.wrap(context);
    }

    private void logResult(String phase, BoundaryDirection direction, ContractValidationResult result) {
        if (!result.passed()) {
            if (mode == EnforcementMode.AUDIT) {
                log.info("Runtime boundary [{}] {}/{} FAILED: blocking={}",
                    mode.value(), phase, direction.value(), result.blockingFailures());
            } else {
                log.warn("Runtime boundary [{}] {}/{} FAILED: blocking={}",
                    mode.value(), phase, direction.value(), result.blockingFailures());
            }
        } else if (!result.warnings().isEmpty()) {
            log.info("Runtime boundary [{}] {}/{} passed with {} warning(s)",
                mode.value(), phase, direction.value(), result.warnings().size());
        } else {
            log.debug("Runtime boundary [{}] {}/{} passed", mode.value(), phase, direction.value());
        }
    }
}
