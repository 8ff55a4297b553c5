package com.ryuqq.contextguard.application.runtime;

import com.ryuqq.contextguard.core.boundary.ContractValidationResult;

import java.util.Map;

/**
 * 진행 중인 Phase 스코프.
 *
 * <p>{@link #close()} 에서 exit 검증을 수행합니다. 본문이 예외로 끝나도 exit 검증은 실행되며,
 * 이때 exit 위반 예외는 본문 예외에 suppressed로 추가됩니다.</p>
 *
 * <p>{@code close()} 는 한 번만 exit 검증을 수행합니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class PhaseScope implements AutoCloseable {

    private final RuntimeBoundaryGuard guard;
    private final String phase;
    private final Map<String, Object> context;
    private final ContractValidationResult entryResult;
    private ContractValidationResult exitResult;
    private boolean closed;

    PhaseScope(RuntimeBoundaryGuard guard, String phase, Map<String, Object> context,
               ContractValidationResult entryResult) {
        this.guard = guard;
        this.phase = phase;
        this.context = context;
        this.entryResult = entryResult;
    }

    public String phase() {
        return phase;
    }

    /**
     * entry 검증 결과 (PERMISSIVE/AUDIT 모드에서 실패 여부 확인용).
     *
     * @return entry 결과
     */
    public ContractValidationResult entryResult() {
        return entryResult;
    }

    /**
     * exit 검증 결과.
     *
     * @return exit 결과 (close 전에는 null)
     */
    public ContractValidationResult exitResult() {
        return exitResult;
    }

    /**
     * exit 검증 실행.
     *
     * @throws BoundaryViolationException STRICT 모드에서 exit가 실패한 경우
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        exitResult = guard.exitPhase(phase, context);
    }
}
