package com.ryuqq.contextguard.application.runtime;

import com.ryuqq.contextguard.core.boundary.BoundaryDirection;
import com.ryuqq.contextguard.core.boundary.ContractValidationResult;

/**
 * STRICT 모드에서 BLOCKING 경계 위반 시 발생하는 예외.
 *
 * <p>호출자(호스트 파이프라인)가 재시도, 중단, PERMISSIVE 전환 여부를 결정합니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public class BoundaryViolationException extends RuntimeException {

    private final String phase;
    private final BoundaryDirection direction;
    private final transient ContractValidationResult result;

    /**
     * 생성자.
     *
     * @param phase Phase 이름
     * @param direction 경계 방향
     * @param result 실패한 검증 결과
     */
    public BoundaryViolationException(String phase, BoundaryDirection direction, ContractValidationResult result) {
        super(String.format("Boundary violation in phase '%s' (%s): blocking fields: [%s]",
            phase, direction.value(), String.join(", ", result.blockingFailures())));
        this.phase = phase;
        this.direction = direction;
        this.result = result;
    }

    public String getPhase() {
        return phase;
    }

    public BoundaryDirection getDirection() {
        return direction;
    }

    public ContractValidationResult getResult() {
        return result;
    }
}
