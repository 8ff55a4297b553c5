package com.ryuqq.contextguard.core.chain;

import com.ryuqq.contextguard.core.model.ChainStatus;

import java.util.List;

/**
 * 단일 전파 체인 검사 결과.
 *
 * @param chainId 체인 식별자
 * @param status 체인 상태
 * @param sourcePhase source Phase 이름
 * @param destinationPhase destination Phase 이름
 * @param sourcePresent source 필드 존재 여부
 * @param destinationPresent destination 필드 존재 여부
 * @param waypointsPresent 경유지별 존재 여부 (선언 순서)
 * @param message 결과 메시지
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record PropagationChainResult(
    String chainId,
    ChainStatus status,
    String sourcePhase,
    String destinationPhase,
    boolean sourcePresent,
    boolean destinationPresent,
    List<Boolean> waypointsPresent,
    String message
) {

    public PropagationChainResult {
        if (chainId == null || chainId.isBlank()) {
            throw new IllegalArgumentException("chainId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        waypointsPresent = waypointsPresent == null ? List.of() : List.copyOf(waypointsPresent);
        if (message == null) {
            message = "";
        }
    }

    public boolean isIntact() {
        return status == ChainStatus.INTACT;
    }

    public boolean isBroken() {
        return status == ChainStatus.BROKEN;
    }

    /**
     * 이 체인이 해당 Phase를 source 또는 destination으로 가지는지 확인.
     *
     * @param phase Phase 이름
     * @return 연결되어 있으면 true
     */
    public boolean touches(String phase) {
        return phase.equals(sourcePhase) || phase.equals(destinationPhase);
    }
}
