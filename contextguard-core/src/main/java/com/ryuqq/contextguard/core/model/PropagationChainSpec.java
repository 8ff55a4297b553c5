package com.ryuqq.contextguard.core.model;

import java.util.List;

/**
 * source에서 destination까지 필드가 흘러가야 함을 선언하는 전파 체인.
 *
 * <p><strong>검증식 (verification):</strong> 값이 있으면 단순 존재/동등성 검사 대신
 * 해석된 source/dest 값에 대해 평가됩니다 (예: {@code "source == dest"}).
 * 문법은 {@code com.ryuqq.contextguard.core.verification} 패키지를 참고하세요.</p>
 *
 * @param chainId 체인 식별자
 * @param description 설명 (null 허용)
 * @param source 값의 출발점
 * @param waypoints 중간 경유 지점 (존재 여부만 기록)
 * @param destination 값의 도착점
 * @param severity 체인 단절 시 처리 강도 (기본 WARNING)
 * @param verification 검증식 (null 허용)
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record PropagationChainSpec(
    String chainId,
    String description,
    ChainEndpoint source,
    List<ChainEndpoint> waypoints,
    ChainEndpoint destination,
    ConstraintSeverity severity,
    String verification
) {

    public PropagationChainSpec {
        if (chainId == null || chainId.isBlank()) {
            throw new IllegalArgumentException("chainId cannot be null or blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null (chain: " + chainId + ")");
        }
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null (chain: " + chainId + ")");
        }
        waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
        if (severity == null) {
            severity = ConstraintSeverity.WARNING;
        }
        if (verification != null && verification.isBlank()) {
            verification = null;
        }
    }

    /**
     * 경유지/검증식 없이 생성.
     *
     * @param chainId 체인 식별자
     * @param source 출발점
     * @param destination 도착점
     * @return PropagationChainSpec
     */
    public static PropagationChainSpec of(String chainId, ChainEndpoint source, ChainEndpoint destination) {
        return new PropagationChainSpec(chainId, null, source, List.of(), destination, null, null);
    }

    /**
     * 검증식을 포함하여 생성.
     *
     * @param chainId 체인 식별자
     * @param source 출발점
     * @param destination 도착점
     * @param verification 검증식
     * @return PropagationChainSpec
     */
    public static PropagationChainSpec verified(String chainId, ChainEndpoint source,
                                                ChainEndpoint destination, String verification) {
        return new PropagationChainSpec(chainId, null, source, List.of(), destination, null, verification);
    }

    public boolean hasVerification() {
        return verification != null;
    }

    /**
     * 이 체인이 해당 Phase를 source 또는 destination으로 가지는지 확인.
     *
     * @param phase Phase 이름
     * @return 연결되어 있으면 true
     */
    public boolean touches(String phase) {
        return source.phase().equals(phase) || destination.phase().equals(phase);
    }
}
