package com.ryuqq.contextguard.core.model;

/**
 * 전파 체인 무결성 상태.
 *
 * <ul>
 *   <li>INTACT: source 값이 destination까지 도달함</li>
 *   <li>DEGRADED: destination이 없거나 기본값/빈 값</li>
 *   <li>BROKEN: source 누락 또는 검증식 실패</li>
 * </ul>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum ChainStatus {
    INTACT,
    DEGRADED,
    BROKEN
}
