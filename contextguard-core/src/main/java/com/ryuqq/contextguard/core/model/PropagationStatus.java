package com.ryuqq.contextguard.core.model;

import java.util.Collection;

/**
 * 필드/경계 단위 전파 상태.
 *
 * <p>심각도 순서 (나쁨 → 좋음): FAILED &gt; PARTIAL &gt; DEFAULTED &gt; PROPAGATED</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public enum PropagationStatus {

    /**
     * 값이 정상적으로 전파됨.
     */
    PROPAGATED("propagated", 0),

    /**
     * 값이 없어 기본값으로 대체되었거나 대체 대상임.
     */
    DEFAULTED("defaulted", 1),

    /**
     * 일부만 전파됨 (advisory 누락 등).
     */
    PARTIAL("partial", 2),

    /**
     * BLOCKING 필드 누락.
     */
    FAILED("failed", 3);

    private final String value;
    private final int rank;

    PropagationStatus(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String value() {
        return value;
    }

    /**
     * 다른 상태보다 나쁜지 확인.
     *
     * @param other 비교 대상
     * @return 이 상태가 더 나쁜 경우 true
     */
    public boolean isWorseThan(PropagationStatus other) {
        return rank > other.rank;
    }

    /**
     * 가장 나쁜 상태 계산.
     *
     * @param statuses 상태 목록
     * @return 가장 나쁜 상태 (비어있으면 PROPAGATED)
     */
    public static PropagationStatus worst(Collection<PropagationStatus> statuses) {
        PropagationStatus worst = PROPAGATED;
        for (PropagationStatus status : statuses) {
            if (status != null && status.isWorseThan(worst)) {
                worst = status;
            }
        }
        return worst;
    }
}
