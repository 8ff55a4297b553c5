package com.ryuqq.contextguard.core.model;

/**
 * 단일 워크플로 Phase의 전체 계약.
 *
 * @param description Phase 설명 (null 허용)
 * @param entry entry 경계 요구사항
 * @param exit exit 경계 요구사항
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record PhaseContract(
    String description,
    PhaseEntryContract entry,
    PhaseExitContract exit
) {

    public PhaseContract {
        if (entry == null) {
            entry = PhaseEntryContract.empty();
        }
        if (exit == null) {
            exit = PhaseExitContract.empty();
        }
    }

    /**
     * 설명 없이 생성.
     *
     * @param entry entry 계약
     * @param exit exit 계약
     * @return PhaseContract
     */
    public static PhaseContract of(PhaseEntryContract entry, PhaseExitContract exit) {
        return new PhaseContract(null, entry, exit);
    }
}
