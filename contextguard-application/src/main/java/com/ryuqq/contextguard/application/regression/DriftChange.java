package com.ryuqq.contextguard.application.regression;

/**
 * 두 계약 버전 사이의 단일 변경.
 *
 * @param changeType 변경 종류
 * @param phase Phase 이름 (체인 변경이면 빈 문자열)
 * @param field 필드명 또는 체인 ID (Phase 변경이면 빈 문자열)
 * @param direction 변경 위치
 * @param breaking 기존 실행을 실패시킬 수 있는 변경인지
 * @param description 설명
 * @param oldValue 이전 severity (nullable)
 * @param newValue 새 severity (nullable)
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record DriftChange(
    DriftChangeType changeType,
    String phase,
    String field,
    DriftDirection direction,
    boolean breaking,
    String description,
    String oldValue,
    String newValue
) {

    public DriftChange {
        if (changeType == null) {
            throw new IllegalArgumentException("changeType cannot be null");
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction cannot be null");
        }
        if (phase == null) {
            phase = "";
        }
        if (field == null) {
            field = "";
        }
        if (description == null) {
            description = "";
        }
    }
}
