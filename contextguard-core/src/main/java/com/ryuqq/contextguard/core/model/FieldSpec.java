package com.ryuqq.contextguard.core.model;

/**
 * Phase 경계에서 검증할 단일 컨텍스트 필드 명세.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>name:</strong> dot-path 필드명 (예: {@code config.db.host})</li>
 *   <li><strong>type:</strong> 기대 타입 이름 (문서화 용도, 기본 "str")</li>
 *   <li><strong>severity:</strong> 누락 시 처리 강도 (기본 BLOCKING)</li>
 *   <li><strong>defaultValue:</strong> 누락 시 적용할 기본값 (null이면 기본값 없음)</li>
 *   <li><strong>description:</strong> 설명 (선택)</li>
 *   <li><strong>sourcePhase:</strong> 이 필드를 최초 생성하는 Phase (선택)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * FieldSpec domain = FieldSpec.blocking("domain");
 * FieldSpec lang = FieldSpec.of("language", ConstraintSeverity.WARNING, "python");
 * </pre>
 *
 * @param name dot-path 필드명
 * @param type 기대 타입 이름
 * @param severity 누락 시 처리 강도
 * @param defaultValue 기본값 (null 허용)
 * @param description 설명 (null 허용)
 * @param sourcePhase 생성 Phase (null 허용)
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record FieldSpec(
    String name,
    String type,
    ConstraintSeverity severity,
    Object defaultValue,
    String description,
    String sourcePhase
) {

    private static final String DEFAULT_TYPE = "str";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("field name cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            type = DEFAULT_TYPE;
        }
        if (severity == null) {
            severity = ConstraintSeverity.BLOCKING;
        }
    }

    /**
     * Severity와 기본값만 지정하여 생성.
     *
     * @param name 필드명
     * @param severity 처리 강도
     * @param defaultValue 기본값 (null 허용)
     * @return FieldSpec
     */
    public static FieldSpec of(String name, ConstraintSeverity severity, Object defaultValue) {
        return new FieldSpec(name, DEFAULT_TYPE, severity, defaultValue, null, null);
    }

    /**
     * Severity만 지정하여 생성 (기본값 없음).
     *
     * @param name 필드명
     * @param severity 처리 강도
     * @return FieldSpec
     */
    public static FieldSpec of(String name, ConstraintSeverity severity) {
        return of(name, severity, null);
    }

    public static FieldSpec blocking(String name) {
        return of(name, ConstraintSeverity.BLOCKING);
    }

    public static FieldSpec warning(String name) {
        return of(name, ConstraintSeverity.WARNING);
    }

    public static FieldSpec advisory(String name) {
        return of(name, ConstraintSeverity.ADVISORY);
    }

    /**
     * 기본값 선언 여부.
     *
     * @return 기본값이 있으면 true
     */
    public boolean hasDefault() {
        return defaultValue != null;
    }
}
