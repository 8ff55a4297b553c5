package com.ryuqq.contextguard.core.context;

import java.util.Objects;

/**
 * dot-path 필드 조회 결과.
 *
 * <p>"없음 / null / 기본값" 세 가지 상태를 구분합니다:</p>
 * <ul>
 *   <li><strong>absent:</strong> 경로가 존재하지 않음 ({@link #isPresent()} false)</li>
 *   <li><strong>null:</strong> 경로는 존재하지만 값이 null ({@link #hasValue()} false)</li>
 *   <li><strong>default:</strong> 값이 {@link DefaultValues#isDefault(Object)} 에 해당</li>
 * </ul>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class FieldLookup {

    private static final FieldLookup ABSENT = new FieldLookup(false, null);

    private final boolean present;
    private final Object value;

    private FieldLookup(boolean present, Object value) {
        this.present = present;
        this.value = value;
    }

    public static FieldLookup absent() {
        return ABSENT;
    }

    /**
     * 존재하는 값으로 생성.
     *
     * @param value 값 (null 허용)
     * @return FieldLookup
     */
    public static FieldLookup of(Object value) {
        return new FieldLookup(true, value);
    }

    public boolean isPresent() {
        return present;
    }

    /**
     * 경로가 존재하고 값이 null이 아닌지 확인.
     *
     * @return 실제 값이 있으면 true
     */
    public boolean hasValue() {
        return present && value != null;
    }

    /**
     * 값이 없거나 placeholder인지 확인.
     *
     * @return absent, null, 또는 기본값 sentinel이면 true
     */
    public boolean isDefault() {
        return !hasValue() || DefaultValues.isDefault(value);
    }

    /**
     * 값 조회.
     *
     * @return 값 (absent 또는 null인 경우 null)
     */
    public Object value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldLookup that = (FieldLookup) o;
        return present == that.present && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        return present ? "FieldLookup{" + value + '}' : "FieldLookup{absent}";
    }
}
