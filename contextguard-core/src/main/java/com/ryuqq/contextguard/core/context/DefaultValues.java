package com.ryuqq.contextguard.core.context;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * 기본값/placeholder 판정.
 *
 * <p>다음 값은 "실제 값이 아님"으로 취급합니다:</p>
 * <ul>
 *   <li>null</li>
 *   <li>빈 Collection / 빈 Map</li>
 *   <li>문자열 {@code ""}, {@code "unknown"}, {@code "UNKNOWN"}</li>
 * </ul>
 *
 * <p>대소문자 무시 규칙이 아닙니다. {@code "Unknown"} 은 실제 값으로 취급됩니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class DefaultValues {

    /**
     * placeholder 문자열 목록.
     */
    public static final Set<String> STRING_SENTINELS = Set.of("", "unknown", "UNKNOWN");

    private DefaultValues() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본값/placeholder 여부 확인.
     *
     * @param value 검사할 값 (null 허용)
     * @return placeholder이면 true
     */
    public static boolean isDefault(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value instanceof String) {
            return STRING_SENTINELS.contains(value);
        }
        return false;
    }
}
