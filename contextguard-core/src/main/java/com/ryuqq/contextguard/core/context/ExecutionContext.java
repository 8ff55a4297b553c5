package com.ryuqq.contextguard.core.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 파이프라인이 Phase 사이에 주고받는 가변 key/value 컨텍스트.
 *
 * <p>중첩 Map 구조를 dot-path({@code config.db.host})로 조회/설정합니다.
 * 리스트 인덱스 경로는 지원하지 않습니다.</p>
 *
 * <p><strong>소유권:</strong> 컨텍스트는 호출자 소유입니다.
 * {@link #wrap(Map)} 은 전달된 Map에 직접 쓰고, {@link #copyOf(Map)} 은 최상위를 복사합니다.
 * 검증기는 기본값 적용({@link #set(String, Object)})외에는 컨텍스트를 변경하지 않습니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 동기화하지 않습니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class ExecutionContext {

    private static final String SEPARATOR = "\\.";

    private final Map<String, Object> values;

    private ExecutionContext(Map<String, Object> values) {
        this.values = values;
    }

    public static ExecutionContext empty() {
        return new ExecutionContext(new LinkedHashMap<>());
    }

    /**
     * 호출자의 Map을 그대로 감싸서 생성 (쓰기가 원본에 반영됨).
     *
     * @param values 가변 Map
     * @return ExecutionContext
     * @throws IllegalArgumentException values가 null인 경우
     */
    public static ExecutionContext wrap(Map<String, Object> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        return new ExecutionContext(values);
    }

    /**
     * 복사본으로 생성 (중첩 Map은 재귀적으로 복사, 그 외 값은 공유).
     *
     * <p>기본값 적용 등의 쓰기가 원본에 반영되지 않습니다.</p>
     *
     * @param values 원본 Map (불변 Map 허용)
     * @return ExecutionContext
     * @throws IllegalArgumentException values가 null인 경우
     */
    public static ExecutionContext copyOf(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        return new ExecutionContext(deepCopy(values));
    }

    private static Map<String, Object> deepCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            Object value = entry.getValue();
            copy.put(String.valueOf(entry.getKey()), value instanceof Map ? deepCopy((Map<?, ?>) value) : value);
        }
        return copy;
    }

    /**
     * dot-path 필드 조회.
     *
     * @param path dot-path (예: {@code config.db.host})
     * @return 조회 결과 (경로가 없으면 absent)
     */
    public FieldLookup lookup(String path) {
        if (path == null || path.isEmpty()) {
            return FieldLookup.absent();
        }
        Object current = values;
        for (String part : path.split(SEPARATOR, -1)) {
            if (!(current instanceof Map)) {
                return FieldLookup.absent();
            }
            Map<?, ?> map = (Map<?, ?>) current;
            if (!map.containsKey(part)) {
                return FieldLookup.absent();
            }
            current = map.get(part);
        }
        return FieldLookup.of(current);
    }

    /**
     * dot-path 값 조회 (편의 메서드).
     *
     * @param path dot-path
     * @return 값 (없거나 null이면 null)
     */
    public Object get(String path) {
        return lookup(path).value();
    }

    public boolean contains(String path) {
        return lookup(path).isPresent();
    }

    /**
     * dot-path 필드 설정 (중간 Map 자동 생성).
     *
     * <p>경로 상의 중첩 Map은 같은 내용의 가변 Map으로 교체된 뒤 기록됩니다.
     * 최상위 Map에는 직접 씁니다.</p>
     *
     * @param path dot-path
     * @param value 설정할 값 (null 허용)
     * @throws IllegalArgumentException path가 null이거나 빈 문자열인 경우
     * @throws IllegalStateException 중간 경로가 Map이 아닌 값인 경우
     */
    public void set(String path, Object value) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path cannot be null or empty");
        }
        String[] parts = path.split(SEPARATOR, -1);
        Map<String, Object> current = values;
        for (int i = 0; i < parts.length - 1; i++) {
            Object next = current.get(parts[i]);
            if (next == null) {
                Map<String, Object> created = new LinkedHashMap<>();
                current.put(parts[i], created);
                current = created;
            } else if (next instanceof Map) {
                Map<String, Object> writable = shallowCopy((Map<?, ?>) next);
                current.put(parts[i], writable);
                current = writable;
            } else {
                throw new IllegalStateException(
                    String.format("Cannot set '%s': '%s' is not a map (found %s)",
                        path, parts[i], next.getClass().getSimpleName())
                );
            }
        }
        current.put(parts[parts.length - 1], value);
    }

    private static Map<String, Object> shallowCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }

    /**
     * 모든 키를 dot-path로 평탄화.
     *
     * <p>예: {@code {"a": {"b": 1}, "c": 2}} → {@code ["a", "a.b", "c"]}</p>
     *
     * @return dot-path 목록 (중간 경로 포함)
     */
    public List<String> flattenedKeys() {
        List<String> keys = new ArrayList<>();
        flatten(values, "", keys);
        return keys;
    }

    private static void flatten(Map<?, ?> map, String prefix, List<String> keys) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            keys.add(key);
            if (entry.getValue() instanceof Map) {
                flatten((Map<?, ?>) entry.getValue(), key, keys);
            }
        }
    }

    /**
     * 최상위 Map 읽기 전용 뷰.
     *
     * @return 읽기 전용 Map
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "ExecutionContext" + values;
    }
}
