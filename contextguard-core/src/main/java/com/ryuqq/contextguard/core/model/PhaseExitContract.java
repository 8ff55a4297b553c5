package com.ryuqq.contextguard.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase 종료 조건 (exit boundary).
 *
 * <ul>
 *   <li><strong>required:</strong> Phase 완료 후 반드시 존재해야 하는 필드</li>
 *   <li><strong>optional:</strong> Phase 완료 후 존재할 수 있는 필드</li>
 * </ul>
 *
 * @param required 필수 산출 필드 목록
 * @param optional 선택 산출 필드 목록
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record PhaseExitContract(
    List<FieldSpec> required,
    List<FieldSpec> optional
) {

    public PhaseExitContract {
        required = required == null ? List.of() : List.copyOf(required);
        optional = optional == null ? List.of() : List.copyOf(optional);
    }

    public static PhaseExitContract empty() {
        return new PhaseExitContract(List.of(), List.of());
    }

    /**
     * 이 Phase가 생산하는 모든 필드명 (required ∪ optional, 선언 순서).
     *
     * @return 필드명 목록
     */
    public List<String> producedFieldNames() {
        List<String> names = new ArrayList<>(required.size() + optional.size());
        for (FieldSpec spec : required) {
            names.add(spec.name());
        }
        for (FieldSpec spec : optional) {
            if (!names.contains(spec.name())) {
                names.add(spec.name());
            }
        }
        return List.copyOf(names);
    }
}
