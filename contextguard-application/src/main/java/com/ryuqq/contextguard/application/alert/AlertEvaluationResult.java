package com.ryuqq.contextguard.application.alert;

import com.ryuqq.contextguard.core.model.ConstraintSeverity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 알림 평가 집계 결과.
 *
 * @param events 평가된 규칙별 결과 (지표가 없어 건너뛴 규칙 제외)
 * @param rulesEvaluated 평가된 규칙 수
 * @param alertsFiring 발생한 알림 수
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record AlertEvaluationResult(List<AlertEvent> events, int rulesEvaluated, int alertsFiring) {

    public AlertEvaluationResult {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public boolean hasFiringAlerts() {
        return alertsFiring > 0;
    }

    public List<AlertEvent> criticalAlerts() {
        return firing(ConstraintSeverity.BLOCKING);
    }

    public List<AlertEvent> warningAlerts() {
        return firing(ConstraintSeverity.WARNING);
    }

    private List<AlertEvent> firing(ConstraintSeverity severity) {
        return events.stream()
            .filter(e -> e.firing() && e.severity() == severity)
            .collect(Collectors.toUnmodifiableList());
    }
}
