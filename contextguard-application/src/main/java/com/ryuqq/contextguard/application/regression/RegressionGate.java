package com.ryuqq.contextguard.application.regression;

import com.ryuqq.contextguard.application.health.HealthScore;
import com.ryuqq.contextguard.application.postexec.PostExecutionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 회귀 게이트 (Layer 7).
 *
 * <p>현재 실행 결과를 기준 실행과 비교하여 통과/실패를 판정합니다.
 * 주어진 입력 조합마다 검사가 하나씩 추가되고, 입력이 없는 검사는 건너뜁니다.</p>
 *
 * <p><strong>검사 순서:</strong></p>
 * <ol>
 *   <li>completeness_regression: 두 보고서 필요</li>
 *   <li>health_minimum: 현재 건강 점수 필요</li>
 *   <li>health_regression: 두 건강 점수 필요 (maxCompletenessDrop 공유)</li>
 *   <li>contract_drift: drift 보고서 필요</li>
 *   <li>blocking_failures: 현재 보고서 필요 (기준 보고서가 없으면 0개 BROKEN으로 간주)</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * GateResult result = new RegressionGate().check(GateInput.builder()
 *     .baselineReport(baseline)
 *     .currentReport(current)
 *     .driftReport(detector.compare(oldContract, newContract))
 *     .build());
 * if (!result.passed()) {
 *     result.failures().forEach(f -&gt; log.error("GATE FAIL: {}", f.message()));
 * }
 * </pre>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class RegressionGate {

    private static final Logger log = LoggerFactory.getLogger(RegressionGate.class);

    private static final int MAX_LISTED_BREAKING_CHANGES = 3;

    private final GateThresholds thresholds;
    private final boolean allowBreakingDrift;

    public RegressionGate() {
        this(new GateThresholds(), false);
    }

    /**
     * 기본 임계값에 일부를 덮어써서 생성.
     *
     * @param overrides 키(snake_case) → 값
     * @param allowBreakingDrift breaking drift를 허용할지 여부
     */
    public RegressionGate(Map<String, ? extends Number> overrides, boolean allowBreakingDrift) {
        this(GateThresholds.fromMap(overrides), allowBreakingDrift);
    }

    /**
     * 생성자.
     *
     * @param thresholds 임계값
     * @param allowBreakingDrift true이면 breaking drift를 보고만 하고 실패시키지 않음
     * @throws IllegalArgumentException thresholds가 null인 경우
     */
    public RegressionGate(GateThresholds thresholds, boolean allowBreakingDrift) {
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds cannot be null");
        }
        this.thresholds = thresholds;
        this.allowBreakingDrift = allowBreakingDrift;
    }

    public GateThresholds thresholds() {
        return thresholds;
    }

    public boolean allowBreakingDrift() {
        return allowBreakingDrift;
    }

    /**
     * 입력 없이 검사 (검사 0개로 통과).
     *
     * @return GateResult
     */
    public GateResult check() {
        return check(GateInput.empty());
    }

    /**
     * 모든 검사 실행.
     *
     * @param baselineReport 기준 보고서 (nullable)
     * @param currentReport 현재 보고서 (nullable)
     * @param baselineHealth 기준 건강 점수 (nullable)
     * @param currentHealth 현재 건강 점수 (nullable)
     * @param driftReport drift 보고서 (nullable)
     * @return GateResult
     */
    public GateResult check(PostExecutionReport baselineReport, PostExecutionReport currentReport,
                            HealthScore baselineHealth, HealthScore currentHealth, DriftReport driftReport) {
        return check(new GateInput(baselineReport, currentReport, baselineHealth, currentHealth, driftReport));
    }

    /**
     * 모든 검사 실행.
     *
     * @param input 게이트 입력
     * @return GateResult
     * @throws IllegalArgumentException input이 null인 경우
     */
    public GateResult check(GateInput input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }

        List<GateCheck> checks = new ArrayList<>();
        if (input.baselineReport() != null && input.currentReport() != null) {
            checks.add(checkCompleteness(input.baselineReport(), input.currentReport()));
        }
        if (input.currentHealth() != null) {
            checks.add(checkHealthMinimum(input.currentHealth()));
            if (input.baselineHealth() != null) {
                checks.add(checkHealthRegression(input.baselineHealth(), input.currentHealth()));
            }
        }
        if (input.driftReport() != null) {
            checks.add(checkDrift(input.driftReport()));
        }
        if (input.currentReport() != null) {
            checks.add(checkBlockingFailures(input.baselineReport(), input.currentReport()));
        }

        GateResult result = GateResult.of(checks);
        if (!result.passed()) {
            log.warn("Regression gate FAILED: {}/{} checks failed", result.failedChecks(), result.totalChecks());
        } else {
            log.info("Regression gate passed: {} checks OK", result.totalChecks());
        }
        return result;
    }

    // ============================================================
    // Checks
    // ============================================================

    private GateCheck checkCompleteness(PostExecutionReport baseline, PostExecutionReport current) {
        double maxDrop = thresholds.maxCompletenessDrop();
        double drop = baseline.completenessPct() - current.completenessPct();
        boolean passed = drop <= maxDrop;
        String message = passed
            ? format("Completeness OK: %.1f%% (baseline=%.1f%%)", current.completenessPct(), baseline.completenessPct())
            : format("Completeness dropped by %.1f%% (baseline=%.1f%%, current=%.1f%%, max_allowed=%.1f%%)",
                drop, baseline.completenessPct(), current.completenessPct(), maxDrop);
        return new GateCheck(GateCheck.COMPLETENESS_REGRESSION, passed, message,
            baseline.completenessPct(), current.completenessPct());
    }

    private GateCheck checkHealthMinimum(HealthScore current) {
        double minScore = thresholds.minHealthScore();
        boolean passed = current.overall() >= minScore;
        String message = passed
            ? format("Health score OK: %.1f >= %.1f", current.overall(), minScore)
            : format("Health score %.1f below minimum %.1f", current.overall(), minScore);
        return new GateCheck(GateCheck.HEALTH_MINIMUM, passed, message, null, current.overall());
    }

    private GateCheck checkHealthRegression(HealthScore baseline, HealthScore current) {
        double drop = baseline.overall() - current.overall();
        boolean passed = drop <= thresholds.maxCompletenessDrop();
        String message = passed
            ? format("Health regression OK: %.1f (baseline=%.1f)", current.overall(), baseline.overall())
            : format("Health score dropped by %.1f (baseline=%.1f, current=%.1f)",
                drop, baseline.overall(), current.overall());
        return new GateCheck(GateCheck.HEALTH_REGRESSION, passed, message, baseline.overall(), current.overall());
    }

    private GateCheck checkDrift(DriftReport drift) {
        if (!drift.hasBreakingChanges()) {
            return new GateCheck(GateCheck.CONTRACT_DRIFT, true,
                "No breaking drift (" + drift.totalChanges() + " non-breaking changes)", null, null);
        }

        String descriptions = drift.breakingChanges().stream()
            .limit(MAX_LISTED_BREAKING_CHANGES)
            .map(DriftChange::description)
            .collect(Collectors.joining("; "));
        String suffix = drift.breakingCount() > MAX_LISTED_BREAKING_CHANGES
            ? " ... and " + (drift.breakingCount() - MAX_LISTED_BREAKING_CHANGES) + " more"
            : "";
        return new GateCheck(GateCheck.CONTRACT_DRIFT, allowBreakingDrift,
            drift.breakingCount() + " breaking contract changes: " + descriptions + suffix,
            null, (double) drift.breakingCount());
    }

    private GateCheck checkBlockingFailures(PostExecutionReport baseline, PostExecutionReport current) {
        int currentBroken = current.chainsBroken();
        int baselineBroken = baseline == null ? 0 : baseline.chainsBroken();
        int increase = currentBroken - baselineBroken;
        boolean passed = increase <= thresholds.maxBlockingFailureIncrease();
        String message = passed
            ? "Broken chains OK: " + currentBroken + " (baseline=" + baselineBroken + ")"
            : "Broken chains increased by " + increase + " (baseline=" + baselineBroken
                + ", current=" + currentBroken + ")";
        return new GateCheck(GateCheck.BLOCKING_FAILURES, passed, message,
            (double) baselineBroken, (double) currentBroken);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
