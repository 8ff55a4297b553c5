package com.ryuqq.contextguard.application.regression;

import com.ryuqq.contextguard.core.model.ConstraintSeverity;
import com.ryuqq.contextguard.core.model.ContextContract;
import com.ryuqq.contextguard.core.model.FieldSpec;
import com.ryuqq.contextguard.core.model.PhaseContract;
import com.ryuqq.contextguard.core.model.PropagationChainSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 계약 drift 탐지기 (Layer 7).
 *
 * <p>두 계약 버전을 구조적으로 비교합니다. 실행은 관여하지 않습니다.</p>
 *
 * <p><strong>Breaking 판정:</strong></p>
 * <ul>
 *   <li>Phase 제거, 체인 제거</li>
 *   <li>entry/enrichment에 BLOCKING 필드 추가</li>
 *   <li>exit required/optional 필드 제거</li>
 *   <li>공통 필드의 severity가 BLOCKING으로 격상</li>
 * </ul>
 *
 * <p>변경은 Phase, 필드, 체인 순서로 나열되며 각 그룹 안에서는 이름순입니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class ContractDriftDetector {

    private static final Logger log = LoggerFactory.getLogger(ContractDriftDetector.class);

    /**
     * 두 계약 비교.
     *
     * @param oldContract 기준 계약
     * @param newContract 새 계약
     * @return drift 보고서
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DriftReport compare(ContextContract oldContract, ContextContract newContract) {
        if (oldContract == null) {
            throw new IllegalArgumentException("oldContract cannot be null");
        }
        if (newContract == null) {
            throw new IllegalArgumentException("newContract cannot be null");
        }

        List<DriftChange> changes = new ArrayList<>();
        detectPhaseChanges(oldContract, newContract, changes);
        detectFieldChanges(oldContract, newContract, changes);
        detectChainChanges(oldContract, newContract, changes);

        DriftReport report = DriftReport.of(changes, oldContract.pipelineId(), newContract.pipelineId());
        if (report.hasBreakingChanges()) {
            log.warn("Contract drift: {} changes ({} breaking) between '{}' and '{}'",
                report.totalChanges(), report.breakingCount(), oldContract.pipelineId(), newContract.pipelineId());
        } else if (report.totalChanges() > 0) {
            log.info("Contract drift: {} non-breaking changes between '{}' and '{}'",
                report.totalChanges(), oldContract.pipelineId(), newContract.pipelineId());
        }
        return report;
    }

    private static void detectPhaseChanges(ContextContract oldContract, ContextContract newContract,
                                           List<DriftChange> changes) {
        Set<String> oldPhases = oldContract.phases().keySet();
        Set<String> newPhases = newContract.phases().keySet();

        for (String phase : difference(newPhases, oldPhases)) {
            changes.add(new DriftChange(DriftChangeType.PHASE_ADDED, phase, "", DriftDirection.PHASE, false,
                "Phase '" + phase + "' added", null, null));
        }
        for (String phase : difference(oldPhases, newPhases)) {
            changes.add(new DriftChange(DriftChangeType.PHASE_REMOVED, phase, "", DriftDirection.PHASE, true,
                "Phase '" + phase + "' removed (may break downstream dependencies)", null, null));
        }
    }

    private static void detectFieldChanges(ContextContract oldContract, ContextContract newContract,
                                           List<DriftChange> changes) {
        Set<String> common = new TreeSet<>(oldContract.phases().keySet());
        common.retainAll(newContract.phases().keySet());

        for (String phase : common) {
            PhaseContract oldPhase = oldContract.phases().get(phase);
            PhaseContract newPhase = newContract.phases().get(phase);
            compareFields(phase, DriftDirection.ENTRY,
                oldPhase.entry().required(), newPhase.entry().required(), changes);
            compareFields(phase, DriftDirection.ENRICHMENT,
                oldPhase.entry().enrichment(), newPhase.entry().enrichment(), changes);
            compareFields(phase, DriftDirection.EXIT,
                oldPhase.exit().required(), newPhase.exit().required(), changes);
            compareFields(phase, DriftDirection.EXIT_OPTIONAL,
                oldPhase.exit().optional(), newPhase.exit().optional(), changes);
        }
    }

    private static void compareFields(String phase, DriftDirection direction, List<FieldSpec> oldList,
                                      List<FieldSpec> newList, List<DriftChange> changes) {
        Map<String, FieldSpec> oldFields = byName(oldList);
        Map<String, FieldSpec> newFields = byName(newList);
        String location = phase + "/" + direction.value();

        for (String name : difference(newFields.keySet(), oldFields.keySet())) {
            ConstraintSeverity severity = newFields.get(name).severity();
            boolean breaking = direction.isConsuming() && severity == ConstraintSeverity.BLOCKING;
            changes.add(new DriftChange(DriftChangeType.FIELD_ADDED, phase, name, direction, breaking,
                "Field '" + name + "' added to " + location
                    + (breaking ? " (BLOCKING, may break existing callers)" : ""),
                null, severity.value()));
        }

        for (String name : difference(oldFields.keySet(), newFields.keySet())) {
            boolean breaking = direction.isProducing();
            changes.add(new DriftChange(DriftChangeType.FIELD_REMOVED, phase, name, direction, breaking,
                "Field '" + name + "' removed from " + location
                    + (breaking ? " (may break downstream phases)" : ""),
                oldFields.get(name).severity().value(), null));
        }

        Set<String> common = new TreeSet<>(oldFields.keySet());
        common.retainAll(newFields.keySet());
        for (String name : common) {
            ConstraintSeverity oldSeverity = oldFields.get(name).severity();
            ConstraintSeverity newSeverity = newFields.get(name).severity();
            if (oldSeverity == newSeverity) {
                continue;
            }
            boolean breaking = newSeverity == ConstraintSeverity.BLOCKING;
            changes.add(new DriftChange(DriftChangeType.SEVERITY_CHANGED, phase, name, direction, breaking,
                "Field '" + name + "' in " + location + ": severity " + oldSeverity.value() + " -> "
                    + newSeverity.value() + (breaking ? " (ESCALATED to blocking)" : ""),
                oldSeverity.value(), newSeverity.value()));
        }
    }

    private static void detectChainChanges(ContextContract oldContract, ContextContract newContract,
                                           List<DriftChange> changes) {
        Set<String> oldChains = chainIds(oldContract);
        Set<String> newChains = chainIds(newContract);

        for (String chainId : difference(newChains, oldChains)) {
            changes.add(new DriftChange(DriftChangeType.CHAIN_ADDED, "", chainId, DriftDirection.CHAIN, false,
                "Propagation chain '" + chainId + "' added", null, null));
        }
        for (String chainId : difference(oldChains, newChains)) {
            changes.add(new DriftChange(DriftChangeType.CHAIN_REMOVED, "", chainId, DriftDirection.CHAIN, true,
                "Propagation chain '" + chainId + "' removed (end-to-end verification lost)", null, null));
        }
    }

    private static Map<String, FieldSpec> byName(List<FieldSpec> fields) {
        Map<String, FieldSpec> map = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            map.put(field.name(), field);
        }
        return map;
    }

    private static Set<String> chainIds(ContextContract contract) {
        Set<String> ids = new TreeSet<>();
        for (PropagationChainSpec chain : contract.propagationChains()) {
            ids.add(chain.chainId());
        }
        return ids;
    }

    private static Set<String> difference(Set<String> left, Set<String> right) {
        Set<String> result = new TreeSet<>(left);
        result.removeAll(right);
        return result;
    }
}
