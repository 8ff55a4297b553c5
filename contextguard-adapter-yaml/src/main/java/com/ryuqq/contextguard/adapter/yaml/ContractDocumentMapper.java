package com.ryuqq.contextguard.adapter.yaml;

import com.ryuqq.contextguard.adapter.yaml.document.ChainDocument;
import com.ryuqq.contextguard.adapter.yaml.document.ContractDocument;
import com.ryuqq.contextguard.adapter.yaml.document.EndpointDocument;
import com.ryuqq.contextguard.adapter.yaml.document.EntryDocument;
import com.ryuqq.contextguard.adapter.yaml.document.ExitDocument;
import com.ryuqq.contextguard.adapter.yaml.document.FieldDocument;
import com.ryuqq.contextguard.adapter.yaml.document.PhaseDocument;
import com.ryuqq.contextguard.core.model.ChainEndpoint;
import com.ryuqq.contextguard.core.model.ConstraintSeverity;
import com.ryuqq.contextguard.core.model.ContextContract;
import com.ryuqq.contextguard.core.model.FieldSpec;
import com.ryuqq.contextguard.core.model.PhaseContract;
import com.ryuqq.contextguard.core.model.PhaseEntryContract;
import com.ryuqq.contextguard.core.model.PhaseExitContract;
import com.ryuqq.contextguard.core.model.PropagationChainSpec;
import com.ryuqq.contextguard.core.verification.VerificationExpression;
import com.ryuqq.contextguard.core.verification.VerificationSyntaxException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ContractDocument} → {@link ContextContract} 변환기.
 *
 * <p>필수 키 누락과 모델 생성자의 검증 실패를 문서 내 위치(예: {@code phases.plan.entry.required[0]})와
 * 함께 {@link ContractLoadException}으로 변환합니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
final class ContractDocumentMapper {

    private final String source;

    ContractDocumentMapper(String source) {
        this.source = source;
    }

    ContextContract toContract(ContractDocument document) {
        if (document == null) {
            throw error("contract document is empty");
        }
        String schemaVersion = requireText(document.schemaVersion(), "schema_version");
        String pipelineId = requireText(document.pipelineId(), "pipeline_id");

        Map<String, PhaseContract> phases = new LinkedHashMap<>();
        if (document.phases() != null) {
            for (Map.Entry<String, PhaseDocument> entry : document.phases().entrySet()) {
                phases.put(entry.getKey(), toPhase(entry.getKey(), entry.getValue()));
            }
        }

        List<PropagationChainSpec> chains = new ArrayList<>();
        if (document.propagationChains() != null) {
            for (int i = 0; i < document.propagationChains().size(); i++) {
                chains.add(toChain("propagation_chains[" + i + "]", document.propagationChains().get(i)));
            }
        }

        try {
            return new ContextContract(schemaVersion, pipelineId, document.description(), phases, chains);
        } catch (IllegalArgumentException e) {
            throw error(e.getMessage(), e);
        }
    }

    private PhaseContract toPhase(String name, PhaseDocument document) {
        String location = "phases." + name;
        if (document == null) {
            throw error(location + ": phase must be a mapping");
        }

        PhaseEntryContract entry = PhaseEntryContract.empty();
        EntryDocument entryDocument = document.entry();
        if (entryDocument != null) {
            entry = new PhaseEntryContract(
                toFields(location + ".entry.required", entryDocument.required()),
                toFields(location + ".entry.enrichment", entryDocument.enrichment()));
        }

        PhaseExitContract exit = PhaseExitContract.empty();
        ExitDocument exitDocument = document.exit();
        if (exitDocument != null) {
            exit = new PhaseExitContract(
                toFields(location + ".exit.required", exitDocument.required()),
                toFields(location + ".exit.optional", exitDocument.optional()));
        }
        return new PhaseContract(document.description(), entry, exit);
    }

    private List<FieldSpec> toFields(String location, List<FieldDocument> documents) {
        List<FieldSpec> fields = new ArrayList<>();
        if (documents == null) {
            return fields;
        }
        for (int i = 0; i < documents.size(); i++) {
            String itemLocation = location + "[" + i + "]";
            FieldDocument document = documents.get(i);
            if (document == null) {
                throw error(itemLocation + ": field must be a mapping");
            }
            String name = requireText(document.name(), itemLocation + ".name");
            ConstraintSeverity severity = document.severity() == null
                ? ConstraintSeverity.BLOCKING
                : severity(itemLocation, document.severity());
            fields.add(new FieldSpec(name, document.type(), severity, document.defaultValue(),
                document.description(), document.sourcePhase()));
        }
        return fields;
    }

    private PropagationChainSpec toChain(String location, ChainDocument document) {
        if (document == null) {
            throw error(location + ": chain must be a mapping");
        }
        String chainId = requireText(document.chainId(), location + ".chain_id");
        ChainEndpoint sourceEndpoint = toEndpoint(location + ".source", document.source());
        ChainEndpoint destination = toEndpoint(location + ".destination", document.destination());

        List<ChainEndpoint> waypoints = new ArrayList<>();
        if (document.waypoints() != null) {
            for (int i = 0; i < document.waypoints().size(); i++) {
                waypoints.add(toEndpoint(location + ".waypoints[" + i + "]", document.waypoints().get(i)));
            }
        }

        ConstraintSeverity severity = document.severity() == null
            ? ConstraintSeverity.WARNING
            : severity(location, document.severity());

        String verification = document.verification();
        if (verification != null && !verification.isBlank()) {
            try {
                VerificationExpression.parse(verification);
            } catch (VerificationSyntaxException e) {
                throw error(location + " (" + chainId + "): " + e.getMessage(), e);
            }
        }

        return new PropagationChainSpec(chainId, document.description(), sourceEndpoint, waypoints, destination,
            severity, verification);
    }

    private ChainEndpoint toEndpoint(String location, EndpointDocument document) {
        if (document == null) {
            throw error(location + ": missing required key");
        }
        return new ChainEndpoint(requireText(document.phase(), location + ".phase"),
            requireText(document.field(), location + ".field"));
    }

    private ConstraintSeverity severity(String location, String value) {
        try {
            return ConstraintSeverity.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw error(location + ": " + e.getMessage(), e);
        }
    }

    private String requireText(String value, String key) {
        if (value == null || value.isBlank()) {
            throw error("missing required key '" + key + "'");
        }
        return value;
    }

    private ContractLoadException error(String detail) {
        return new ContractLoadException(source, detail);
    }

    private ContractLoadException error(String detail, Throwable cause) {
        return new ContractLoadException(source, detail, cause);
    }
}
