package com.ryuqq.contextguard.adapter.yaml;

import com.ryuqq.contextguard.core.model.ChainEndpoint;
import com.ryuqq.contextguard.core.model.ConstraintSeverity;
import com.ryuqq.contextguard.core.model.ContextContract;
import com.ryuqq.contextguard.core.model.FieldSpec;
import com.ryuqq.contextguard.core.model.PhaseContract;
import com.ryuqq.contextguard.core.model.PropagationChainSpec;
import com.ryuqq.contextguard.core.verification.VerificationSyntaxException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * YamlContractLoader 테스트.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
class YamlContractLoaderTest {

    private YamlContractLoader loader;

    @BeforeEach
    void setUp() {
        loader = new YamlContractLoader();
    }

    // ============================================================
    // Mapping
    // ============================================================

    @Test
    void loadResource_FullContract_MapsPhasesInOrder() {
        // When
        ContextContract contract = loader.loadResource("contracts/sdlc-contract.yaml");

        // Then
        assertThat(contract.schemaVersion()).isEqualTo("1.0");
        assertThat(contract.pipelineId()).isEqualTo("sdlc");
        assertThat(contract.phaseOrder()).containsExactly("seed", "plan", "implement");
        assertThat(contract.phase("seed")).hasValueSatisfying(
            phase -> assertThat(phase.description()).isEqualTo("Capture the request"));
    }

    @Test
    void loadResource_FieldKeys_MappedWithDefaults() {
        // When
        ContextContract contract = loader.loadResource("contracts/sdlc-contract.yaml");
        PhaseContract plan = contract.phases().get("plan");
        PhaseContract implement = contract.phases().get("implement");

        // Then
        FieldSpec title = plan.entry().required().get(0);
        assertThat(title.name()).isEqualTo("request.title");
        assertThat(title.severity()).isEqualTo(ConstraintSeverity.BLOCKING);
        assertThat(title.type()).isEqualTo("str");

        FieldSpec language = plan.entry().enrichment().get(0);
        assertThat(language.severity()).isEqualTo(ConstraintSeverity.WARNING);
        assertThat(language.defaultValue()).isEqualTo("python");
        assertThat(plan.entry().enrichment().get(1).defaultValue()).isEqualTo(List.of());

        assertThat(plan.exit().optional()).extracting(FieldSpec::name).containsExactly("plan.risks");
        assertThat(implement.entry().required().get(1).severity()).isEqualTo(ConstraintSeverity.WARNING);

        FieldSpec files = implement.exit().required().get(0);
        assertThat(files.type()).isEqualTo("list");
        assertThat(files.sourcePhase()).isEqualTo("implement");
    }

    @Test
    void loadResource_Chains_MappedWithSeverityDefaults() {
        // When
        ContextContract contract = loader.loadResource("contracts/sdlc-contract.yaml");

        // Then
        assertThat(contract.propagationChains()).hasSize(2);
        PropagationChainSpec domain = contract.propagationChains().get(0);
        assertThat(domain.severity()).isEqualTo(ConstraintSeverity.BLOCKING);
        assertThat(domain.verification()).isEqualTo("source == dest");
        assertThat(domain.source()).isEqualTo(ChainEndpoint.of("plan", "domain"));

        PropagationChainSpec title = contract.propagationChains().get(1);
        assertThat(title.severity()).isEqualTo(ConstraintSeverity.WARNING);
        assertThat(title.hasVerification()).isFalse();
        assertThat(title.waypoints()).containsExactly(ChainEndpoint.of("plan", "request.title"));
    }

    // ============================================================
    // Authoring errors
    // ============================================================

    @Nested
    class AuthoringErrors {

        @Test
        void loadResource_UnknownKey_Rejected() {
            // When & Then
            assertThatThrownBy(() -> loader.loadResource("contracts/unknown-key.yaml"))
                .isInstanceOf(ContractLoadException.class)
                .hasMessageContaining("unknown key 'requried'");
        }

        @Test
        void loadFromString_MissingPipelineId_Rejected() {
            // When & Then
            assertThatThrownBy(() -> loader.loadFromString("schema_version: '1.0'\nphases: {}\n"))
                .isInstanceOf(ContractLoadException.class)
                .hasMessage("Failed to load contract from <string>: missing required key 'pipeline_id'");
        }

        @Test
        void loadFromString_FieldWithoutName_ReportsLocation() {
            // Given
            String yaml = String.join("\n",
                "schema_version: '1.0'",
                "pipeline_id: p",
                "phases:",
                "  plan:",
                "    entry:",
                "      required:",
                "        - severity: warning");

            // When & Then
            assertThatThrownBy(() -> loader.loadFromString(yaml))
                .isInstanceOf(ContractLoadException.class)
                .hasMessageContaining("phases.plan.entry.required[0].name");
        }

        @Test
        void loadFromString_InvalidSeverity_Rejected() {
            // Given
            String yaml = String.join("\n",
                "schema_version: '1.0'",
                "pipeline_id: p",
                "phases:",
                "  plan:",
                "    exit:",
                "      required:",
                "        - name: summary",
                "          severity: fatal");

            // When & Then
            assertThatThrownBy(() -> loader.loadFromString(yaml))
                .isInstanceOf(ContractLoadException.class)
                .hasMessageContaining("Unknown severity: 'fatal'");
        }

        @Test
        void loadFromString_BadVerification_RejectedAtLoadTime() {
            // Given
            String yaml = String.join("\n",
                "schema_version: '1.0'",
                "pipeline_id: p",
                "propagation_chains:",
                "  - chain_id: c1",
                "    source: { phase: a, field: x }",
                "    destination: { phase: b, field: x }",
                "    verification: \"__import__('os')\"");

            // When & Then
            assertThatThrownBy(() -> loader.loadFromString(yaml))
                .isInstanceOf(ContractLoadException.class)
                .hasMessageContaining("propagation_chains[0] (c1)")
                .hasCauseInstanceOf(VerificationSyntaxException.class);
        }

        @Test
        void loadFromString_DuplicateChainId_Rejected() {
            // Given
            String yaml = String.join("\n",
                "schema_version: '1.0'",
                "pipeline_id: p",
                "propagation_chains:",
                "  - chain_id: c1",
                "    source: { phase: a, field: x }",
                "    destination: { phase: b, field: x }",
                "  - chain_id: c1",
                "    source: { phase: a, field: y }",
                "    destination: { phase: b, field: y }");

            // When & Then
            assertThatThrownBy(() -> loader.loadFromString(yaml))
                .isInstanceOf(ContractLoadException.class)
                .hasMessageContaining("Duplicate chainId: c1");
        }

        @Test
        void loadFromString_RootIsSequence_Rejected() {
            // When & Then
            assertThatThrownBy(() -> loader.loadFromString("- plan\n- implement\n"))
                .isInstanceOf(ContractLoadException.class);
        }

        @Test
        void loadResource_Missing_Rejected() {
            // When & Then
            assertThatThrownBy(() -> loader.loadResource("contracts/absent.yaml"))
                .isInstanceOf(ContractLoadException.class)
                .hasMessage("Failed to load contract from classpath:contracts/absent.yaml: resource not found");
        }
    }

    // ============================================================
    // File loading and cache
    // ============================================================

    @Nested
    class FileLoading {

        @TempDir
        Path tempDir;

        @Test
        void load_SamePathTwice_ReturnsCachedInstance() throws IOException {
            // Given
            Path file = writeContract("contract.yaml", "pipeline-a");

            // When
            ContextContract first = loader.load(file);
            ContextContract second = loader.load(tempDir.resolve("./contract.yaml"));

            // Then
            assertThat(second).isSameAs(first);
            assertThat(loader.cacheSize()).isEqualTo(1);
        }

        @Test
        void clearCache_ReloadsChangedFile() throws IOException {
            // Given
            Path file = writeContract("contract.yaml", "pipeline-a");
            loader.load(file);
            writeContract("contract.yaml", "pipeline-b");

            // When
            ContextContract stale = loader.load(file);
            loader.clearCache();
            ContextContract fresh = loader.load(file);

            // Then
            assertThat(stale.pipelineId()).isEqualTo("pipeline-a");
            assertThat(fresh.pipelineId()).isEqualTo("pipeline-b");
        }

        @Test
        void load_MissingFile_NamesPath() {
            // Given
            Path missing = tempDir.resolve("missing.yaml");

            // When & Then
            assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(ContractLoadException.class)
                .hasMessageContaining("missing.yaml")
                .hasMessageEndingWith("file not found")
                .satisfies(e -> assertThat(((ContractLoadException) e).getSource())
                    .isEqualTo(missing.toAbsolutePath().normalize().toString()));
        }

        @Test
        void loadFromString_NeverCached() {
            // When
            loader.loadFromString("schema_version: '1.0'\npipeline_id: p\n");

            // Then
            assertThat(loader.cacheSize()).isZero();
        }

        private Path writeContract(String name, String pipelineId) throws IOException {
            return Files.writeString(tempDir.resolve(name),
                "schema_version: '1.0'\npipeline_id: " + pipelineId + "\n");
        }
    }
}
