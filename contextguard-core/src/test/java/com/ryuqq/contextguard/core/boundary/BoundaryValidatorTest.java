package com.ryuqq.contextguard.core.boundary;

import com.ryuqq.contextguard.core.context.ExecutionContext;
import com.ryuqq.contextguard.core.model.ConstraintSeverity;
import com.ryuqq.contextguard.core.model.ContextContract;
import com.ryuqq.contextguard.core.model.FieldSpec;
import com.ryuqq.contextguard.core.model.PhaseContract;
import com.ryuqq.contextguard.core.model.PhaseEntryContract;
import com.ryuqq.contextguard.core.model.PhaseExitContract;
import com.ryuqq.contextguard.core.model.PropagationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BoundaryValidator 테스트.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
class BoundaryValidatorTest {

    private BoundaryValidator validator;
    private ContextContract contract;

    @BeforeEach
    void setUp() {
        validator = new BoundaryValidator();
        contract = ContextContract.builder("artisan", "0.2.0")
            .phase("plan", PhaseContract.of(
                new PhaseEntryContract(
                    List.of(
                        FieldSpec.blocking("domain"),
                        FieldSpec.of("language", ConstraintSeverity.WARNING, "python"),
                        FieldSpec.warning("owner"),
                        FieldSpec.advisory("notes")),
                    List.of(
                        FieldSpec.of("config.retries", ConstraintSeverity.WARNING, 3),
                        FieldSpec.of("config.theme", ConstraintSeverity.ADVISORY, "dark"))),
                new PhaseExitContract(List.of(FieldSpec.blocking("plan")), List.of())))
            .build();
    }

    @Test
    void validateEntry_AllPresent_Passes() {
        // Given
        ExecutionContext context = ExecutionContext.copyOf(Map.of(
            "domain", "web", "language", "java", "owner", "team-a", "notes", "n/a"));

        // When
        ContractValidationResult result = validator.validateEntry("plan", context, contract);

        // Then
        assertThat(result.passed()).isTrue();
        assertThat(result.propagationStatus()).isEqualTo(PropagationStatus.PROPAGATED);
        assertThat(result.warnings()).isEmpty();
        assertThat(result.fieldResults()).hasSize(4);
        assertThat(result.direction()).isEqualTo(BoundaryDirection.ENTRY);
    }

    @Test
    void validateEntry_BlockingMissing_FailsWithFieldName() {
        // Given
        ExecutionContext context = ExecutionContext.copyOf(Map.of("language", "java", "owner", "a", "notes", "b"));

        // When
        ContractValidationResult result = validator.validateEntry("plan", context, contract);

        // Then
        assertThat(result.passed()).isFalse();
        assertThat(result.blockingFailures()).containsExactly("domain");
        assertThat(result.propagationStatus()).isEqualTo(PropagationStatus.FAILED);
        assertThat(result.fieldResults().get(0).message()).isEqualTo("Required field 'domain' is missing");
    }

    @Test
    void validateEntry_BlockingNullValue_FailsAsMissing() {
        // Given
        Map<String, Object> values = new HashMap<>(Map.of("language", "java", "owner", "a", "notes", "b"));
        values.put("domain", null);

        // When
        ContractValidationResult result = validator.validateEntry("plan", ExecutionContext.wrap(values), contract);

        // Then
        assertThat(result.passed()).isFalse();
        assertThat(result.blockingFailures()).containsExactly("domain");
    }

    @Test
    void validateEntry_WarningWithDefault_AppliesDefaultIntoContext() {
        // Given
        Map<String, Object> values = new HashMap<>(Map.of("domain", "web", "owner", "a", "notes", "b"));
        ExecutionContext context = ExecutionContext.wrap(values);

        // When
        ContractValidationResult result = validator.validateEntry("plan", context, contract);

        // Then
        assertThat(result.passed()).isTrue();
        assertThat(values).containsEntry("language", "python");
        assertThat(result.defaultsApplied()).isEqualTo(1);
        assertThat(result.fieldResults())
            .filteredOn(f -> f.field().equals("language"))
            .extracting(FieldValidationResult::status)
            .containsExactly(PropagationStatus.DEFAULTED);
        assertThat(result.propagationStatus()).isEqualTo(PropagationStatus.PARTIAL);
        assertThat(result.warnings()).containsExactly("language: Field 'language' defaulted to 'python'");
    }

    @Test
    void validateEntry_WarningAndAdvisoryWithoutDefault_ReportsWarningsOnly() {
        // Given
        ExecutionContext context = ExecutionContext.copyOf(Map.of("domain", "web", "language", "go"));

        // When
        ContractValidationResult result = validator.validateEntry("plan", context, contract);

        // Then
        assertThat(result.passed()).isTrue();
        assertThat(result.blockingFailures()).isEmpty();
        assertThat(result.warnings()).containsExactly(
            "owner: Field 'owner' is missing (no default)",
            "notes: Advisory: field 'notes' is absent");
        assertThat(result.propagationStatus()).isEqualTo(PropagationStatus.PARTIAL);
        assertThat(result.defaultsApplied()).isZero();
    }

    @Test
    void validateEnrichment_WarningDefault_SetsNestedPath() {
        // Given
        ExecutionContext context = ExecutionContext.empty();

        // When
        ContractValidationResult result = validator.validateEnrichment("plan", context, contract);

        // Then
        assertThat(result.passed()).isTrue();
        assertThat(context.get("config.retries")).isEqualTo(3);
        assertThat(result.direction()).isEqualTo(BoundaryDirection.ENRICHMENT);
    }

    @Test
    void validateEnrichment_AdvisoryWithDefault_LeavesContextUntouched() {
        // Given
        ExecutionContext context = ExecutionContext.empty();

        // When
        ContractValidationResult result = validator.validateEnrichment("plan", context, contract);

        // Then
        assertThat(context.lookup("config.theme").isPresent()).isFalse();
        assertThat(result.defaultsApplied()).isEqualTo(1);
        assertThat(result.warnings()).containsExactly(
            "config.retries: Field 'config.retries' defaulted to 3",
            "config.theme: Advisory: field 'config.theme' is absent");
        assertThat(result.propagationStatus()).isEqualTo(PropagationStatus.PARTIAL);
    }

    @Test
    void validateExit_UsesExitRequiredFields() {
        // When
        ContractValidationResult result = validator.validateExit("plan", ExecutionContext.empty(), contract);

        // Then
        assertThat(result.passed()).isFalse();
        assertThat(result.blockingFailures()).containsExactly("plan");
    }

    @Test
    void validate_UnknownPhase_ReturnsEmptyPass() {
        // When
        ContractValidationResult result = validator.validateEntry("deploy", ExecutionContext.empty(), contract);

        // Then
        assertThat(result.passed()).isTrue();
        assertThat(result.fieldResults()).isEmpty();
        assertThat(result.propagationStatus()).isEqualTo(PropagationStatus.PROPAGATED);
    }

    @Test
    void validate_NullContext_ThrowsException() {
        assertThatThrownBy(() -> validator.validateEntry("plan", null, contract))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("context cannot be null");
    }

    @Test
    void result_PassedMismatch_ThrowsException() {
        assertThatThrownBy(() -> new ContractValidationResult(true, "plan", BoundaryDirection.ENTRY,
            List.of(), List.of("domain"), List.of(), PropagationStatus.FAILED))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
