package com.ryuqq.contextguard.core.verification;

import com.ryuqq.contextguard.core.context.ExecutionContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * VerificationExpression 파싱/평가 테스트.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
class VerificationExpressionTest {

    private static boolean eval(String expression, Object source, Object dest) {
        return eval(expression, source, dest, ExecutionContext.empty());
    }

    private static boolean eval(String expression, Object source, Object dest, ExecutionContext context) {
        return VerificationExpression.parse(expression).evaluate(new VerificationBindings(source, dest, context));
    }

    @Test
    void equality_SameValues_True() {
        assertThat(eval("source == dest", "web", "web")).isTrue();
        assertThat(eval("source != dest", "web", "web")).isFalse();
        assertThat(eval("source == dest", "web", "mobile")).isFalse();
    }

    @Test
    void equality_NumbersCompareByValue() {
        assertThat(eval("source == dest", 1, 1.0)).isTrue();
        assertThat(eval("dest == 3", null, 3L)).isTrue();
        assertThat(eval("dest == 2.50", null, 2.5)).isTrue();
    }

    @Test
    void isNone_ChecksNull() {
        assertThat(eval("dest is None", "x", null)).isTrue();
        assertThat(eval("dest is not None", "x", "y")).isTrue();
        assertThat(eval("dest is null", "x", "y")).isFalse();
    }

    @Test
    void booleanOperators_CombineAndNegate() {
        assertThat(eval("source == 'web' and dest == 'web'", "web", "web")).isTrue();
        assertThat(eval("source == 'web' and not dest", "web", "")).isTrue();
        assertThat(eval("(source == 'a' or source == 'b') and dest != None", "b", "x")).isTrue();
        assertThat(eval("not (source == dest)", "a", "a")).isFalse();
    }

    @Test
    void bareOperand_UsesTruthiness() {
        assertThat(eval("dest", null, List.of())).isFalse();
        assertThat(eval("dest", null, List.of("x"))).isTrue();
        assertThat(eval("dest", null, 0)).isFalse();
        assertThat(eval("True", null, null)).isTrue();
        assertThat(eval("false", null, null)).isFalse();
    }

    @Test
    void contextPath_ResolvesFromContext() {
        // Given
        ExecutionContext context = ExecutionContext.copyOf(Map.of("config", Map.of("mode", "fast")));

        // When & Then
        assertThat(eval("context.config.mode == \"fast\"", null, null, context)).isTrue();
        assertThat(eval("context.config.missing is None", null, null, context)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "source ==",
        "__import__('os')",
        "source = dest",
        "(source == dest",
        "context",
        "source == 'open",
        "dest is 'x'",
        "source; dest"
    })
    void parse_InvalidSyntax_ThrowsSyntaxException(String expression) {
        assertThatThrownBy(() -> VerificationExpression.parse(expression))
            .isInstanceOf(VerificationSyntaxException.class)
            .hasMessageContaining("Invalid verification expression");
    }

    @Test
    void parse_Blank_ThrowsSyntaxException() {
        assertThatThrownBy(() -> VerificationExpression.parse(" "))
            .isInstanceOf(VerificationSyntaxException.class);
    }

    @Test
    void syntaxException_ReportsPosition() {
        // When
        VerificationSyntaxException exception = org.junit.jupiter.api.Assertions.assertThrows(
            VerificationSyntaxException.class,
            () -> VerificationExpression.parse("source == dest extra")
        );

        // Then
        assertThat(exception.getPosition()).isEqualTo(15);
        assertThat(exception.getExpression()).isEqualTo("source == dest extra");
    }
}
