package com.ryuqq.contextguard.core.verification;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * 파싱된 전파 체인 검증식.
 *
 * <p>임의 코드 실행을 막기 위해 닫힌 문법만 허용합니다:</p>
 * <pre>
 * expr       := or
 * or         := and ("or" and)*
 * and        := not ("and" not)*
 * not        := "not" not | comparison
 * comparison := operand (("==" | "!=") operand | "is" ["not"] "None")?
 * operand    := "source" | "dest" | "context" ("." ident)*
 *             | STRING | NUMBER | "True" | "False" | "None" | "(" expr ")"
 * </pre>
 *
 * <p><strong>평가 규칙:</strong></p>
 * <ul>
 *   <li>단독 operand는 truthiness로 판정 (null, false, 0, 빈 문자열/컬렉션은 false)</li>
 *   <li>숫자는 표현(정수/실수)과 무관하게 값으로 비교</li>
 *   <li>{@code true/false/null} 은 {@code True/False/None} 의 별칭</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * VerificationExpression expr = VerificationExpression.parse("source == dest");
 * boolean ok = expr.evaluate(new VerificationBindings("web", "web", context));
 * </pre>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class VerificationExpression {

    /**
     * 평가 가능한 AST 노드.
     */
    interface Node {
        Object evaluate(VerificationBindings bindings);
    }

    private final String text;
    private final Node root;

    VerificationExpression(String text, Node root) {
        this.text = text;
        this.root = root;
    }

    /**
     * 검증식 파싱.
     *
     * @param text 검증식 문자열
     * @return 파싱된 검증식
     * @throws VerificationSyntaxException 문법 오류인 경우
     */
    public static VerificationExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new VerificationSyntaxException(String.valueOf(text), 0, "expression cannot be empty");
        }
        return new VerificationExpression(text, new VerificationParser(text).parse());
    }

    /**
     * 검증식 평가.
     *
     * @param bindings 변수 바인딩
     * @return 결과의 truthiness
     * @throws IllegalArgumentException bindings가 null인 경우
     */
    public boolean evaluate(VerificationBindings bindings) {
        if (bindings == null) {
            throw new IllegalArgumentException("bindings cannot be null");
        }
        return isTruthy(root.evaluate(bindings));
    }

    public String text() {
        return text;
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            Number number = (Number) value;
            if (isNonFinite(number)) {
                return true;
            }
            return toDecimal(number).signum() != 0;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            Number l = (Number) left;
            Number r = (Number) right;
            if (isNonFinite(l) || isNonFinite(r)) {
                return l.doubleValue() == r.doubleValue();
            }
            return toDecimal(l).compareTo(toDecimal(r)) == 0;
        }
        return Objects.equals(left, right);
    }

    private static boolean isNonFinite(Number number) {
        return (number instanceof Double || number instanceof Float)
            && !Double.isFinite(number.doubleValue());
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }

    @Override
    public String toString() {
        return "VerificationExpression{" + text + '}';
    }
}
