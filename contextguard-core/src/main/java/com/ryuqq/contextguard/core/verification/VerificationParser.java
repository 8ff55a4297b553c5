package com.ryuqq.contextguard.core.verification;

import com.ryuqq.contextguard.core.verification.VerificationExpression.Node;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 검증식 재귀 하강 파서.
 *
 * <p>토큰화 후 {@link VerificationExpression} 의 문법에 따라 AST를 구성합니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
final class VerificationParser {

    private enum TokenType { IDENT, STRING, NUMBER, EQ, NE, LPAREN, RPAREN, DOT, EOF }

    private record Token(TokenType type, String text, int position) {
    }

    private final String text;
    private final List<Token> tokens;
    private int index;

    VerificationParser(String text) {
        this.text = text;
        this.tokens = tokenize(text);
    }

    Node parse() {
        Node node = parseOr();
        Token next = peek();
        if (next.type() != TokenType.EOF) {
            throw error(next, "unexpected token '" + next.text() + "'");
        }
        return node;
    }

    // ============================================================
    // Grammar
    // ============================================================

    private Node parseOr() {
        Node left = parseAnd();
        while (acceptKeyword("or")) {
            Node l = left;
            Node r = parseAnd();
            left = b -> VerificationExpression.isTruthy(l.evaluate(b)) || VerificationExpression.isTruthy(r.evaluate(b));
        }
        return left;
    }

    private Node parseAnd() {
        Node left = parseNot();
        while (acceptKeyword("and")) {
            Node l = left;
            Node r = parseNot();
            left = b -> VerificationExpression.isTruthy(l.evaluate(b)) && VerificationExpression.isTruthy(r.evaluate(b));
        }
        return left;
    }

    private Node parseNot() {
        if (acceptKeyword("not")) {
            Node operand = parseNot();
            return b -> !VerificationExpression.isTruthy(operand.evaluate(b));
        }
        return parseComparison();
    }

    private Node parseComparison() {
        Node left = parseOperand();
        Token next = peek();
        if (next.type() == TokenType.EQ || next.type() == TokenType.NE) {
            index++;
            Node right = parseOperand();
            boolean negate = next.type() == TokenType.NE;
            return b -> negate != VerificationExpression.valuesEqual(left.evaluate(b), right.evaluate(b));
        }
        if (acceptKeyword("is")) {
            boolean negate = acceptKeyword("not");
            Token none = advance();
            if (!isNullLiteral(none)) {
                throw error(none, "expected None after 'is'");
            }
            return b -> negate != (left.evaluate(b) == null);
        }
        return left;
    }

    private Node parseOperand() {
        Token token = advance();
        switch (token.type()) {
            case STRING: {
                String value = token.text();
                return b -> value;
            }
            case NUMBER: {
                BigDecimal value = new BigDecimal(token.text());
                return b -> value;
            }
            case LPAREN: {
                Node inner = parseOr();
                Token close = advance();
                if (close.type() != TokenType.RPAREN) {
                    throw error(close, "expected ')'");
                }
                return inner;
            }
            case IDENT:
                return parseIdentifier(token);
            default:
                throw error(token, token.type() == TokenType.EOF
                    ? "unexpected end of expression"
                    : "unexpected token '" + token.text() + "'");
        }
    }

    private Node parseIdentifier(Token token) {
        switch (token.text()) {
            case "source":
                return VerificationBindings::source;
            case "dest":
                return VerificationBindings::dest;
            case "True":
            case "true":
                return b -> Boolean.TRUE;
            case "False":
            case "false":
                return b -> Boolean.FALSE;
            case "None":
            case "null":
                return b -> null;
            case "context":
                return parseContextPath();
            default:
                throw error(token, "unknown identifier '" + token.text() + "'");
        }
    }

    private Node parseContextPath() {
        List<String> parts = new ArrayList<>();
        while (peek().type() == TokenType.DOT) {
            index++;
            Token part = advance();
            if (part.type() != TokenType.IDENT) {
                throw error(part, "expected field name after '.'");
            }
            parts.add(part.text());
        }
        if (parts.isEmpty()) {
            throw error(peek(), "'context' must be followed by a field path");
        }
        String path = String.join(".", parts);
        return b -> b.context().get(path);
    }

    // ============================================================
    // Token helpers
    // ============================================================

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (token.type() != TokenType.EOF) {
            index++;
        }
        return token;
    }

    private boolean acceptKeyword(String keyword) {
        Token token = peek();
        if (token.type() == TokenType.IDENT && token.text().equals(keyword)) {
            index++;
            return true;
        }
        return false;
    }

    private static boolean isNullLiteral(Token token) {
        return token.type() == TokenType.IDENT && ("None".equals(token.text()) || "null".equals(token.text()));
    }

    private VerificationSyntaxException error(Token token, String message) {
        return new VerificationSyntaxException(text, token.position(), message);
    }

    // ============================================================
    // Tokenizer
    // ============================================================

    private List<Token> tokenize(String input) {
        List<Token> result = new ArrayList<>();
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                result.add(new Token(TokenType.LPAREN, "(", i++));
            } else if (c == ')') {
                result.add(new Token(TokenType.RPAREN, ")", i++));
            } else if (c == '.') {
                result.add(new Token(TokenType.DOT, ".", i++));
            } else if (c == '=' || c == '!') {
                if (i + 1 >= input.length() || input.charAt(i + 1) != '=') {
                    throw new VerificationSyntaxException(input, i, "expected '==' or '!='");
                }
                result.add(new Token(c == '=' ? TokenType.EQ : TokenType.NE, c + "=", i));
                i += 2;
            } else if (c == '\'' || c == '"') {
                i = readString(input, i, result);
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < input.length() && Character.isDigit(input.charAt(i + 1)))) {
                i = readNumber(input, i, result);
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < input.length() && (Character.isLetterOrDigit(input.charAt(i)) || input.charAt(i) == '_')) {
                    i++;
                }
                result.add(new Token(TokenType.IDENT, input.substring(start, i), start));
            } else {
                throw new VerificationSyntaxException(input, i, "unexpected character '" + c + "'");
            }
        }
        result.add(new Token(TokenType.EOF, "", input.length()));
        return result;
    }

    private static int readString(String input, int start, List<Token> out) {
        char quote = input.charAt(start);
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\\' && i + 1 < input.length()) {
                value.append(input.charAt(i + 1));
                i += 2;
            } else if (c == quote) {
                out.add(new Token(TokenType.STRING, value.toString(), start));
                return i + 1;
            } else {
                value.append(c);
                i++;
            }
        }
        throw new VerificationSyntaxException(input, start, "unterminated string literal");
    }

    private static int readNumber(String input, int start, List<Token> out) {
        int i = start + 1;
        boolean seenDot = false;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (Character.isDigit(c)) {
                i++;
            } else if (c == '.' && !seenDot && i + 1 < input.length() && Character.isDigit(input.charAt(i + 1))) {
                seenDot = true;
                i++;
            } else {
                break;
            }
        }
        out.add(new Token(TokenType.NUMBER, input.substring(start, i), start));
        return i;
    }
}
