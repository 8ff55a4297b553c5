package com.ryuqq.contextguard.core.verification;

/**
 * 검증식 문법 오류.
 *
 * <p>계약 작성 오류(authoring error)이므로 계약 로드 시점에 발견되는 것이 바람직합니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public class VerificationSyntaxException extends IllegalArgumentException {

    private final String expression;
    private final int position;

    /**
     * 생성자.
     *
     * @param expression 원본 검증식
     * @param position 오류 위치 (0부터 시작)
     * @param message 오류 설명
     */
    public VerificationSyntaxException(String expression, int position, String message) {
        super(String.format("Invalid verification expression '%s' at position %d: %s",
            expression, position, message));
        this.expression = expression;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }
}
