package com.ryuqq.contextguard.core.verification;

import com.ryuqq.contextguard.core.context.ExecutionContext;

/**
 * 검증식 평가 시 사용할 변수 바인딩.
 *
 * @param source 해석된 source 값 (null 허용)
 * @param dest 해석된 destination 값 (null 허용)
 * @param context 최종 컨텍스트 ({@code context.x.y} 참조용)
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public record VerificationBindings(Object source, Object dest, ExecutionContext context) {

    public VerificationBindings {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
    }
}
