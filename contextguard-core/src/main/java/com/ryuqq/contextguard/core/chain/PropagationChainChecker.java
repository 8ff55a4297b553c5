package com.ryuqq.contextguard.core.chain;

import com.ryuqq.contextguard.core.context.ExecutionContext;
import com.ryuqq.contextguard.core.context.FieldLookup;
import com.ryuqq.contextguard.core.model.ChainEndpoint;
import com.ryuqq.contextguard.core.model.ChainStatus;
import com.ryuqq.contextguard.core.model.ContextContract;
import com.ryuqq.contextguard.core.model.PropagationChainSpec;
import com.ryuqq.contextguard.core.verification.VerificationBindings;
import com.ryuqq.contextguard.core.verification.VerificationExpression;
import com.ryuqq.contextguard.core.verification.VerificationSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 전파 체인 무결성 검사기.
 *
 * <p><strong>판정 순서:</strong></p>
 * <ol>
 *   <li>source 필드 없음 → BROKEN</li>
 *   <li>검증식이 있으면 평가, 실패 → BROKEN</li>
 *   <li>destination 없음 또는 기본값/빈 값 → DEGRADED</li>
 *   <li>그 외 → INTACT</li>
 * </ol>
 *
 * <p>파싱된 검증식은 문자열 단위로 캐시합니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class PropagationChainChecker {

    private static final Logger log = LoggerFactory.getLogger(PropagationChainChecker.class);

    private final Map<String, VerificationExpression> expressions = new ConcurrentHashMap<>();

    /**
     * 단일 체인 검사.
     *
     * @param chain 체인 선언
     * @param context 최종 컨텍스트
     * @return 검사 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PropagationChainResult check(PropagationChainSpec chain, ExecutionContext context) {
        if (chain == null) {
            throw new IllegalArgumentException("chain cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        ChainEndpoint source = chain.source();
        ChainEndpoint destination = chain.destination();
        FieldLookup sourceLookup = context.lookup(source.field());
        FieldLookup destLookup = context.lookup(destination.field());

        List<Boolean> waypointsPresent = new ArrayList<>(chain.waypoints().size());
        for (ChainEndpoint waypoint : chain.waypoints()) {
            waypointsPresent.add(context.lookup(waypoint.field()).isPresent());
        }

        if (!sourceLookup.isPresent()) {
            return result(chain, ChainStatus.BROKEN, false, destLookup.isPresent(), waypointsPresent,
                "Source field '" + source.field() + "' absent at phase '" + source.phase() + "'");
        }

        if (chain.hasVerification()) {
            String failure = verify(chain, sourceLookup, destLookup, context);
            if (failure != null) {
                return result(chain, ChainStatus.BROKEN, true, destLookup.isPresent(), waypointsPresent, failure);
            }
        }

        if (destLookup.isDefault()) {
            String reason = destLookup.isPresent() ? "has default/empty value" : "absent";
            return result(chain, ChainStatus.DEGRADED, true, destLookup.isPresent(), waypointsPresent,
                "Destination field '" + destination.field() + "' " + reason + " at phase '" + destination.phase() + "'");
        }

        return result(chain, ChainStatus.INTACT, true, true, waypointsPresent, "Chain intact");
    }

    /**
     * 계약의 모든 체인 검사 (선언 순서).
     *
     * @param contract 계약
     * @param context 최종 컨텍스트
     * @return 체인별 결과
     */
    public List<PropagationChainResult> checkAll(ContextContract contract, ExecutionContext context) {
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }
        List<PropagationChainResult> results = new ArrayList<>(contract.propagationChains().size());
        for (PropagationChainSpec chain : contract.propagationChains()) {
            PropagationChainResult result = check(chain, context);
            results.add(result);
            if (!result.isIntact()) {
                log.warn("Chain {}: {} ({})", result.chainId(), result.status(), result.message());
            }
        }
        return results;
    }

    private String verify(PropagationChainSpec chain, FieldLookup source, FieldLookup dest, ExecutionContext context) {
        VerificationExpression expression;
        try {
            expression = expressions.computeIfAbsent(chain.verification(), VerificationExpression::parse);
        } catch (VerificationSyntaxException e) {
            log.warn("Chain {} verification expression error: {}", chain.chainId(), e.getMessage());
            return "Verification error: " + e.getMessage();
        }

        boolean satisfied = expression.evaluate(new VerificationBindings(source.value(), dest.value(), context));
        return satisfied ? null : "Verification failed: " + chain.verification();
    }

    private static PropagationChainResult result(PropagationChainSpec chain, ChainStatus status,
                                                 boolean sourcePresent, boolean destinationPresent,
                                                 List<Boolean> waypointsPresent, String message) {
        return new PropagationChainResult(chain.chainId(), status, chain.source().phase(),
            chain.destination().phase(), sourcePresent, destinationPresent, waypointsPresent, message);
    }
}
