package com.ryuqq.contextguard.testkit.contract;

import com.ryuqq.contextguard.adapter.yaml.YamlContractLoader;
import com.ryuqq.contextguard.core.model.ChainEndpoint;
import com.ryuqq.contextguard.core.model.ContextContract;
import com.ryuqq.contextguard.core.model.FieldSpec;
import com.ryuqq.contextguard.core.model.PhaseContract;
import com.ryuqq.contextguard.core.model.PhaseEntryContract;
import com.ryuqq.contextguard.core.model.PhaseExitContract;
import com.ryuqq.contextguard.core.model.PropagationChainSpec;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ready-made contracts and contexts for contract tests.
 *
 * <p><strong>Contracts:</strong></p>
 * <ul>
 *   <li>{@link #planOnlyContract()}: one phase {@code plan} requiring {@code domain} (BLOCKING)
 *       and producing {@code plan_output} (BLOCKING)</li>
 *   <li>{@link #singleChainContract()}: {@code seed} and {@code plan} with the chain
 *       {@code seed.domain → plan.domain}</li>
 *   <li>{@link #noChainContract()}: same phases, no chains</li>
 *   <li>{@link #sdlcContract()}: the four-phase pipeline loaded from {@value #SDLC_RESOURCE}</li>
 * </ul>
 *
 * <p>Every context factory returns a new mutable map.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class ContractFixtures {

    /**
     * Classpath location of the four-phase pipeline contract.
     */
    public static final String SDLC_RESOURCE = "contracts/sdlc-pipeline.yaml";

    public static final String SINGLE_CHAIN_ID = "seed_domain_to_plan";

    private static final YamlContractLoader LOADER = new YamlContractLoader();

    private ContractFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ContextContract planOnlyContract() {
        return ContextContract.builder("plan-only", "1.0")
            .phase("plan", PhaseContract.of(
                new PhaseEntryContract(List.of(FieldSpec.blocking("domain")), List.of()),
                new PhaseExitContract(List.of(FieldSpec.blocking("plan_output")), List.of())))
            .build();
    }

    public static ContextContract singleChainContract() {
        return twoPhases("single-chain")
            .chain(PropagationChainSpec.of(SINGLE_CHAIN_ID,
                ChainEndpoint.of("seed", "domain"), ChainEndpoint.of("plan", "domain")))
            .build();
    }

    public static ContextContract noChainContract() {
        return twoPhases("no-chain").build();
    }

    /**
     * Loads the four-phase pipeline contract (seed, plan, implement, verify).
     *
     * @return ContextContract
     */
    public static ContextContract sdlcContract() {
        return LOADER.loadResource(SDLC_RESOURCE);
    }

    /**
     * Final context in which every phase of {@link #singleChainContract()} produced its output.
     *
     * @return mutable context
     */
    public static Map<String, Object> singleChainFinalContext() {
        Map<String, Object> context = new HashMap<>();
        context.put("domain", "web_app");
        context.put("seed_output", "s");
        context.put("plan_output", "p");
        return context;
    }

    /**
     * Final context in which every phase of {@link #sdlcContract()} produced its output.
     *
     * @return mutable context
     */
    public static Map<String, Object> sdlcFinalContext() {
        Map<String, Object> context = new HashMap<>();
        context.put("domain", "web_app");
        context.put("seed_output", "request classified");
        context.put("language", "java");
        context.put("plan_output", "add login form");
        context.put("impl_output", List.of("LoginForm.java"));
        context.put("verdict", "pass");
        return context;
    }

    private static ContextContract.Builder twoPhases(String pipelineId) {
        return ContextContract.builder(pipelineId, "1.0")
            .phase("seed", PhaseContract.of(
                PhaseEntryContract.empty(),
                new PhaseExitContract(List.of(FieldSpec.blocking("domain"), FieldSpec.warning("seed_output")),
                    List.of())))
            .phase("plan", PhaseContract.of(
                new PhaseEntryContract(List.of(FieldSpec.blocking("domain")), List.of()),
                new PhaseExitContract(List.of(FieldSpec.blocking("plan_output")), List.of())));
    }
}
