package com.trustplatform.common.engine;

import com.trustplatform.common.context.ContextEvaluator;
import com.trustplatform.common.decision.DecisionClassifier;
import com.trustplatform.common.factor.FactorRegistry;
import com.trustplatform.common.model.Decision;
import com.trustplatform.common.model.EvaluationInput;
import com.trustplatform.common.model.EvaluationResult;
import com.trustplatform.common.model.Policy;
import com.trustplatform.common.model.PolicyConfig;
import com.trustplatform.common.model.PostureFacts;
import com.trustplatform.common.model.ScoreDetail;
import com.trustplatform.common.policy.PolicyResolver;
import com.trustplatform.common.posture.PostureEvaluator;
import com.trustplatform.common.policy.ResolvedPolicy;
import com.trustplatform.common.scoring.NormalizedWeightedTrustScorer;
import com.trustplatform.common.scoring.ScoreBreakdown;
import com.trustplatform.common.scoring.TrustScorer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composes the evaluators, policy resolution, scoring and classification into one
 * request → decision call.
 *
 * <h3>Flow</h3>
 * <ol>
 *   <li>{@link PostureEvaluator} on the device's checkpoint facts</li>
 *   <li>{@link ContextEvaluator} on the client IP and attempt timestamp</li>
 *   <li>{@link PolicyResolver} on the active policies, falling back to {@link PolicyConfig}</li>
 *   <li>{@link TrustScorer} on both factor scores</li>
 *   <li>{@link DecisionClassifier} on the total and the resolved threshold</li>
 * </ol>
 *
 * <p>Never persists and never notifies; the caller owns the returned {@link EvaluationResult}.
 * Holds no mutable state, so concurrent calls need no locking. For identical inputs, facts and
 * policies the result is identical.
 */
public class TrustEvaluationEngine {

    private final PostureEvaluator postureEvaluator;
    private final ContextEvaluator contextEvaluator;
    private final PolicyResolver policyResolver;
    private final TrustScorer trustScorer;
    private final FactorRegistry factorRegistry;

    public TrustEvaluationEngine(PostureEvaluator postureEvaluator,
                                 ContextEvaluator contextEvaluator,
                                 PolicyResolver policyResolver,
                                 TrustScorer trustScorer,
                                 FactorRegistry factorRegistry) {
        this.postureEvaluator = postureEvaluator;
        this.contextEvaluator = contextEvaluator;
        this.policyResolver   = policyResolver;
        this.trustScorer      = trustScorer;
        this.factorRegistry   = factorRegistry;
    }

    /** Engine with the stock components and a context zone of {@code contextEvaluator}. */
    public static TrustEvaluationEngine standard(ContextEvaluator contextEvaluator) {
        return new TrustEvaluationEngine(
            new PostureEvaluator(),
            contextEvaluator,
            new PolicyResolver(),
            new NormalizedWeightedTrustScorer(),
            FactorRegistry.withDefaults());
    }

    public EvaluationResult evaluate(EvaluationInput input, PostureFacts postureFacts, List<Policy> activePolicies) {
        return evaluate(input, postureFacts, activePolicies, PolicyConfig.defaults());
    }

    public EvaluationResult evaluate(EvaluationInput input,
                                     PostureFacts postureFacts,
                                     List<Policy> activePolicies,
                                     PolicyConfig config) {
        PostureFacts facts = postureFacts == null ? PostureFacts.empty() : postureFacts;

        // ── factor scores, in breakdown order ───────────────────────────────
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put(factorRegistry.require(FactorRegistry.DEVICE_POSTURE).name(),
                   postureEvaluator.evaluate(input.deviceId(), facts.forDevice(input.deviceId())));
        scores.put(factorRegistry.require(FactorRegistry.CONTEXT).name(),
                   contextEvaluator.evaluate(input.clientIp(), input.timestamp()));

        // ── policy + aggregation ────────────────────────────────────────────
        ResolvedPolicy policy = policyResolver.resolve(activePolicies, config);
        ScoreBreakdown breakdown = trustScorer.score(scores, policy.weights(), config.defaultWeights());
        Decision decision = DecisionClassifier.classify(breakdown.totalScore(), policy.threshold());

        List<ScoreDetail> details = new ArrayList<>(scores.size());
        scores.forEach((factor, score) -> details.add(new ScoreDetail(factor, score)));

        return new EvaluationResult(breakdown.totalScore(), decision, details,
                                    policy.policyId(), policy.threshold(), breakdown.effectiveWeights());
    }

    public FactorRegistry factorRegistry() {
        return factorRegistry;
    }
}
