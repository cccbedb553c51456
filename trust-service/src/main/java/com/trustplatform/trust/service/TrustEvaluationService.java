package com.trustplatform.trust.service;

import com.trustplatform.common.decision.TrustEventPublisher;
import com.trustplatform.common.engine.TrustEvaluationEngine;
import com.trustplatform.common.exception.DependencyUnavailableException;
import com.trustplatform.common.exception.PolicyValidationException;
import com.trustplatform.common.factor.FactorRegistry;
import com.trustplatform.common.model.EvaluationInput;
import com.trustplatform.common.model.EvaluationResult;
import com.trustplatform.common.model.Policy;
import com.trustplatform.common.model.PolicyConfig;
import com.trustplatform.common.model.PostureFacts;
import com.trustplatform.common.model.TrustEvaluationEvent;
import com.trustplatform.common.policy.PolicyValidator;
import com.trustplatform.common.trace.TraceContextUtil;
import com.trustplatform.trust.logger.TrustFlowLogger;
import com.trustplatform.trust.store.AccessAttemptRecord;
import com.trustplatform.trust.store.TrustDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Caller of {@link TrustEvaluationEngine}: fetches the facts, runs the engine, then hands the
 * result to persistence and live notification without waiting for either.
 *
 * <h3>Failure model</h3>
 * <ul>
 *   <li>Policy or posture lookup error or timeout → {@link DependencyUnavailableException}, no retry.</li>
 *   <li>Stored policy failing {@link PolicyValidator} → skipped with a warning.</li>
 *   <li>Audit write or event publish failure → logged, never surfaced.</li>
 * </ul>
 */
@Service
public class TrustEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(TrustEvaluationService.class);

    static final String POLICY_STORE  = "policy-store";
    static final String POSTURE_STORE = "posture-store";

    private final TrustDataStore dataStore;
    private final TrustEvaluationEngine engine;
    private final PolicyConfig policyConfig;
    private final TrustEventPublisher eventPublisher;
    private final TrustFlowLogger flowLogger;
    private final FactorRegistry factorRegistry;
    private final Clock clock;
    private final Duration storeTimeout;

    public TrustEvaluationService(TrustDataStore dataStore,
                                  TrustEvaluationEngine engine,
                                  PolicyConfig policyConfig,
                                  TrustEventPublisher eventPublisher,
                                  TrustFlowLogger flowLogger,
                                  FactorRegistry factorRegistry,
                                  Clock clock,
                                  Duration storeTimeout) {
        this.dataStore      = dataStore;
        this.engine         = engine;
        this.policyConfig   = policyConfig;
        this.eventPublisher = eventPublisher;
        this.flowLogger     = flowLogger;
        this.factorRegistry = factorRegistry;
        this.clock          = clock;
        this.storeTimeout   = storeTimeout;
    }

    /**
     * Evaluates one access attempt at the current clock instant.
     *
     * @param subjectId required subject identifier
     * @param deviceId  optional device identifier
     * @param clientIp  client IP already resolved at the boundary; blank → undetermined
     */
    public Mono<EvaluatedAttempt> evaluate(String subjectId, String deviceId, String clientIp) {
        return Mono.defer(() -> {
            if (subjectId == null || subjectId.isBlank()) {
                return Mono.error(new IllegalArgumentException("subjectId is required"));
            }
            UUID attemptId = UUID.randomUUID();
            String traceId = attemptId.toString();
            EvaluationInput input = new EvaluationInput(subjectId, deviceId, clientIp, clock.instant());
            flowLogger.logWithTraceId(TrustFlowLogger.REQUEST_RECEIVED, traceId);

            Mono<EvaluatedAttempt> pipeline = Mono.zip(loadPolicies(), loadFacts(input.deviceId()))
                .doOnEach(flowLogger.stage(TrustFlowLogger.FACTS_LOADED))
                .map(loaded -> engine.evaluate(input, loaded.getT2(), loaded.getT1(), policyConfig))
                .map(result -> dispatch(attemptId, input, result, traceId))
                .doOnError(e -> TraceContextUtil.withMdc(traceId, () ->
                    log.error("Trust evaluation failed. subjectId={} deviceId={} traceId={}",
                              subjectId, input.deviceId(), traceId, e)));

            return TraceContextUtil.withTraceId(pipeline, traceId);
        });
    }

    private EvaluatedAttempt dispatch(UUID attemptId, EvaluationInput input, EvaluationResult result, String traceId) {
        flowLogger.logDecision(attemptId, result, traceId);

        AccessAttemptRecord record = new AccessAttemptRecord(attemptId, input, result, traceId);
        saveAttempt(record);                                                            // fire-and-forget
        publish(TrustEvaluationEvent.of(attemptId, input, result, traceId));            // fire-and-forget
        flowLogger.logWithTraceId(TrustFlowLogger.EVENTS_DISPATCHED, traceId);

        return new EvaluatedAttempt(attemptId, input, result, traceId);
    }

    private Mono<List<Policy>> loadPolicies() {
        return dataStore.loadActivePolicies()
            .filter(this::isValid)
            .collectList()
            .timeout(storeTimeout)
            .onErrorMap(e -> !(e instanceof DependencyUnavailableException),
                        e -> new DependencyUnavailableException(POLICY_STORE,
                                 "active policies could not be loaded: " + e, e));
    }

    private Mono<PostureFacts> loadFacts(String deviceId) {
        if (deviceId == null) {
            return Mono.just(PostureFacts.empty());
        }
        return dataStore.loadCheckpoints(deviceId)
            .defaultIfEmpty(PostureFacts.empty())
            .timeout(storeTimeout)
            .onErrorMap(e -> !(e instanceof DependencyUnavailableException),
                        e -> new DependencyUnavailableException(POSTURE_STORE,
                                 "checkpoints for device " + deviceId + " could not be loaded: " + e, e));
    }

    private boolean isValid(Policy policy) {
        try {
            PolicyValidator.validate(policy, factorRegistry);
            return true;
        } catch (PolicyValidationException e) {
            log.warn("Stored policy rejected, skipped for evaluation. policyId={} name={} reason={}",
                     policy.id(), policy.name(), e.getMessage());
            return false;
        }
    }

    private void saveAttempt(AccessAttemptRecord record) {
        dataStore.saveAttempt(record)
            .subscribe(
                ok  -> { },
                err -> log.warn("Attempt persist failed (non-critical). attemptId={} traceId={}",
                                record.attemptId(), record.traceId(), err),
                ()  -> log.info("Attempt persisted. attemptId={} decision={} traceId={}",
                                record.attemptId(), record.result().decision(), record.traceId())
            );
    }

    private void publish(TrustEvaluationEvent event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("Trust event publish failed (non-critical). attemptId={} traceId={}",
                     event.attemptId(), event.traceId(), e);
        }
    }
}
