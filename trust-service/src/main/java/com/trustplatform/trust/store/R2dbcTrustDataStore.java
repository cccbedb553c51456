package com.trustplatform.trust.store;

import com.trustplatform.common.model.CheckpointResult;
import com.trustplatform.common.model.CheckpointStatus;
import com.trustplatform.common.model.Factor;
import com.trustplatform.common.model.Policy;
import com.trustplatform.common.model.PostureFacts;
import com.trustplatform.trust.model.PolicyEntity;
import com.trustplatform.trust.model.TrustFactorEntity;
import com.trustplatform.trust.repository.DevicePostureStatusRepository;
import com.trustplatform.trust.repository.PolicyFactorWeightRepository;
import com.trustplatform.trust.repository.PolicyRepository;
import com.trustplatform.trust.repository.TrustFactorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * {@link TrustDataStore} over the relational schema in {@code schema.sql}.
 *
 * <p>Policy weights are joined to factor names in memory: factors are loaded once per
 * {@link #loadActivePolicies()} call. A weight pointing at a missing factor row is dropped
 * with a warning. Attempts are written with {@link R2dbcEntityTemplate#insert} since their
 * ids are assigned before the write.
 */
@Component
public class R2dbcTrustDataStore implements TrustDataStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcTrustDataStore.class);

    private final PolicyRepository policyRepository;
    private final PolicyFactorWeightRepository weightRepository;
    private final TrustFactorRepository factorRepository;
    private final DevicePostureStatusRepository postureRepository;
    private final R2dbcEntityTemplate template;
    private final AccessAttemptMapper attemptMapper;

    public R2dbcTrustDataStore(PolicyRepository policyRepository,
                               PolicyFactorWeightRepository weightRepository,
                               TrustFactorRepository factorRepository,
                               DevicePostureStatusRepository postureRepository,
                               R2dbcEntityTemplate template,
                               AccessAttemptMapper attemptMapper) {
        this.policyRepository  = policyRepository;
        this.weightRepository  = weightRepository;
        this.factorRepository  = factorRepository;
        this.postureRepository = postureRepository;
        this.template          = template;
        this.attemptMapper     = attemptMapper;
    }

    @Override
    public Flux<Policy> loadActivePolicies() {
        return factorRepository.findAll()
            .collectMap(TrustFactorEntity::getFactorId, TrustFactorEntity::getName)
            .flatMapMany(factorNames -> policyRepository.findByActiveTrueOrderByCreatedAtAsc()
                .concatMap(entity -> loadWeights(entity.getPolicyId(), factorNames)
                    .map(weights -> toPolicy(entity, weights))));
    }

    @Override
    public Mono<PostureFacts> loadCheckpoints(String deviceId) {
        return postureRepository.findByDeviceId(deviceId)
            .map(row -> new CheckpointResult(
                row.getCheckpointName(),
                CheckpointStatus.fromValue(row.getStatus()),
                toInstant(row.getCheckedAt())))
            .collectList()
            .map(results -> PostureFacts.of(deviceId, results));
    }

    @Override
    public Mono<Void> saveAttempt(AccessAttemptRecord record) {
        return Mono.fromCallable(() -> attemptMapper.toEntity(record))
            .flatMap(template::insert)
            .doOnSuccess(saved -> log.debug("Attempt persisted. attemptId={} decision={} traceId={}",
                                            saved.getAttemptId(), saved.getDecision(), saved.getTraceId()))
            .then();
    }

    @Override
    public Mono<Factor> registerFactor(Factor factor) {
        return factorRepository.findByName(factor.name())
            .switchIfEmpty(Mono.defer(() -> {
                TrustFactorEntity entity = new TrustFactorEntity();
                entity.setFactorId(factor.id());
                entity.setName(factor.name());
                entity.setDescription(factor.description());
                log.info("Factor created. name={} id={}", factor.name(), factor.id());
                return template.insert(entity);
            }))
            .map(e -> new Factor(e.getFactorId(), e.getName(), e.getDescription()));
    }

    private Mono<Map<String, Double>> loadWeights(UUID policyId, Map<UUID, String> factorNames) {
        return weightRepository.findByPolicyId(policyId)
            .collect(HashMap<String, Double>::new, (weights, row) -> {
                String name = factorNames.get(row.getFactorId());
                if (name == null) {
                    log.warn("Weight references missing factor, dropped. policyId={} factorId={}",
                             policyId, row.getFactorId());
                    return;
                }
                weights.put(name, row.getWeight());
            })
            .map(weights -> (Map<String, Double>) weights);
    }

    private static Policy toPolicy(PolicyEntity entity, Map<String, Double> weights) {
        return new Policy(entity.getPolicyId(), entity.getPolicyName(), entity.getOwner(),
                          entity.getMinTrustThreshold(), weights, entity.isActive(),
                          toInstant(entity.getCreatedAt()));
    }

    private static Instant toInstant(LocalDateTime utc) {
        return utc == null ? Instant.EPOCH : utc.toInstant(ZoneOffset.UTC);
    }
}
