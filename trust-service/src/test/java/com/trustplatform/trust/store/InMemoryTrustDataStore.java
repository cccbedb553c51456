package com.trustplatform.trust.store;

import com.trustplatform.common.model.CheckpointResult;
import com.trustplatform.common.model.Factor;
import com.trustplatform.common.model.Policy;
import com.trustplatform.common.model.PostureFacts;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Test double: collections in memory, with switchable failure modes per operation. */
public class InMemoryTrustDataStore implements TrustDataStore {

    public final List<Policy> policies = new CopyOnWriteArrayList<>();
    public final Map<String, List<CheckpointResult>> checkpoints = new ConcurrentHashMap<>();
    public final List<AccessAttemptRecord> savedAttempts = new CopyOnWriteArrayList<>();
    public final Map<String, Factor> factors = new ConcurrentHashMap<>();
    public final AtomicInteger checkpointLookups = new AtomicInteger();

    public Mono<Void> saveOverride;
    public Flux<Policy> policiesOverride;
    public Mono<PostureFacts> checkpointsOverride;

    @Override
    public Flux<Policy> loadActivePolicies() {
        if (policiesOverride != null) return policiesOverride;
        return Flux.fromIterable(policies).filter(Policy::active);
    }

    @Override
    public Mono<PostureFacts> loadCheckpoints(String deviceId) {
        checkpointLookups.incrementAndGet();
        if (checkpointsOverride != null) return checkpointsOverride;
        return Mono.fromSupplier(() ->
            PostureFacts.of(deviceId, checkpoints.getOrDefault(deviceId, List.of())));
    }

    @Override
    public Mono<Void> saveAttempt(AccessAttemptRecord record) {
        if (saveOverride != null) return saveOverride;
        return Mono.fromRunnable(() -> savedAttempts.add(record));
    }

    @Override
    public Mono<Factor> registerFactor(Factor factor) {
        return Mono.fromSupplier(() -> factors.computeIfAbsent(factor.name(), n -> factor));
    }
}
