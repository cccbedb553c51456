package com.trustplatform.trust.store;

import com.trustplatform.common.model.Factor;
import com.trustplatform.common.model.Policy;
import com.trustplatform.common.model.PostureFacts;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Storage collaborator of the trust evaluation path.
 *
 * <p>Reads are pre-fetches for one evaluation; writes are append-only. Implementations
 * signal failures as errors on the returned publisher and never retry.
 */
public interface TrustDataStore {

    /** Active policies with their weights keyed by factor name, oldest first. */
    Flux<Policy> loadActivePolicies();

    /** Recorded checkpoint results for {@code deviceId}; empty facts when there are none. */
    Mono<PostureFacts> loadCheckpoints(String deviceId);

    /** Appends the audit record of one evaluated attempt. */
    Mono<Void> saveAttempt(AccessAttemptRecord record);

    /** Idempotent upsert-by-name of a factor definition. */
    Mono<Factor> registerFactor(Factor factor);
}
