package com.trustplatform.trust.repository;

import com.trustplatform.trust.model.TrustFactorEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface TrustFactorRepository extends ReactiveCrudRepository<TrustFactorEntity, UUID> {

    Mono<TrustFactorEntity> findByName(String name);
}
