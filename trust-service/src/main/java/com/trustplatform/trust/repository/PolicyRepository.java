package com.trustplatform.trust.repository;

import com.trustplatform.trust.model.PolicyEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Repository
public interface PolicyRepository extends ReactiveCrudRepository<PolicyEntity, UUID> {

    Flux<PolicyEntity> findByActiveTrueOrderByCreatedAtAsc();
}
