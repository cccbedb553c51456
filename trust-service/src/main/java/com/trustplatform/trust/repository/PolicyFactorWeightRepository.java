package com.trustplatform.trust.repository;

import com.trustplatform.trust.model.PolicyFactorWeightEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Repository
public interface PolicyFactorWeightRepository extends ReactiveCrudRepository<PolicyFactorWeightEntity, Long> {

    Flux<PolicyFactorWeightEntity> findByPolicyId(UUID policyId);
}
