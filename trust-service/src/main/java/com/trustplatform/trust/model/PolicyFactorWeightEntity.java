package com.trustplatform.trust.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

@Data
@NoArgsConstructor
@Table("policy_factor_weights")
public class PolicyFactorWeightEntity {

    @Id
    private Long id;

    private UUID policyId;

    private UUID factorId;

    private double weight;
}
