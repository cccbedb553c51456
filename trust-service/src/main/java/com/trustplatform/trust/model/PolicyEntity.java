package com.trustplatform.trust.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Stored policy header. Factor weights live in {@code policy_factor_weights}.
 * Timestamps are UTC.
 */
@Data
@NoArgsConstructor
@Table("policies")
public class PolicyEntity {

    @Id
    private UUID policyId;

    private String policyName;

    private String owner;

    private double minTrustThreshold;

    private String description;

    private boolean active;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
