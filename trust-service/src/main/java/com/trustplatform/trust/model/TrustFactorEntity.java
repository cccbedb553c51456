package com.trustplatform.trust.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

@Data
@NoArgsConstructor
@Table("trust_factors")
public class TrustFactorEntity {

    @Id
    private UUID factorId;

    private String name;

    private String description;
}
