package com.trustplatform.trust.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Immutable audit record of one evaluated access attempt. Append-only.
 *
 * scoreDetails: JSON-serialised {@code List<ScoreDetail>}
 * effectiveWeights: JSON-serialised {@code Map<String, Double>}
 */
@Data
@NoArgsConstructor
@Table("access_attempts")
public class AccessAttemptEntity {

    @Id
    private UUID attemptId;

    private String subjectId;

    private String deviceId;

    private String ipAddress;

    private LocalDateTime attemptedAt;

    private double totalScore;

    private String decision;

    private UUID policyId;

    private double thresholdUsed;

    private String reason;

    private String scoreDetails;

    private String effectiveWeights;

    private String traceId;
}
