package com.trustplatform.trust.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trustplatform.common.model.EvaluationInput;
import com.trustplatform.common.model.EvaluationResult;
import com.trustplatform.trust.model.AccessAttemptEntity;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Maps an {@link AccessAttemptRecord} to its {@code access_attempts} row.
 * Breakdown collections are stored as JSON text.
 */
@Component
public class AccessAttemptMapper {

    private final ObjectMapper objectMapper;

    public AccessAttemptMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AccessAttemptEntity toEntity(AccessAttemptRecord record) {
        EvaluationInput input   = record.input();
        EvaluationResult result = record.result();

        AccessAttemptEntity entity = new AccessAttemptEntity();
        entity.setAttemptId(record.attemptId());
        entity.setSubjectId(input.subjectId());
        entity.setDeviceId(input.deviceId());
        entity.setIpAddress(input.clientIp());
        entity.setAttemptedAt(LocalDateTime.ofInstant(input.timestamp(), ZoneOffset.UTC));
        entity.setTotalScore(result.totalScore());
        entity.setDecision(result.decision().wireValue());
        entity.setPolicyId(result.policyId());
        entity.setThresholdUsed(result.thresholdUsed());
        entity.setReason(record.reason());
        entity.setScoreDetails(toJson(result.details()));
        entity.setEffectiveWeights(toJson(result.effectiveWeights()));
        entity.setTraceId(record.traceId());
        return entity;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise attempt breakdown", e);
        }
    }
}
