package com.trustplatform.common.policy;

import com.trustplatform.common.exception.PolicyValidationException;
import com.trustplatform.common.factor.FactorRegistry;
import com.trustplatform.common.model.Policy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PolicyValidatorTest {

    private final FactorRegistry registry = FactorRegistry.withDefaults();

    private static Policy policy(double threshold, Map<String, Double> weights) {
        return new Policy(UUID.randomUUID(), "p", "admin", threshold, weights, true, Instant.EPOCH);
    }

    @Test
    @DisplayName("well-formed policy passes through")
    void valid() {
        Policy p = policy(70.0, Map.of("device_posture", 2.0, "context", 0.0));
        assertSame(p, PolicyValidator.validate(p, registry));
    }

    @Test
    @DisplayName("all-zero weights are accepted")
    void zeroWeights() {
        assertDoesNotThrow(() -> PolicyValidator.validate(
            policy(70.0, Map.of("device_posture", 0.0, "context", 0.0)), registry));
    }

    @Test
    @DisplayName("negative weight rejected")
    void negativeWeight() {
        Policy p = policy(70.0, Map.of("device_posture", -0.1));
        PolicyValidationException ex = assertThrows(PolicyValidationException.class,
            () -> PolicyValidator.validate(p, registry));
        assertEquals(p.id(), ex.getPolicyId());
    }

    @Test
    @DisplayName("NaN and infinite weights rejected")
    void nonFinite() {
        assertThrows(PolicyValidationException.class,
            () -> PolicyValidator.validate(policy(70.0, Map.of("context", Double.NaN)), registry));
        assertThrows(PolicyValidationException.class,
            () -> PolicyValidator.validate(policy(70.0, Map.of("context", Double.POSITIVE_INFINITY)), registry));
    }

    @Test
    @DisplayName("threshold outside [0,100] rejected")
    void thresholdRange() {
        assertThrows(PolicyValidationException.class,
            () -> PolicyValidator.validate(policy(100.5, Map.of()), registry));
        assertThrows(PolicyValidationException.class,
            () -> PolicyValidator.validate(policy(-1.0, Map.of()), registry));
        assertDoesNotThrow(() -> PolicyValidator.validate(policy(100.0, Map.of()), registry));
        assertDoesNotThrow(() -> PolicyValidator.validate(policy(0.0, Map.of()), registry));
    }

    @Test
    @DisplayName("unregistered factor rejected")
    void unknownFactor() {
        assertThrows(PolicyValidationException.class,
            () -> PolicyValidator.validate(policy(70.0, Map.of("geo_velocity", 1.0)), registry));
    }
}
