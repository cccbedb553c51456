package com.trustplatform.common.policy;

import com.trustplatform.common.model.Policy;
import com.trustplatform.common.model.PolicyConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PolicyResolverTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final PolicyResolver resolver = new PolicyResolver();

    private static Policy policy(String id, Instant createdAt, double threshold, boolean active) {
        return new Policy(UUID.fromString(id), "p-" + id.charAt(0), "admin", threshold,
                          Map.of("device_posture", 1.0, "context", 1.0), active, createdAt);
    }

    @Nested
    @DisplayName("no active policy")
    class Defaults {

        @Test
        @DisplayName("empty list → default weights and threshold 70")
        void emptyList() {
            ResolvedPolicy resolved = resolver.resolve(List.of(), PolicyConfig.defaults());
            assertTrue(resolved.isDefault());
            assertNull(resolved.policyId());
            assertEquals(70.0, resolved.threshold());
            assertEquals(Map.of("device_posture", 0.7, "context", 0.3), resolved.weights());
        }

        @Test
        @DisplayName("null list → defaults")
        void nullList() {
            assertTrue(resolver.resolve(null, PolicyConfig.defaults()).isDefault());
        }

        @Test
        @DisplayName("only inactive policies supplied → defaults")
        void inactiveIgnored() {
            Policy inactive = policy("00000000-0000-0000-0000-000000000001", T0, 50.0, false);
            assertTrue(resolver.resolve(List.of(inactive), PolicyConfig.defaults()).isDefault());
        }

        @Test
        @DisplayName("custom config defaults are used")
        void customConfig() {
            PolicyConfig config = new PolicyConfig(Map.of("device_posture", 0.5, "context", 0.5), 60.0);
            ResolvedPolicy resolved = resolver.resolve(List.of(), config);
            assertEquals(60.0, resolved.threshold());
            assertEquals(0.5, resolved.weights().get("context"));
        }
    }

    @Nested
    @DisplayName("selection order")
    class Selection {

        @Test
        @DisplayName("earliest created active policy wins")
        void earliestWins() {
            Policy newer = policy("00000000-0000-0000-0000-000000000001", T0.plusSeconds(10), 90.0, true);
            Policy older = policy("00000000-0000-0000-0000-000000000002", T0, 40.0, true);
            ResolvedPolicy resolved = resolver.resolve(List.of(newer, older), PolicyConfig.defaults());
            assertEquals(older.id(), resolved.policyId());
            assertEquals(40.0, resolved.threshold());
            assertFalse(resolved.isDefault());
        }

        @Test
        @DisplayName("equal createdAt broken by id")
        void tieBrokenById() {
            Policy b = policy("b0000000-0000-0000-0000-000000000000", T0, 80.0, true);
            Policy a = policy("a0000000-0000-0000-0000-000000000000", T0, 60.0, true);
            assertEquals(a.id(), resolver.resolve(List.of(b, a), PolicyConfig.defaults()).policyId());
            assertEquals(a.id(), resolver.resolve(List.of(a, b), PolicyConfig.defaults()).policyId());
        }

        @Test
        @DisplayName("selection does not depend on input order")
        void orderInsensitive() {
            List<Policy> policies = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                policies.add(policy(String.format("%08d-0000-0000-0000-000000000000", i),
                                    T0.plusSeconds(100 - i * 7L), 50.0 + i, true));
            }
            UUID expected = resolver.resolve(policies, PolicyConfig.defaults()).policyId();
            for (int round = 0; round < 5; round++) {
                Collections.shuffle(policies, new java.util.Random(round));
                assertEquals(expected, resolver.resolve(policies, PolicyConfig.defaults()).policyId());
            }
        }

        @Test
        @DisplayName("weights are returned raw")
        void rawWeights() {
            Policy p = new Policy(UUID.randomUUID(), "raw", "admin", 75.0,
                                  Map.of("device_posture", 3.0, "context", 1.0), true, T0);
            assertEquals(Map.of("device_posture", 3.0, "context", 1.0),
                         resolver.resolve(List.of(p), PolicyConfig.defaults()).weights());
        }
    }
}
