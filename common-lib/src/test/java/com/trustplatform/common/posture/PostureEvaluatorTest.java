package com.trustplatform.common.posture;

import com.trustplatform.common.model.CheckpointResult;
import com.trustplatform.common.model.CheckpointStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PostureEvaluatorTest {

    private static final Instant T0 = Instant.parse("2024-03-04T10:00:00Z");

    private final PostureEvaluator evaluator = new PostureEvaluator();

    private static CheckpointResult result(String checkpoint, CheckpointStatus status, Instant at) {
        return new CheckpointResult(checkpoint, status, at);
    }

    @Nested
    @DisplayName("neutral defaults")
    class NeutralDefaults {

        @Test
        @DisplayName("no device → 50")
        void noDevice() {
            assertEquals(50.0, evaluator.evaluate(null, List.of(result("disk", CheckpointStatus.PASS, T0))));
        }

        @Test
        @DisplayName("blank device id → 50")
        void blankDevice() {
            assertEquals(50.0, evaluator.evaluate("  ", List.of()));
        }

        @Test
        @DisplayName("device without recorded checkpoints → 50")
        void noCheckpoints() {
            assertEquals(50.0, evaluator.evaluate("dev-1", List.of()));
            assertEquals(50.0, evaluator.evaluate("dev-1", null));
        }
    }

    @Nested
    @DisplayName("pass ratio")
    class PassRatio {

        @Test
        @DisplayName("all passed → 100")
        void allPassed() {
            List<CheckpointResult> results = List.of(
                result("disk-encryption", CheckpointStatus.PASS, T0),
                result("firewall",        CheckpointStatus.PASS, T0));
            assertEquals(100.0, evaluator.evaluate("dev-1", results));
        }

        @Test
        @DisplayName("FAIL and UNKNOWN both count against the device")
        void unknownIsNotPassed() {
            List<CheckpointResult> results = List.of(
                result("disk-encryption", CheckpointStatus.PASS,    T0),
                result("firewall",        CheckpointStatus.FAIL,    T0),
                result("antivirus",       CheckpointStatus.UNKNOWN, T0),
                result("os-patch",        CheckpointStatus.PASS,    T0));
            assertEquals(50.0, evaluator.evaluate("dev-1", results));
        }

        @Test
        @DisplayName("none passed → 0")
        void nonePassed() {
            assertEquals(0.0, evaluator.evaluate("dev-1",
                List.of(result("firewall", CheckpointStatus.FAIL, T0))));
        }

        @Test
        @DisplayName("one of three passed → 33.33…")
        void oneOfThree() {
            List<CheckpointResult> results = List.of(
                result("a", CheckpointStatus.PASS, T0),
                result("b", CheckpointStatus.FAIL, T0),
                result("c", CheckpointStatus.FAIL, T0));
            assertEquals(100.0 / 3.0, evaluator.evaluate("dev-1", results), 1e-9);
        }
    }

    @Nested
    @DisplayName("latest status per checkpoint")
    class LatestStatus {

        @Test
        @DisplayName("later FAIL overrides earlier PASS")
        void laterFailWins() {
            List<CheckpointResult> results = List.of(
                result("firewall", CheckpointStatus.PASS, T0),
                result("firewall", CheckpointStatus.FAIL, T0.plusSeconds(60)));
            assertEquals(0.0, evaluator.evaluate("dev-1", results));
        }

        @Test
        @DisplayName("later PASS overrides earlier FAIL regardless of list order")
        void laterPassWinsOutOfOrder() {
            List<CheckpointResult> results = List.of(
                result("firewall", CheckpointStatus.PASS, T0.plusSeconds(60)),
                result("firewall", CheckpointStatus.FAIL, T0),
                result("disk",     CheckpointStatus.FAIL, T0));
            assertEquals(50.0, evaluator.evaluate("dev-1", results));
        }

        @Test
        @DisplayName("repeated results for one checkpoint count once")
        void distinctCheckpointsOnly() {
            List<CheckpointResult> results = List.of(
                result("firewall", CheckpointStatus.PASS, T0),
                result("firewall", CheckpointStatus.PASS, T0.plusSeconds(1)),
                result("firewall", CheckpointStatus.PASS, T0.plusSeconds(2)),
                result("disk",     CheckpointStatus.FAIL, T0));
            assertEquals(50.0, evaluator.evaluate("dev-1", results));
        }
    }
}
