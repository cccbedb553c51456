package com.trustplatform.common.posture;

import com.trustplatform.common.model.CheckpointResult;
import com.trustplatform.common.model.CheckpointStatus;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a device's compliance from its posture-checkpoint results, 0–100.
 *
 * <pre>
 *   no device                → 50.0  (unknown device)
 *   device, no results       → 50.0  (no evidence either way)
 *   otherwise                → 100 × passed / total
 * </pre>
 *
 * <p>{@code total} counts distinct checkpoints. A checkpoint is passed only when its latest
 * recorded status is {@link CheckpointStatus#PASS}; {@code FAIL} and {@code UNKNOWN} both count
 * against it. When two results share the latest {@code recordedAt}, the later one in the list wins.
 *
 * <p>Stateless and thread-safe. Never throws on well-formed input.
 */
public final class PostureEvaluator {

    public static final double NEUTRAL_SCORE = 50.0;

    public double evaluate(String deviceId, List<CheckpointResult> results) {
        if (deviceId == null || deviceId.isBlank()) {
            return NEUTRAL_SCORE;
        }
        if (results == null || results.isEmpty()) {
            return NEUTRAL_SCORE;
        }

        Map<String, CheckpointResult> latest = new HashMap<>();
        for (CheckpointResult r : results) {
            latest.merge(r.checkpoint(), r,
                (held, next) -> next.recordedAt().isBefore(held.recordedAt()) ? held : next);
        }

        long passed = latest.values().stream()
            .filter(r -> r.status() == CheckpointStatus.PASS)
            .count();
        return 100.0 * passed / latest.size();
    }
}
