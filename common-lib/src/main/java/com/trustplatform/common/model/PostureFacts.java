package com.trustplatform.common.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only lookup of checkpoint results per device, pre-fetched by the caller.
 */
public final class PostureFacts {

    private static final PostureFacts EMPTY = new PostureFacts(Map.of());

    private final Map<String, List<CheckpointResult>> byDevice;

    private PostureFacts(Map<String, List<CheckpointResult>> byDevice) {
        this.byDevice = byDevice;
    }

    public static PostureFacts empty() {
        return EMPTY;
    }

    public static PostureFacts of(String deviceId, List<CheckpointResult> results) {
        return of(Map.of(deviceId, results));
    }

    public static PostureFacts of(Map<String, List<CheckpointResult>> byDevice) {
        Map<String, List<CheckpointResult>> copy = new HashMap<>();
        byDevice.forEach((device, results) -> copy.put(device, List.copyOf(results)));
        return new PostureFacts(Map.copyOf(copy));
    }

    /**
     * @return recorded results for the device; empty when the device is {@code null} or unknown
     */
    public List<CheckpointResult> forDevice(String deviceId) {
        if (deviceId == null) {
            return List.of();
        }
        return byDevice.getOrDefault(deviceId, List.of());
    }
}
