package com.trustplatform.common.model;

/** Recorded outcome of one posture checkpoint on a device. Only {@link #PASS} counts as passed. */
public enum CheckpointStatus {
    PASS,
    FAIL,
    UNKNOWN;

    /**
     * Lenient parse of a stored status value. Anything unrecognised is {@link #UNKNOWN}.
     */
    public static CheckpointStatus fromValue(String value) {
        if (value == null) return UNKNOWN;
        return switch (value.trim().toLowerCase()) {
            case "pass" -> PASS;
            case "fail" -> FAIL;
            default     -> UNKNOWN;
        };
    }
}
