package com.trustplatform.common.model;

/**
 * Tri-state outcome of a trust evaluation, ordered from least to most permissive.
 *
 * <ul>
 *   <li>{@link #DENY}: total score below the review band</li>
 *   <li>{@link #REVIEW}: total score inside the review band, below the threshold</li>
 *   <li>{@link #ALLOW}: total score at or above the threshold</li>
 * </ul>
 */
public enum Decision {
    DENY,
    REVIEW,
    ALLOW;

    /** Lower-case wire value, as stored in audit records. */
    public String wireValue() {
        return name().toLowerCase();
    }
}
