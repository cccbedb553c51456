package com.trustplatform.common.context;

import com.trustplatform.common.model.EvaluationInput;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Scores the temporal and network origin of a request, 0–100.
 *
 * <h3>Components</h3>
 * <pre>
 *   time     local hour in [9, 18] inclusive → 40, otherwise 20
 *   network  private-range prefix            → 60, otherwise 40
 *   total    min(100, time + network)
 * </pre>
 *
 * <p>The private-range test is a plain prefix match on {@code 10.}, {@code 192.168.} and
 * {@code 172.16.}. It does not cover the rest of {@code 172.16.0.0/12} nor any IPv6 range;
 * the 40/60 split is relied on by stored scores, so the match is kept as is.
 *
 * <p>An undetermined IP ({@code null}, blank or {@value EvaluationInput#UNDETERMINED_IP}) is
 * treated as non-private. The local hour is taken in the zone given at construction.
 */
public final class ContextEvaluator {

    static final double IN_HOURS_SCORE      = 40.0;
    static final double OFF_HOURS_SCORE     = 20.0;
    static final double PRIVATE_NET_SCORE   = 60.0;
    static final double PUBLIC_NET_SCORE    = 40.0;
    static final double MAX_SCORE           = 100.0;

    static final int OFFICE_START_HOUR = 9;
    static final int OFFICE_END_HOUR   = 18;

    private static final List<String> PRIVATE_PREFIXES = List.of("10.", "192.168.", "172.16.");

    private final ZoneId zone;

    public ContextEvaluator() {
        this(ZoneId.systemDefault());
    }

    public ContextEvaluator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public double evaluate(String clientIp, Instant timestamp) {
        int hour = timestamp.atZone(zone).getHour();
        double timeScore    = (hour >= OFFICE_START_HOUR && hour <= OFFICE_END_HOUR) ? IN_HOURS_SCORE : OFF_HOURS_SCORE;
        double networkScore = isPrivate(clientIp) ? PRIVATE_NET_SCORE : PUBLIC_NET_SCORE;
        return Math.min(MAX_SCORE, timeScore + networkScore);
    }

    public static boolean isPrivate(String ip) {
        if (ip == null) {
            return false;
        }
        for (String prefix : PRIVATE_PREFIXES) {
            if (ip.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public ZoneId zone() {
        return zone;
    }
}
