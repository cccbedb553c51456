package com.trustplatform.trust.logger;

import com.trustplatform.common.model.EvaluationResult;
import com.trustplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Observability component for one evaluation's path through {@code TrustEvaluationService}.
 * Pure side effects; never alters the pipeline.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: attempt accepted, id assigned</li>
 *   <li>{@link #FACTS_LOADED}: policies and checkpoint facts fetched</li>
 *   <li>{@link #DECISION_CREATED}: engine returned a result</li>
 *   <li>{@link #EVENTS_DISPATCHED}: audit write and event publish initiated</li>
 * </ol>
 */
@Component
public class TrustFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(TrustFlowLogger.class);

    public static final String REQUEST_RECEIVED  = "REQUEST_RECEIVED";
    public static final String FACTS_LOADED      = "FACTS_LOADED";
    public static final String DECISION_CREATED  = "DECISION_CREATED";
    public static final String EVENTS_DISPATCHED = "EVENTS_DISPATCHED";

    /**
     * {@code doOnEach} consumer logging {@code stageName} on {@code onNext} signals, with the
     * traceId read from the Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[TrustFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[TrustFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /** Compact summary of a finished evaluation. */
    public void logDecision(UUID attemptId, EvaluationResult result, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[TrustFlow] stage={} attemptId={} totalScore={} decision={} threshold={} "
                     + "policyId={} weights={} traceId={}",
                     DECISION_CREATED, attemptId, result.totalScore(), result.decision(),
                     result.thresholdUsed(),
                     result.policyId() != null ? result.policyId() : "default",
                     result.effectiveWeights(), traceId)
        );
    }
}
