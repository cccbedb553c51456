package com.trustplatform.common.decision;

import com.trustplatform.common.model.TrustEvaluationEvent;

/**
 * Abstraction for announcing completed evaluations to live subscribers.
 *
 * <p>Implementations MUST be non-blocking and best-effort: the decision has already been
 * returned to the caller, and no ordering against the stored audit record is promised.
 */
public interface TrustEventPublisher {

    void publish(TrustEvaluationEvent event);
}
