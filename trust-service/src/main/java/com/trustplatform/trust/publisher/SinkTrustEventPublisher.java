package com.trustplatform.trust.publisher;

import com.trustplatform.common.decision.TrustEventPublisher;
import com.trustplatform.common.model.TrustEvaluationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * In-process {@link TrustEventPublisher} backed by a multicast Reactor sink.
 *
 * <p>Best effort: subscribers only see events published after they subscribed, and an
 * event that cannot be delivered (no subscriber, slow subscriber) is dropped and logged.
 * Emission is serialized so concurrent evaluations never trip the sink's
 * non-serialized guard.
 */
@Component
public class SinkTrustEventPublisher implements TrustEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SinkTrustEventPublisher.class);

    private final Sinks.Many<TrustEvaluationEvent> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public void publish(TrustEvaluationEvent event) {
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure()) {
            log.debug("Trust event not delivered. attemptId={} result={} traceId={}",
                      event.attemptId(), result, event.traceId());
        } else {
            log.info("Trust event published. attemptId={} decision={} subscribers={} traceId={}",
                     event.attemptId(), event.decision(), sink.currentSubscriberCount(), event.traceId());
        }
    }

    /** Live feed of events published from now on. */
    public Flux<TrustEvaluationEvent> stream() {
        return sink.asFlux();
    }
}
