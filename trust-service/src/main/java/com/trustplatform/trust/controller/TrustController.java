package com.trustplatform.trust.controller;

import com.trustplatform.common.model.TrustEvaluationEvent;
import com.trustplatform.trust.dto.AttemptResponse;
import com.trustplatform.trust.dto.EvaluationRequest;
import com.trustplatform.trust.publisher.SinkTrustEventPublisher;
import com.trustplatform.trust.service.TrustEvaluationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/trust")
public class TrustController {

    private static final Logger log = LoggerFactory.getLogger(TrustController.class);

    private final TrustEvaluationService evaluationService;
    private final SinkTrustEventPublisher eventPublisher;

    public TrustController(TrustEvaluationService evaluationService,
                           SinkTrustEventPublisher eventPublisher) {
        this.evaluationService = evaluationService;
        this.eventPublisher    = eventPublisher;
    }

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<AttemptResponse>> evaluate(@RequestBody EvaluationRequest request) {
        log.info("Evaluation request received. subjectId={} deviceId={}",
                 request.subjectId(), request.deviceId());
        return evaluationService.evaluate(request.subjectId(), request.deviceId(), request.clientIp())
            .map(AttemptResponse::from)
            .map(ResponseEntity::ok);
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<TrustEvaluationEvent>> events() {
        log.info("SSE trust event client connected");
        return eventPublisher.stream()
            .map(event -> ServerSentEvent.<TrustEvaluationEvent>builder()
                .id(event.attemptId().toString())
                .event("trust-evaluation")
                .data(event)
                .build());
    }

    @GetMapping("/health")
    public Mono<Map<String, String>> health() {
        return Mono.just(Map.of("status", "UP", "service", "trust-service"));
    }
}
