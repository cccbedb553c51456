package com.trustplatform.trust.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trustplatform.common.context.ContextEvaluator;
import com.trustplatform.common.engine.TrustEvaluationEngine;
import com.trustplatform.common.factor.FactorRegistry;
import com.trustplatform.common.model.PolicyConfig;
import com.trustplatform.common.policy.PolicyResolver;
import com.trustplatform.common.posture.PostureEvaluator;
import com.trustplatform.common.scoring.NormalizedWeightedTrustScorer;
import com.trustplatform.common.scoring.TrustScorer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

@Configuration
public class TrustServiceConfig {

    @Value("${trust.defaults.weight-posture:0.7}")
    private double weightPosture;

    @Value("${trust.defaults.weight-context:0.3}")
    private double weightContext;

    @Value("${trust.defaults.threshold:70}")
    private double threshold;

    @Value("${trust.context.zone-id:UTC}")
    private String contextZoneId;

    @Value("${trust.store.timeout-ms:2000}")
    private long storeTimeoutMs;

    /** Read once at startup; immutable for the life of the process. */
    @Bean
    public PolicyConfig policyConfig() {
        return new PolicyConfig(
            Map.of(FactorRegistry.DEVICE_POSTURE, weightPosture,
                   FactorRegistry.CONTEXT,        weightContext),
            threshold);
    }

    @Bean
    public FactorRegistry factorRegistry() {
        return FactorRegistry.withDefaults();
    }

    @Bean
    public TrustScorer trustScorer() {
        return new NormalizedWeightedTrustScorer();
    }

    @Bean
    public TrustEvaluationEngine trustEvaluationEngine(FactorRegistry factorRegistry, TrustScorer trustScorer) {
        return new TrustEvaluationEngine(
            new PostureEvaluator(),
            new ContextEvaluator(ZoneId.of(contextZoneId)),
            new PolicyResolver(),
            trustScorer,
            factorRegistry);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Duration storeTimeout() {
        return Duration.ofMillis(storeTimeoutMs);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
