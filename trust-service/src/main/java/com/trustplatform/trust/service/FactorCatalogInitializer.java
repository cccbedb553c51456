package com.trustplatform.trust.service;

import com.trustplatform.common.factor.FactorRegistry;
import com.trustplatform.trust.store.TrustDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Makes sure every factor in the {@link FactorRegistry} has a row in the store, so policy
 * weights can reference it. Upsert-by-name; safe to run on every start.
 */
@Component
public class FactorCatalogInitializer {

    private static final Logger log = LoggerFactory.getLogger(FactorCatalogInitializer.class);

    private final FactorRegistry factorRegistry;
    private final TrustDataStore dataStore;

    public FactorCatalogInitializer(FactorRegistry factorRegistry, TrustDataStore dataStore) {
        this.factorRegistry = factorRegistry;
        this.dataStore      = dataStore;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        sync().subscribe(
            count -> log.info("Factor catalog synchronised. factors={}", count),
            err   -> log.warn("Factor catalog sync failed; policies referencing new factors may be skipped", err)
        );
    }

    public Mono<Long> sync() {
        return Flux.fromIterable(factorRegistry.all())
            .concatMap(dataStore::registerFactor)
            .count();
    }
}
