package com.trustplatform.trust.service;

import com.trustplatform.common.factor.FactorRegistry;
import com.trustplatform.trust.store.InMemoryTrustDataStore;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FactorCatalogInitializerTest {

    @Test
    void registersEveryBuiltInFactorOnce() {
        InMemoryTrustDataStore store = new InMemoryTrustDataStore();
        FactorCatalogInitializer initializer =
            new FactorCatalogInitializer(FactorRegistry.withDefaults(), store);

        assertEquals(2L, initializer.sync().block());
        assertEquals(2L, initializer.sync().block());

        assertEquals(Set.of(FactorRegistry.DEVICE_POSTURE, FactorRegistry.CONTEXT), store.factors.keySet());
        assertEquals(FactorRegistry.idFor(FactorRegistry.CONTEXT), store.factors.get(FactorRegistry.CONTEXT).id());
    }
}
