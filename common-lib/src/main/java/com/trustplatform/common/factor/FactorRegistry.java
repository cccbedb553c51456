package com.trustplatform.common.factor;

import com.trustplatform.common.exception.UnknownFactorException;
import com.trustplatform.common.model.Factor;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Canonical set of named scoring factors.
 *
 * <p>Registration is an idempotent upsert-by-name: registering an existing name returns
 * the factor already held and never replaces it. Factor ids are derived from the name,
 * so every registry (and every store row created from it) agrees on the id of a factor.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. Evaluators only ever emit the names
 * declared here; {@link #require(String)} rejects anything else.
 */
public final class FactorRegistry {

    public static final String DEVICE_POSTURE = "device_posture";
    public static final String CONTEXT        = "context";

    private static final Map<String, String> BUILT_IN = Map.of(
        DEVICE_POSTURE, "Evaluates the device's compliance and posture",
        CONTEXT,        "Evaluates the network and temporal context of the request"
    );

    private final ConcurrentHashMap<String, Factor> factors = new ConcurrentHashMap<>();

    /** Registry holding {@value #DEVICE_POSTURE} and {@value #CONTEXT}. */
    public static FactorRegistry withDefaults() {
        FactorRegistry registry = new FactorRegistry();
        registry.register(DEVICE_POSTURE, BUILT_IN.get(DEVICE_POSTURE));
        registry.register(CONTEXT, BUILT_IN.get(CONTEXT));
        return registry;
    }

    /**
     * Returns the factor registered under {@code name}, creating it on first use.
     * A blank description falls back to the name.
     */
    public Factor register(String name, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("factor name must not be blank");
        }
        String desc = (description == null || description.isBlank()) ? name : description;
        return factors.computeIfAbsent(name, n -> new Factor(idFor(n), n, desc));
    }

    public Factor require(String name) {
        Factor factor = factors.get(name);
        if (factor == null) {
            throw new UnknownFactorException(name);
        }
        return factor;
    }

    public boolean contains(String name) {
        return name != null && factors.containsKey(name);
    }

    /** Snapshot of registered factors, sorted by name. */
    public List<Factor> all() {
        List<Factor> snapshot = new ArrayList<>(factors.values());
        snapshot.sort((a, b) -> a.name().compareTo(b.name()));
        return Collections.unmodifiableList(snapshot);
    }

    public static UUID idFor(String name) {
        return UUID.nameUUIDFromBytes(("trust-factor:" + name).getBytes(StandardCharsets.UTF_8));
    }
}
