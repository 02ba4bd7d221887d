package com.crossbridge.generator.codegen.backend;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each backend to the factory of its generator. The Swift bridging header generator is
 * registered out of the box; every other backend is plugged in by the caller.
 */
public class BackendRegistry {

    private final Map<Backend, BackendFactory> factories = new EnumMap<>(Backend.class);

    public BackendRegistry() {
        factories.put(Backend.SWIFT_BRIDGING_HEADER, SwiftBridgingHeaderGenerator::new);
    }

    /**
     * Registers (or replaces) the factory for {@code backend}.
     */
    public BackendRegistry register(Backend backend, BackendFactory factory) {
        factories.put(backend, factory);
        return this;
    }

    public Optional<BackendFactory> find(Backend backend) {
        return Optional.ofNullable(factories.get(backend));
    }
}
