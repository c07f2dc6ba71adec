package io.flowrules.core.engine;

import io.flowrules.core.spi.RuleEngine;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of rule engines keyed by engine id. Thread-safe: registration and
 * lookup can happen concurrently.
 */
public final class EngineRegistry {

    private final Map<String, RuleEngine> engines = new ConcurrentHashMap<>();

    /**
     * Registers a rule engine, replacing any engine with the same id.
     *
     * @throws NullPointerException     if engine is null
     * @throws IllegalArgumentException if engine.id() is null or empty
     */
    public void register(RuleEngine engine) {
        if (engine == null) {
            throw new NullPointerException("engine must not be null");
        }
        String id = engine.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("engine id must not be null or empty");
        }
        engines.put(id, engine);
    }

    public Optional<RuleEngine> getEngine(String engineId) {
        return engineId == null ? Optional.empty() : Optional.ofNullable(engines.get(engineId));
    }

    /**
     * Looks up an engine by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no engine is registered with the given id
     */
    public RuleEngine requireEngine(String engineId) {
        return getEngine(engineId)
                .orElseThrow(() -> new IllegalArgumentException("No rule engine registered for id: '" + engineId + "'"));
    }

    public int size() {
        return engines.size();
    }

    public boolean hasEngine(String engineId) {
        return engineId != null && engines.containsKey(engineId);
    }
}
