package io.flowrules.core.engine;

import io.flowrules.core.engine.legacy.LegacyRuleEngine;
import io.flowrules.core.engine.strict.DirectiveCache;
import io.flowrules.core.engine.strict.StrictRuleEngine;
import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.VisibilityMap;
import io.flowrules.core.spi.RuleEngine;
import io.flowrules.core.spi.RuleEventListener;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for hosts. Picks the active engine once per call from the
 * engine selector, delegates, and turns any unexpected failure into the safe
 * default: every question visible with its declared requiredness, no
 * navigation override, no validation issues.
 *
 * <p>
 * The selector is read on every call so a runtime toggle takes effect on the
 * next evaluation. An unknown engine id falls back to {@link #DEFAULT_ENGINE};
 * a selector that throws counts as the toggle being off and selects
 * {@link #TOGGLE_FAILURE_ENGINE}.
 *
 * <p>
 * Thread-safe.
 */
public final class FlowRules {

    private static final Logger LOG = LoggerFactory.getLogger(FlowRules.class);

    /** Engine used when the selector yields nothing usable. */
    public static final String DEFAULT_ENGINE = StrictRuleEngine.ID;

    /** Engine used when the selector itself fails. */
    public static final String TOGGLE_FAILURE_ENGINE = LegacyRuleEngine.ID;

    private final EngineRegistry registry;
    private final Supplier<String> engineSelector;

    public FlowRules(EngineRegistry registry, Supplier<String> engineSelector) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.engineSelector = Objects.requireNonNull(engineSelector, "engineSelector must not be null");
    }

    /**
     * Creates a facade with both built-in engines registered.
     *
     * @param engineSelector yields {@code "strict"} or {@code "legacy"} per call
     * @param parseCache     whether the strict engine memoizes parsed rule text
     * @param listener       receives rule events from both engines
     */
    public static FlowRules withBuiltinEngines(
            Supplier<String> engineSelector, boolean parseCache, RuleEventListener listener) {
        RuleEvents events = new RuleEvents(listener);
        EngineRegistry registry = new EngineRegistry();
        registry.register(new StrictRuleEngine(new DirectiveCache(parseCache), events));
        registry.register(new LegacyRuleEngine(events));
        return new FlowRules(registry, engineSelector);
    }

    /** Facade pinned to one built-in engine, with a parse cache and no listener. */
    public static FlowRules fixed(String engineId) {
        return withBuiltinEngines(() -> engineId, true, RuleEventListener.NOOP);
    }

    /** Resolves the visibility of every question; never throws. */
    public VisibilityMap evaluateVisibility(List<Question> questions, AnswerBag answers) {
        RuleEngine engine = activeEngine();
        try {
            return engine.evaluateVisibility(questions, answers);
        } catch (RuntimeException e) {
            LOG.error("rules.failure engine={} operation=visibility", engine.id(), e);
            return VisibilityMap.defaults(questions);
        }
    }

    /** Navigation override from {@code currentIndex}, or empty; never throws. */
    public OptionalInt nextIndex(int currentIndex, List<Question> questions, AnswerBag answers) {
        RuleEngine engine = activeEngine();
        try {
            return engine.nextIndex(currentIndex, questions, answers);
        } catch (RuntimeException e) {
            LOG.error("rules.failure engine={} operation=navigation", engine.id(), e);
            return OptionalInt.empty();
        }
    }

    /** The navigation override if present, else {@code currentIndex + 1}. */
    public int nextStep(int currentIndex, List<Question> questions, AnswerBag answers) {
        OptionalInt override = nextIndex(currentIndex, questions, answers);
        return override.isPresent() ? override.getAsInt() : currentIndex + 1;
    }

    /** Issues with the rule cells of {@code questions}, per the active engine; never throws. */
    public List<String> validate(List<Question> questions) {
        RuleEngine engine = activeEngine();
        try {
            return engine.validate(questions);
        } catch (RuntimeException e) {
            LOG.error("rules.failure engine={} operation=validate", engine.id(), e);
            return List.of();
        }
    }

    /** The engine the next call would use. */
    public RuleEngine activeEngine() {
        String selected;
        try {
            selected = engineSelector.get();
        } catch (RuntimeException e) {
            LOG.warn("rules.toggle_failure fallback={}", TOGGLE_FAILURE_ENGINE, e);
            return registry.requireEngine(TOGGLE_FAILURE_ENGINE);
        }
        return registry.getEngine(selected).orElseGet(() -> {
            LOG.warn("rules.unknown_engine engine={} fallback={}", selected, DEFAULT_ENGINE);
            return registry.requireEngine(DEFAULT_ENGINE);
        });
    }
}
