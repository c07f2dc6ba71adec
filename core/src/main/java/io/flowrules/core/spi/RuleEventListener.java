package io.flowrules.core.spi;

/**
 * SPI for observing rule evaluation. Every event also produces a structured
 * log line; listeners exist so a host can count or trace them.
 *
 * <p>
 * Implementations MUST be thread-safe and non-blocking. Exceptions thrown by a
 * listener are caught and logged; they never change an evaluation result.
 */
public interface RuleEventListener {

    /** A listener that ignores every event. */
    RuleEventListener NOOP = new RuleEventListener() {};

    /** A directive failed to parse or evaluate, or named an unknown target. */
    default void onRuleError(RuleErrorEvent event) {}

    /** A visibility directive changed a question's state. */
    default void onStateFlip(StateFlipEvent event) {}

    /** A navigation directive produced a jump. */
    default void onNavigation(NavigationEvent event) {}

    /** Navigation was cut short by the cycle or hop-limit guard. */
    default void onNavGuard(NavGuardEvent event) {}

    // --- Event records ---

    /** Error stage of a {@link RuleErrorEvent}. */
    enum Reason {
        PARSE,
        EVAL,
        RESOLVE;

        /** Lowercase name used in log lines. */
        public String wireName() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }

    /** Emitted for every recoverable rule error. */
    record RuleErrorEvent(String qid, String directive, Reason reason, String detail) {}

    /** Emitted when a directive moves {@code target} from one state to another. */
    record StateFlipEvent(String target, String from, String to, String directive) {}

    /** Emitted when a navigation directive fires. */
    record NavigationEvent(String from, String to, String directive) {}

    /** Guard that stopped a navigation chain. */
    enum GuardReason {
        CYCLE,
        DEPTH;

        public String wireName() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }

    /** Emitted when navigation gives up. */
    record NavGuardEvent(int hops, GuardReason reason) {}
}
