package io.flowrules.core.engine;

import io.flowrules.core.model.QuestionState;
import io.flowrules.core.spi.RuleEventListener;
import io.flowrules.core.spi.RuleEventListener.GuardReason;
import io.flowrules.core.spi.RuleEventListener.Reason;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits rule events: one structured log line per event, then the matching
 * {@link RuleEventListener} callback. Listener failures are logged and
 * swallowed so they never change an evaluation result.
 *
 * <p>
 * Thread-safe if the wrapped listener is.
 */
public final class RuleEvents {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEvents.class);

    private static final RuleEvents SILENT = new RuleEvents(RuleEventListener.NOOP);

    private final RuleEventListener listener;

    public RuleEvents(RuleEventListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /** Events that are only logged. */
    public static RuleEvents loggingOnly() {
        return SILENT;
    }

    public void ruleError(String qid, String directive, Reason reason, String detail) {
        LOG.warn(
                "rules.error qid={} directive={} reason={} detail={}",
                qid,
                directive,
                reason.wireName(),
                detail);
        try {
            listener.onRuleError(new RuleEventListener.RuleErrorEvent(qid, directive, reason, detail));
        } catch (Exception e) {
            LOG.warn("RuleEventListener.onRuleError failed", e);
        }
    }

    public void stateFlip(String target, QuestionState from, QuestionState to, String directive) {
        LOG.info(
                "rules.flip target={} from={} to={} by={}", target, from.humanized(), to.humanized(), directive);
        try {
            listener.onStateFlip(
                    new RuleEventListener.StateFlipEvent(target, from.humanized(), to.humanized(), directive));
        } catch (Exception e) {
            LOG.warn("RuleEventListener.onStateFlip failed", e);
        }
    }

    public void navigation(String from, String to, String directive) {
        LOG.info("rules.nav from={} to={} reason={}", from, to, directive);
        try {
            listener.onNavigation(new RuleEventListener.NavigationEvent(from, to, directive));
        } catch (Exception e) {
            LOG.warn("RuleEventListener.onNavigation failed", e);
        }
    }

    public void navGuard(int hops, GuardReason reason) {
        LOG.warn("rules.nav_guard hops={} reason={}", hops, reason.wireName());
        try {
            listener.onNavGuard(new RuleEventListener.NavGuardEvent(hops, reason));
        } catch (Exception e) {
            LOG.warn("RuleEventListener.onNavGuard failed", e);
        }
    }
}
