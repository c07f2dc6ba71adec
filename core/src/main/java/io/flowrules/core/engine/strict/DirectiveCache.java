package io.flowrules.core.engine.strict;

import io.flowrules.core.rule.DirectiveParser;
import io.flowrules.core.rule.NavDirective;
import io.flowrules.core.rule.VisibilityDirective;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes parsed directive lists keyed by raw rule text. Only successful
 * parses are stored, so a parse error is reported on every evaluation.
 *
 * <p>
 * Rule text is immutable per flow version, so entries never go stale. A
 * disabled cache parses on every call. Thread-safe.
 */
public final class DirectiveCache {

    private final boolean enabled;
    private final Map<String, List<VisibilityDirective>> visibility = new ConcurrentHashMap<>();
    private final Map<String, List<NavDirective>> navigation = new ConcurrentHashMap<>();

    public DirectiveCache(boolean enabled) {
        this.enabled = enabled;
    }

    /** A cache that never stores anything. */
    public static DirectiveCache disabled() {
        return new DirectiveCache(false);
    }

    /**
     * Parsed visibility directives for {@code text}.
     *
     * @throws io.flowrules.core.error.RuleParseException if the text is malformed
     */
    public List<VisibilityDirective> visibility(String text, String qid) {
        if (!enabled) {
            return DirectiveParser.parseVisibility(text, qid);
        }
        List<VisibilityDirective> cached = visibility.get(text);
        if (cached != null) {
            return cached;
        }
        List<VisibilityDirective> parsed = List.copyOf(DirectiveParser.parseVisibility(text, qid));
        visibility.putIfAbsent(text, parsed);
        return parsed;
    }

    /**
     * Parsed navigation directives for {@code text}.
     *
     * @throws io.flowrules.core.error.RuleParseException if the text is malformed
     */
    public List<NavDirective> navigation(String text, String qid) {
        if (!enabled) {
            return DirectiveParser.parseNavigation(text, qid);
        }
        List<NavDirective> cached = navigation.get(text);
        if (cached != null) {
            return cached;
        }
        List<NavDirective> parsed = List.copyOf(DirectiveParser.parseNavigation(text, qid));
        navigation.putIfAbsent(text, parsed);
        return parsed;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Number of cached entries across both directive kinds. */
    public int size() {
        return visibility.size() + navigation.size();
    }
}
