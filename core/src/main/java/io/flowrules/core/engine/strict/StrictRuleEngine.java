package io.flowrules.core.engine.strict;

import io.flowrules.core.engine.RuleEvents;
import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.VisibilityMap;
import io.flowrules.core.spi.RuleEngine;
import java.util.List;
import java.util.OptionalInt;

/**
 * Grammar-based engine: {@code visibility_rules} and {@code nav_rules} cells
 * parsed into directive ASTs, resolved by {@link VisibilityResolver} and
 * {@link NavigationResolver}.
 */
public final class StrictRuleEngine implements RuleEngine {

    public static final String ID = "strict";

    private final DirectiveCache cache;
    private final VisibilityResolver visibility;
    private final NavigationResolver navigation;

    public StrictRuleEngine(DirectiveCache cache, RuleEvents events) {
        this.cache = cache;
        this.visibility = new VisibilityResolver(cache, events);
        this.navigation = new NavigationResolver(cache, events);
    }

    /** An engine with a parse cache that only logs events. */
    public StrictRuleEngine() {
        this(new DirectiveCache(true), RuleEvents.loggingOnly());
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public VisibilityMap evaluateVisibility(List<Question> questions, AnswerBag answers) {
        return visibility.resolve(questions, answers);
    }

    @Override
    public OptionalInt nextIndex(int currentIndex, List<Question> questions, AnswerBag answers) {
        return navigation.resolve(currentIndex, questions, answers);
    }

    @Override
    public List<String> validate(List<Question> questions) {
        return StrictRuleValidator.validate(questions);
    }

    DirectiveCache cache() {
        return cache;
    }
}
