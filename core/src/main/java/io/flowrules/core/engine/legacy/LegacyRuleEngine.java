package io.flowrules.core.engine.legacy;

import io.flowrules.core.engine.RuleEvents;
import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.VisibilityMap;
import io.flowrules.core.spi.RuleEngine;
import java.util.List;
import java.util.OptionalInt;

/**
 * Pattern-based engine over the legacy {@code rules} cell. Kept alongside the
 * strict engine so flows authored for either toggle state keep their
 * behavior.
 */
public final class LegacyRuleEngine implements RuleEngine {

    public static final String ID = "legacy";

    private final LegacyVisibilityEvaluator visibility;
    private final LegacyNavigationEvaluator navigation;

    public LegacyRuleEngine(RuleEvents events) {
        this.visibility = new LegacyVisibilityEvaluator(events);
        this.navigation = new LegacyNavigationEvaluator(events);
    }

    public LegacyRuleEngine() {
        this(RuleEvents.loggingOnly());
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public VisibilityMap evaluateVisibility(List<Question> questions, AnswerBag answers) {
        return visibility.evaluate(questions, answers);
    }

    @Override
    public OptionalInt nextIndex(int currentIndex, List<Question> questions, AnswerBag answers) {
        return navigation.nextIndex(currentIndex, questions, answers);
    }

    @Override
    public List<String> validate(List<Question> questions) {
        return LegacyRuleValidator.validate(questions);
    }
}
