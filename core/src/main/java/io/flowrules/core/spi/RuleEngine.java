package io.flowrules.core.spi;

import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.VisibilityMap;
import java.util.List;
import java.util.OptionalInt;

/**
 * A rule engine: computes per-question visibility, resolves navigation jumps
 * and validates rule cells for one flow.
 *
 * <p>
 * Implementations must be thread-safe. They may throw on unexpected internal
 * failures; the {@code FlowRules} facade converts those into safe defaults.
 * Rule-level problems (bad syntax, failed evaluation, unknown targets) are
 * handled inside the engine and reported through {@link RuleEventListener}.
 */
public interface RuleEngine {

    /** Unique engine identifier (e.g. {@code "strict"}, {@code "legacy"}). */
    String id();

    /**
     * Resolves the visibility state of every question in {@code questions}.
     *
     * @param questions the flow's questions in order
     * @param answers   answers collected so far
     * @return one state per question, keyed by qid
     */
    VisibilityMap evaluateVisibility(List<Question> questions, AnswerBag answers);

    /**
     * Resolves the navigation override from the question at {@code currentIndex}.
     *
     * @return the index to jump to, or empty for normal sequential flow
     */
    OptionalInt nextIndex(int currentIndex, List<Question> questions, AnswerBag answers);

    /**
     * Checks every rule cell of {@code questions} without evaluating anything.
     *
     * @return human-readable issues; empty when every cell is well-formed
     */
    List<String> validate(List<Question> questions);
}
