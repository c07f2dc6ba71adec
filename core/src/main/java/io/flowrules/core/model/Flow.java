package io.flowrules.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, ordered sequence of questions (e.g. {@code welcome}, {@code promo}).
 *
 * @param name      flow name
 * @param questions questions sorted by order key
 */
public record Flow(String name, List<Question> questions) {

    public Flow {
        Objects.requireNonNull(name, "name must not be null");
        questions = List.copyOf(questions);
    }

    /** Index of the question with the given qid, or {@code -1}. */
    public int indexOf(String qid) {
        for (int i = 0; i < questions.size(); i++) {
            if (questions.get(i).qid().equals(qid)) {
                return i;
            }
        }
        return -1;
    }

    public int size() {
        return questions.size();
    }
}
