package io.flowrules.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One row of a question flow. Immutable; the engine never mutates it.
 *
 * <p>
 * Three rule cells are carried verbatim: {@code visibilityRules} and
 * {@code navRules} use the strict directive grammar, {@code rules} uses the
 * legacy clause grammar. Missing cells are normalised to the empty string.
 *
 * @param flow            owning flow name
 * @param qid             unique identifier within the flow
 * @param order           sort key, digits with an optional letter suffix
 *                        (e.g. {@code 12B})
 * @param label           question text
 * @param type            answer kind
 * @param required        declared requiredness
 * @param options         selectable values for select types
 * @param multiMax        max selections for multi-select, or {@code null}
 * @param maxlen          max text length, or {@code null}
 * @param validate        validation hint, or {@code null}
 * @param help            help text, or {@code null}
 * @param rules           legacy rule clauses
 * @param visibilityRules strict visibility directives
 * @param navRules        strict navigation directives
 */
public record Question(
        String flow,
        String qid,
        String order,
        String label,
        QuestionType type,
        boolean required,
        List<Option> options,
        Integer multiMax,
        Integer maxlen,
        String validate,
        String help,
        String rules,
        String visibilityRules,
        String navRules) {

    public Question {
        Objects.requireNonNull(qid, "qid must not be null");
        flow = flow == null ? "" : flow;
        order = order == null ? "" : order;
        label = label == null ? "" : label;
        type = type == null ? QuestionType.SHORT : type;
        options = options == null ? List.of() : List.copyOf(options);
        rules = rules == null ? "" : rules;
        visibilityRules = visibilityRules == null ? "" : visibilityRules;
        navRules = navRules == null ? "" : navRules;
    }

    /** Creates a builder for a question with the given qid. */
    public static Builder builder(String qid) {
        return new Builder(qid);
    }

    /**
     * Sort key: numeric prefix first, then the remaining suffix. An order
     * without a numeric prefix sorts as {@code 0}.
     */
    public static OrderKey orderKey(String order) {
        String text = order == null ? "" : order;
        int split = 0;
        while (split < text.length() && Character.isDigit(text.charAt(split))) {
            split++;
        }
        int number;
        try {
            number = split == 0 ? 0 : Integer.parseInt(text.substring(0, split));
        } catch (NumberFormatException e) {
            number = 0;
        }
        return new OrderKey(number, text.substring(split));
    }

    /** Comparable order key derived from an {@code order} cell. */
    public record OrderKey(int number, String suffix) implements Comparable<OrderKey> {
        @Override
        public int compareTo(OrderKey other) {
            int byNumber = Integer.compare(number, other.number);
            return byNumber != 0 ? byNumber : suffix.compareTo(other.suffix);
        }
    }

    /** Builder with empty defaults for every field except {@code qid}. */
    public static final class Builder {
        private final String qid;
        private String flow = "";
        private String order = "";
        private String label;
        private QuestionType type = QuestionType.SHORT;
        private boolean required = true;
        private List<Option> options = List.of();
        private Integer multiMax;
        private Integer maxlen;
        private String validate;
        private String help;
        private String rules = "";
        private String visibilityRules = "";
        private String navRules = "";

        Builder(String qid) {
            this.qid = qid;
        }

        public Builder flow(String flow) {
            this.flow = flow;
            return this;
        }

        public Builder order(String order) {
            this.order = order;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder type(QuestionType type) {
            this.type = type;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder options(List<Option> options) {
            this.options = options;
            return this;
        }

        public Builder multiMax(Integer multiMax) {
            this.multiMax = multiMax;
            return this;
        }

        public Builder maxlen(Integer maxlen) {
            this.maxlen = maxlen;
            return this;
        }

        public Builder validate(String validate) {
            this.validate = validate;
            return this;
        }

        public Builder help(String help) {
            this.help = help;
            return this;
        }

        public Builder rules(String rules) {
            this.rules = rules;
            return this;
        }

        public Builder visibilityRules(String visibilityRules) {
            this.visibilityRules = visibilityRules;
            return this;
        }

        public Builder navRules(String navRules) {
            this.navRules = navRules;
            return this;
        }

        public Question build() {
            return new Question(
                    flow,
                    qid,
                    order,
                    label != null ? label : qid,
                    type,
                    required,
                    options,
                    multiMax,
                    maxlen,
                    validate,
                    help,
                    rules,
                    visibilityRules,
                    navRules);
        }
    }
}
