package io.flowrules.core.engine.strict;

import static org.assertj.core.api.Assertions.assertThat;

import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.VisibilityState;
import io.flowrules.core.testkit.TestQuestions;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link StrictRuleEngine}. */
@DisplayName("StrictRuleEngine")
class StrictRuleEngineTest {

    private final StrictRuleEngine engine = new StrictRuleEngine();

    @Test
    void delegatesToResolvers() {
        List<Question> questions = List.of(
                Question.builder("q0")
                        .order("1")
                        .navRules("goto_if(value = \"no\", target=q2)")
                        .build(),
                TestQuestions.withVisibility("q1", "2", "skip_if(q0 = \"no\")"),
                TestQuestions.plain("q2", "3"));
        AnswerBag answers = AnswerBag.of("q0", "no");

        assertThat(engine.id()).isEqualTo("strict");
        assertThat(engine.evaluateVisibility(questions, answers).stateOf("q1")).isEqualTo(VisibilityState.SKIP);
        assertThat(engine.nextIndex(0, questions, answers)).hasValue(2);
        assertThat(engine.cache().size()).isPositive();
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        void cleanFlowHasNoIssues() {
            List<Question> questions = List.of(
                    Question.builder("q0")
                            .order("1")
                            .navRules("goto_if(int(value) > 3, target=q1)")
                            .build(),
                    TestQuestions.withVisibility("q1", "2", "optional_if(q0 in [a, b] and not q0 = true)"));

            assertThat(engine.validate(questions)).isEmpty();
        }

        @Test
        void reportsParseErrorsWithOwner() {
            List<Question> questions = List.of(TestQuestions.withVisibility("q1", "1", "skip_if(a ="));

            assertThat(engine.validate(questions))
                    .containsExactly("q1: unsupported visibility directive: skip_if(a =");
        }

        @Test
        void reportsUnknownReferences() {
            List<Question> questions = List.of(
                    TestQuestions.withVisibility("q1", "1", "skip_if(ghost = 1, target=nobody)"),
                    TestQuestions.withNav("q2", "2", "goto_if(len(q1) > 1, target=q9)"));

            assertThat(engine.validate(questions))
                    .containsExactly(
                            "q1: visibility target 'nobody' is unknown",
                            "q1: unknown identifier 'ghost'",
                            "q2: navigation target 'q9' is unknown",
                            "q2: unsupported function 'len'");
        }

        @Test
        void valueIsOnlyValidInNavigation() {
            List<Question> questions = List.of(TestQuestions.withVisibility("q1", "1", "skip_if(value = 1)"));

            assertThat(engine.validate(questions)).containsExactly("q1: 'value' is not valid in visibility rules");
        }
    }
}
