package io.flowrules.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.flowrules.core.engine.strict.StrictRuleEngine;
import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.AnswerValue;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.QuestionState;
import io.flowrules.core.model.VisibilityMap;
import io.flowrules.core.testkit.TestQuestions;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link RequiredAnswers}. */
@DisplayName("RequiredAnswers")
class RequiredAnswersTest {

    @Test
    void visibilityDecidesWhichQuestionsMustBeAnswered() {
        List<Question> questions = List.of(
                TestQuestions.select("w_level_detail", "1", true),
                TestQuestions.withVisibility(
                        "w_siege", "2", "skip_if(w_level_detail = \"Beginner\")\noptional_if(w_level_detail = \"Early Game\")"),
                TestQuestions.plain("w_cvc", "3"));
        StrictRuleEngine engine = new StrictRuleEngine();

        AnswerBag midGame = AnswerBag.of("w_level_detail", "Mid Game");
        assertThat(RequiredAnswers.missing(questions, engine.evaluateVisibility(questions, midGame), AnswerBag.empty()))
                .extracting(Question::qid)
                .containsExactly("w_level_detail", "w_siege", "w_cvc");

        AnswerBag beginner = AnswerBag.of("w_level_detail", "Beginner");
        assertThat(RequiredAnswers.missing(questions, engine.evaluateVisibility(questions, beginner), beginner))
                .extracting(Question::qid)
                .containsExactly("w_cvc");

        AnswerBag earlyGame = AnswerBag.of("w_level_detail", "Early Game");
        assertThat(RequiredAnswers.missing(questions, engine.evaluateVisibility(questions, earlyGame), earlyGame))
                .extracting(Question::qid)
                .containsExactly("w_cvc");
    }

    @Test
    void questionMissingFromVisibilityUsesDeclaredFlag() {
        List<Question> questions = List.of(
                TestQuestions.plain("q1", "1"),
                Question.builder("q2").order("2").required(false).build());

        assertThat(RequiredAnswers.missing(questions, new VisibilityMap(Map.of()), AnswerBag.empty()))
                .extracting(Question::qid)
                .containsExactly("q1");
    }

    @Test
    void visibilityRequirednessOverridesDeclaredFlag() {
        List<Question> questions = List.of(Question.builder("q1").order("1").required(false).build());
        VisibilityMap visibility = new VisibilityMap(Map.of("q1", new QuestionState(true, true)));

        assertThat(RequiredAnswers.missing(questions, visibility, AnswerBag.empty())).hasSize(1);
    }

    @Nested
    @DisplayName("hasAnswer")
    class HasAnswer {

        private final Question text = TestQuestions.plain("q1", "1");
        private final Question select = TestQuestions.select("q2", "2", true);

        @Test
        void textNeedsNonBlankContent() {
            assertThat(RequiredAnswers.hasAnswer(text, AnswerValue.text("hi"))).isTrue();
            assertThat(RequiredAnswers.hasAnswer(text, AnswerValue.text("  "))).isFalse();
            assertThat(RequiredAnswers.hasAnswer(text, AnswerValue.EMPTY)).isFalse();
            assertThat(RequiredAnswers.hasAnswer(text, AnswerValue.of(false))).isTrue();
        }

        @Test
        void textAcceptsAnyStructuredAnswer() {
            assertThat(RequiredAnswers.hasAnswer(text, AnswerValue.list())).isTrue();
            assertThat(RequiredAnswers.hasAnswer(text, AnswerValue.of(Map.of()))).isTrue();
        }

        @Test
        void selectNeedsAChosenValue() {
            assertThat(RequiredAnswers.hasAnswer(select, AnswerValue.choice("tank", "Tank"))).isTrue();
            assertThat(RequiredAnswers.hasAnswer(select, AnswerValue.choice(" ", "Tank"))).isFalse();
            assertThat(RequiredAnswers.hasAnswer(select, AnswerValue.choices("a", "b"))).isTrue();
            assertThat(RequiredAnswers.hasAnswer(select, AnswerValue.choices())).isFalse();
            assertThat(RequiredAnswers.hasAnswer(select, AnswerValue.list(AnswerValue.text(""), AnswerValue.text("x"))))
                    .isTrue();
            assertThat(RequiredAnswers.hasAnswer(select, AnswerValue.text("tank"))).isTrue();
            assertThat(RequiredAnswers.hasAnswer(select, AnswerValue.EMPTY)).isFalse();
        }
    }
}
