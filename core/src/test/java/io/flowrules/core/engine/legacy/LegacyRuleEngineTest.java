package io.flowrules.core.engine.legacy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.flowrules.core.engine.RuleEvents;
import io.flowrules.core.model.AnswerBag;
import io.flowrules.core.model.AnswerValue;
import io.flowrules.core.model.Question;
import io.flowrules.core.model.QuestionState;
import io.flowrules.core.model.VisibilityMap;
import io.flowrules.core.model.VisibilityState;
import io.flowrules.core.spi.RuleEventListener;
import io.flowrules.core.testkit.TestQuestions;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link LegacyRuleEngine}. */
@DisplayName("LegacyRuleEngine")
class LegacyRuleEngineTest {

    private RuleEventListener listener;
    private LegacyRuleEngine engine;

    @BeforeEach
    void setUp() {
        listener = mock(RuleEventListener.class);
        engine = new LegacyRuleEngine(new RuleEvents(listener));
    }

    @Nested
    @DisplayName("visibility")
    class Visibility {

        private List<Question> flow(String rules) {
            return List.of(
                    TestQuestions.withRules("w_pvp", "1", "Do you play PvP?", rules),
                    TestQuestions.withRules("w_arena", "2", "Arena tier", ""),
                    TestQuestions.withRules("w_siege_a", "3A", "Siege participation", ""),
                    TestQuestions.withRules("w_siege_b", "3B", "Siege rewards", ""),
                    Question.builder("w_notes").order("4").label("Notes").required(false).build());
        }

        @Test
        void freeTextConditionSkipsTargetByOrder() {
            VisibilityMap visibility = engine.evaluateVisibility(flow("if no skip 2"), AnswerBag.of("w_pvp", "No"));

            assertThat(visibility.get("w_arena")).isEqualTo(QuestionState.SKIPPED);
            assertThat(visibility.stateOf("w_pvp")).isEqualTo(VisibilityState.SHOW);
            verify(listener).onStateFlip(new RuleEventListener.StateFlipEvent("w_arena", "required", "skip", "no"));
        }

        @Test
        void conditionThatDoesNotMatchLeavesFlowAlone() {
            List<Question> questions = flow("if no skip 2");

            assertThat(engine.evaluateVisibility(questions, AnswerBag.of("w_pvp", "Yes")))
                    .isEqualTo(VisibilityMap.defaults(questions));
        }

        @Test
        void noAnswersMeansDefaults() {
            List<Question> questions = flow("if no skip 2");

            assertThat(engine.evaluateVisibility(questions, AnswerBag.empty()))
                    .isEqualTo(VisibilityMap.defaults(questions));
        }

        @Test
        void makeOptionalClearsRequiredness() {
            VisibilityMap visibility =
                    engine.evaluateVisibility(flow("if yes make 2 optional"), AnswerBag.of("w_pvp", "yes"));

            assertThat(visibility.get("w_arena")).isEqualTo(new QuestionState(true, false));
        }

        @Test
        void skipWinsRegardlessOfClauseOrder() {
            AnswerBag answers = AnswerBag.of("w_pvp", "yes");

            assertThat(engine.evaluateVisibility(flow("if yes make 2 optional; if yes skip 2"), answers)
                            .stateOf("w_arena"))
                    .isEqualTo(VisibilityState.SKIP);
            assertThat(engine.evaluateVisibility(flow("if yes skip 2\nif yes make 2 optional"), answers)
                            .stateOf("w_arena"))
                    .isEqualTo(VisibilityState.SKIP);
        }

        @Test
        void wildcardTargetsCoverEveryMatchingOrder() {
            VisibilityMap visibility = engine.evaluateVisibility(flow("if no skip 3*"), AnswerBag.of("w_pvp", "no"));

            assertThat(visibility.stateOf("w_siege_a")).isEqualTo(VisibilityState.SKIP);
            assertThat(visibility.stateOf("w_siege_b")).isEqualTo(VisibilityState.SKIP);
            assertThat(visibility.stateOf("w_arena")).isEqualTo(VisibilityState.SHOW);
        }

        @Test
        void targetsResolveByQidAndLabel() {
            VisibilityMap visibility = engine.evaluateVisibility(
                    flow("if no skip w_arena and siege participation"), AnswerBag.of("w_pvp", "no"));

            assertThat(visibility.stateOf("w_arena")).isEqualTo(VisibilityState.SKIP);
            assertThat(visibility.stateOf("w_siege_a")).isEqualTo(VisibilityState.SKIP);
            assertThat(visibility.stateOf("w_siege_b")).isEqualTo(VisibilityState.SHOW);
        }

        @Test
        void conditionMatchesHyphenAndUnderscoreVariants() {
            AnswerBag answers = AnswerBag.of(Map.of("w_pvp", AnswerValue.choice("early-game", "Early-Game")));

            VisibilityMap visibility = engine.evaluateVisibility(flow("if early game skip 2"), answers);

            assertThat(visibility.stateOf("w_arena")).isEqualTo(VisibilityState.SKIP);
        }

        @Test
        void qidConditionChecksThatQuestionsAnswer() {
            List<Question> questions = List.of(
                    TestQuestions.select("role", "1", true),
                    TestQuestions.withRules("w_tank_gear", "2", "Tank gear", "if role in [tank, heal] skip 3"),
                    TestQuestions.withRules("w_dps_gear", "3", "Damage gear", ""));

            VisibilityMap tank = engine.evaluateVisibility(
                    questions, AnswerBag.of(Map.of("role", AnswerValue.choice("tank", "Tank"))));
            VisibilityMap dps = engine.evaluateVisibility(
                    questions, AnswerBag.of(Map.of("role", AnswerValue.choice("dps", "DPS"))));

            assertThat(tank.stateOf("w_dps_gear")).isEqualTo(VisibilityState.SKIP);
            assertThat(dps.stateOf("w_dps_gear")).isEqualTo(VisibilityState.SHOW);
        }

        @Test
        void optionalQuestionStaysOptionalWhenShown() {
            VisibilityMap visibility = engine.evaluateVisibility(flow(""), AnswerBag.of("w_pvp", "no"));

            assertThat(visibility.get("w_notes")).isEqualTo(new QuestionState(true, false));
        }
    }

    @Nested
    @DisplayName("navigation")
    class Navigation {

        private List<Question> flow(String rules) {
            return List.of(
                    TestQuestions.withRules("q1", "1", "Start", rules),
                    TestQuestions.plain("q2", "2"),
                    TestQuestions.plain("q3", "3"),
                    TestQuestions.plain("q4", "4"),
                    TestQuestions.plain("q5", "5B"));
        }

        @Test
        void unconditionalGotoJumpsToOrder() {
            assertThat(engine.nextIndex(0, flow("goto 5b"), AnswerBag.empty())).hasValue(4);
            verify(listener).onNavigation(new RuleEventListener.NavigationEvent("q1", "q5", "goto 5b"));
        }

        @Test
        void conditionalGotoPicksBranch() {
            List<Question> questions = flow("if q1 = yes goto 4 else goto 3");

            assertThat(engine.nextIndex(0, questions, AnswerBag.of("q1", "YES"))).hasValue(3);
            assertThat(engine.nextIndex(0, questions, AnswerBag.of("q1", "no"))).hasValue(2);
        }

        @Test
        void unansweredConditionIsSkipped() {
            assertThat(engine.nextIndex(0, flow("if q1 = yes goto 4 else goto 3"), AnswerBag.empty()))
                    .isEmpty();
        }

        @Test
        void numericConditionsCompareByValue() {
            List<Question> questions = flow("if q1 >= 10 goto 4");

            assertThat(engine.nextIndex(0, questions, AnswerBag.of("q1", "12.5"))).hasValue(3);
            assertThat(engine.nextIndex(0, questions, AnswerBag.of("q1", "lots"))).isEmpty();
        }

        @Test
        void unresolvableJumpFallsThroughToNextClause() {
            assertThat(engine.nextIndex(0, flow("goto 99\nskip order>=2 and order<4\ngoto 3"), AnswerBag.empty()))
                    .hasValue(2);
        }

        @Test
        void indexOutsideFlowMeansNoOverride() {
            assertThat(engine.nextIndex(7, flow("goto 2"), AnswerBag.empty())).isEmpty();
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        void cleanRulesHaveNoIssues() {
            List<Question> questions = List.of(
                    TestQuestions.withRules("q1", "1", "Start", "if no skip 2\nif q1 = yes goto 3 else goto 2"),
                    TestQuestions.withRules("q2", "2", "Middle", "skip order>=2 and order<3"),
                    TestQuestions.withRules("q3", "3", "End", "goto 1"));

            assertThat(engine.validate(questions)).isEmpty();
        }

        @Test
        void reportsEveryProblem() {
            List<Question> questions = List.of(
                    TestQuestions.withRules("q1", "1", "Start", "if no skip ghost and 2"),
                    TestQuestions.withRules("q2", "2", "Middle", "if nobody = x goto 99"),
                    TestQuestions.withRules("q3", "3", "End", "whatever happens"));

            assertThat(engine.validate(questions))
                    .containsExactly(
                            "q1: unknown rule target(s): ghost",
                            "q2: rule references unknown question 'nobody'",
                            "q2: rule references unknown order '99'",
                            "q3: no valid rule clauses parsed");
        }
    }

    @Test
    void clauseSplittingAndTargets() {
        assertThat(LegacyClauses.split("a;\n; b \n")).containsExactly("a", "b");
        assertThat(LegacyClauses.splitTargets("2, 3 and 4 & 5")).containsExactly("2", "3", "4", "5");
        assertThat(LegacyClauses.parseRhsList("[Tank, Heal]")).containsExactly("Tank", "Heal");
        assertThat(LegacyConditions.parseNumber("5.2M")).isNull();
        assertThat(LegacyConditions.parseNumber("1e3")).isEqualTo(1000.0);
    }
}
