package io.flowrules.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for the value types of the model package. */
class ModelTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Nested
    @DisplayName("AnswerBag")
    class AnswerBags {

        @Test
        void fromJsonConvertsEveryShape() throws Exception {
            JsonNode json = MAPPER.readTree("""
                    {"w_role": {"value": "tank", "label": "Tank"},
                     "w_power": 1500000,
                     "w_skip": null,
                     "w_tags": ["a", "b"]}
                    """);

            AnswerBag bag = AnswerBag.fromJson(json);

            assertThat(bag.get("w_role")).isEqualTo(AnswerValue.choice("tank", "Tank"));
            assertThat(bag.get("w_power")).isEqualTo(new AnswerValue.Scalar("1500000"));
            assertThat(bag.get("w_skip").isEmpty()).isTrue();
            assertThat(bag.get("w_tags")).isEqualTo(AnswerValue.list(AnswerValue.text("a"), AnswerValue.text("b")));
            assertThat(bag.get("absent")).isSameAs(AnswerValue.EMPTY);
        }

        @Test
        void fromJsonRejectsNonObjects() throws Exception {
            assertThatThrownBy(() -> AnswerBag.fromJson(MAPPER.readTree("[1, 2]")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Answers payload must be a JSON object");
        }

        @Test
        void lookupFallsBackToLowercaseKey() {
            AnswerBag bag = AnswerBag.of("w_role", "tank");

            assertThat(bag.lookup("W_ROLE")).isEqualTo(AnswerValue.text("tank"));
            assertThat(bag.get("W_ROLE").isEmpty()).isTrue();
        }

        @Test
        void withReturnsACopy() {
            AnswerBag original = AnswerBag.empty();
            AnswerBag updated = original.with("q1", AnswerValue.text("x"));

            assertThat(original.isEmpty()).isTrue();
            assertThat(updated.asMap()).containsOnlyKeys("q1");
        }
    }

    @Nested
    @DisplayName("VisibilityMap")
    class VisibilityMaps {

        @Test
        void rendersSortedJson() {
            Map<String, QuestionState> states = new LinkedHashMap<>();
            states.put("w_siege", QuestionState.SKIPPED);
            states.put("w_cvc", new QuestionState(true, false));
            states.put("w_arena", new QuestionState(true, true));

            String json = new VisibilityMap(states).toJson().toString();

            assertThat(json)
                    .isEqualTo("{\"w_arena\":{\"required\":true,\"state\":\"show\"},"
                            + "\"w_cvc\":{\"required\":false,\"state\":\"optional\"},"
                            + "\"w_siege\":{\"required\":false,\"state\":\"skip\"}}");
        }

        @Test
        void unknownQidReportsShow() {
            VisibilityMap map = new VisibilityMap(Map.of("q1", QuestionState.SKIPPED));

            assertThat(map.isSkipped("q1")).isTrue();
            assertThat(map.stateOf("q2")).isEqualTo(VisibilityState.SHOW);
            assertThat(map.get("q2")).isNull();
        }

        @Test
        void defaultsUseDeclaredRequiredness() {
            VisibilityMap map = VisibilityMap.defaults(List.of(
                    Question.builder("q1").build(), Question.builder("q2").required(false).build()));

            assertThat(map.get("q1")).isEqualTo(new QuestionState(true, true));
            assertThat(map.stateOf("q2")).isEqualTo(VisibilityState.OPTIONAL);
        }
    }

    @Nested
    @DisplayName("QuestionType")
    class QuestionTypes {

        @ParameterizedTest
        @CsvSource({
            "short, SHORT",
            "Paragraph, PARAGRAPH",
            "number, NUMBER",
            "bool, BOOL",
            "single-select, SINGLE_SELECT",
            "multi-select, MULTI_SELECT",
            "multi-select-4, MULTI_SELECT"
        })
        void resolvesCatalogNames(String raw, QuestionType expected) {
            assertThat(QuestionType.fromSheet(raw)).isEqualTo(expected);
        }

        @Test
        void rejectsBlankAndUnknown() {
            assertThatThrownBy(() -> QuestionType.fromSheet(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Question type is required");
            assertThatThrownBy(() -> QuestionType.fromSheet("slider"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Unknown question type: 'slider'");
        }

        @Test
        void selectTypes() {
            assertThat(QuestionType.SINGLE_SELECT.isSelect()).isTrue();
            assertThat(QuestionType.MULTI_SELECT.isSelect()).isTrue();
            assertThat(QuestionType.SHORT.isSelect()).isFalse();
        }
    }

    @Nested
    @DisplayName("Question")
    class Questions {

        @Test
        void builderDefaults() {
            Question question = Question.builder("q1").build();

            assertThat(question.label()).isEqualTo("q1");
            assertThat(question.type()).isEqualTo(QuestionType.SHORT);
            assertThat(question.required()).isTrue();
            assertThat(question.rules()).isEmpty();
            assertThat(question.visibilityRules()).isEmpty();
            assertThat(question.navRules()).isEmpty();
        }

        @Test
        void orderKeySplitsNumberAndSuffix() {
            assertThat(Question.orderKey("12B")).isEqualTo(new Question.OrderKey(12, "B"));
            assertThat(Question.orderKey("intro")).isEqualTo(new Question.OrderKey(0, "intro"));
            assertThat(Question.orderKey("9").compareTo(Question.orderKey("10"))).isNegative();
        }
    }
}
