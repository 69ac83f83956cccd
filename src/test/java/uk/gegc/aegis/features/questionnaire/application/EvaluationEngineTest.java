package uk.gegc.aegis.features.questionnaire.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.aegis.features.questionnaire.domain.exception.AnswerValidationException;
import uk.gegc.aegis.features.questionnaire.domain.exception.RulesetConfigurationException;
import uk.gegc.aegis.features.questionnaire.domain.model.ComparisonOperator;
import uk.gegc.aegis.features.questionnaire.domain.model.Condition;
import uk.gegc.aegis.features.questionnaire.domain.model.Outcome;
import uk.gegc.aegis.features.questionnaire.domain.model.OutcomeBucket;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireDefinition;
import uk.gegc.aegis.features.questionnaire.domain.model.Ruleset;

import com.fasterxml.jackson.databind.node.BooleanNode;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;
import static uk.gegc.aegis.testsupport.QuestionnaireFixtures.answers;
import static uk.gegc.aegis.testsupport.QuestionnaireFixtures.definition;
import static uk.gegc.aegis.testsupport.QuestionnaireFixtures.handlerFactory;
import static uk.gegc.aegis.testsupport.QuestionnaireFixtures.sampleDefinition;

class EvaluationEngineTest {

    private EvaluationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new EvaluationEngine(handlerFactory());
    }

    @Nested
    @DisplayName("decision order")
    class DecisionOrder {

        @Test
        @DisplayName("evaluate: when a pregnant adult answers then ineligible with the bucket message")
        void pregnantAdultIsIneligible() {
            EvaluationResult result = engine.evaluate(sampleDefinition(),
                    answers("{\"age_check\": true, \"pregnancy_check\": true}"));

            assertThat(result.outcome()).isEqualTo(Outcome.INELIGIBLE);
            assertThat(result.message()).isEqualTo("Not for use during pregnancy");
        }

        @Test
        @DisplayName("evaluate: when an adult who is not pregnant answers then eligible")
        void adultNotPregnantIsEligible() {
            EvaluationResult result = engine.evaluate(sampleDefinition(),
                    answers("{\"age_check\": true, \"pregnancy_check\": false}"));

            assertThat(result.outcome()).isEqualTo(Outcome.ELIGIBLE);
            assertThat(result.message()).isEqualTo("You may use this product");
        }

        @Test
        @DisplayName("evaluate: when no bucket matches then consult_professional with no message")
        void noMatchFallsBackToConsult() {
            EvaluationResult result = engine.evaluate(sampleDefinition(),
                    answers("{\"age_check\": false, \"pregnancy_check\": false}"));

            assertThat(result.outcome()).isEqualTo(Outcome.CONSULT_PROFESSIONAL);
            assertThat(result.message()).isNull();
        }

        @Test
        @DisplayName("evaluate: when both an ineligible and an eligible bucket match then ineligible wins")
        void ineligibleBeatsEligible() {
            QuestionnaireDefinition definition = definition("""
                    {
                      "title": "Overlap",
                      "questions": [{"id": "smoker", "type": "boolean", "text": "Do you smoke?", "required": true}],
                      "ruleset": {
                        "eligible": [{"conditions": [{"questionId": "smoker", "operator": "equals", "value": true}]}],
                        "ineligible": [{"conditions": [{"questionId": "smoker", "operator": "equals", "value": true}]}]
                      }
                    }
                    """);

            EvaluationResult result = engine.evaluate(definition, answers("{\"smoker\": true}"));

            assertThat(result.outcome()).isEqualTo(Outcome.INELIGIBLE);
        }

        @Test
        @DisplayName("evaluate: when any of several eligible buckets matches then eligible")
        void bucketsUnderOneOutcomeAreAlternatives() {
            QuestionnaireDefinition definition = definition("""
                    {
                      "title": "Either",
                      "questions": [
                        {"id": "age", "type": "numeric", "text": "Age", "required": true},
                        {"id": "on_statin", "type": "boolean", "text": "Statin?", "required": true}
                      ],
                      "ruleset": {
                        "eligible": [
                          {"conditions": [{"questionId": "age", "operator": "greater_than_or_equal", "value": 65}], "message": "age"},
                          {"conditions": [{"questionId": "on_statin", "operator": "equals", "value": true}], "message": "statin"}
                        ]
                      }
                    }
                    """);

            EvaluationResult result = engine.evaluate(definition, answers("{\"age\": 40, \"on_statin\": true}"));

            assertThat(result.outcome()).isEqualTo(Outcome.ELIGIBLE);
            assertThat(result.message()).isEqualTo("statin");
        }

        @Test
        @DisplayName("evaluate: when a bucket has no conditions then it never matches")
        void emptyBucketNeverMatches() {
            QuestionnaireDefinition base = sampleDefinition();
            QuestionnaireDefinition definition = new QuestionnaireDefinition(
                    base.title(), null, base.questions(),
                    new Ruleset(List.of(), List.of(new OutcomeBucket(List.of(), "always"))),
                    List.of());

            EvaluationResult result = engine.evaluate(definition,
                    answers("{\"age_check\": true, \"pregnancy_check\": false}"));

            assertThat(result.outcome()).isEqualTo(Outcome.CONSULT_PROFESSIONAL);
        }

        @Test
        @DisplayName("evaluate: when the same input is evaluated twice then the results are equal")
        void deterministic() {
            Map<String, com.fasterxml.jackson.databind.JsonNode> input =
                    answers("{\"age_check\": true, \"pregnancy_check\": false}");

            EvaluationResult first = engine.evaluate(sampleDefinition(), input);
            EvaluationResult second = engine.evaluate(sampleDefinition(), input);

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("answer validation")
    class AnswerValidation {

        @Test
        @DisplayName("evaluate: when several required answers are missing then every violation is reported together")
        void collectsAllMissingRequiredAnswers() {
            assertThatThrownBy(() -> engine.evaluate(sampleDefinition(), answers("{}")))
                    .isInstanceOf(AnswerValidationException.class)
                    .extracting(e -> ((AnswerValidationException) e).getViolations(), MAP)
                    .containsOnlyKeys("age_check", "pregnancy_check");
        }

        @Test
        @DisplayName("evaluate: when a required answer is JSON null then it counts as missing")
        void nullAnswerIsMissing() {
            assertThatThrownBy(() -> engine.evaluate(sampleDefinition(),
                    answers("{\"age_check\": true, \"pregnancy_check\": null}")))
                    .isInstanceOf(AnswerValidationException.class)
                    .extracting(e -> ((AnswerValidationException) e).getViolations(), MAP)
                    .containsEntry("pregnancy_check", "answer is required");
        }

        @Test
        @DisplayName("evaluate: when an answer names an unknown question then it is rejected")
        void unknownQuestionIdRejected() {
            assertThatThrownBy(() -> engine.evaluate(sampleDefinition(),
                    answers("{\"age_check\": true, \"pregnancy_check\": false, \"shoe_size\": 9}")))
                    .isInstanceOf(AnswerValidationException.class)
                    .extracting(e -> ((AnswerValidationException) e).getViolations(), MAP)
                    .containsOnlyKeys("shoe_size");
        }

        @Test
        @DisplayName("evaluate: when a boolean question gets the string \"yes\" then it is rejected")
        void booleanRequiresJsonBoolean() {
            assertThatThrownBy(() -> engine.evaluate(sampleDefinition(),
                    answers("{\"age_check\": \"yes\", \"pregnancy_check\": false}")))
                    .isInstanceOf(AnswerValidationException.class)
                    .extracting(e -> ((AnswerValidationException) e).getViolations(), MAP)
                    .containsEntry("age_check", "must be true or false");
        }

        @Test
        @DisplayName("evaluate: when a numeric answer is outside its bounds then it is rejected")
        void numericBoundsEnforced() {
            QuestionnaireDefinition definition = definition("""
                    {
                      "title": "Age",
                      "questions": [{"id": "age", "type": "numeric", "text": "Age", "required": true, "min": 18, "max": 120}],
                      "ruleset": {"eligible": [{"conditions": [{"questionId": "age", "operator": "greater_than", "value": 40}]}]}
                    }
                    """);

            assertThatThrownBy(() -> engine.evaluate(definition, answers("{\"age\": 12}")))
                    .isInstanceOf(AnswerValidationException.class)
                    .extracting(e -> ((AnswerValidationException) e).getViolations(), MAP)
                    .containsEntry("age", "must be at least 18");
        }

        @Test
        @DisplayName("evaluate: when a numeric answer overflows a double then it is rejected as not a number")
        void numericOverflowRejected() {
            QuestionnaireDefinition definition = definition("""
                    {
                      "title": "Age",
                      "questions": [{"id": "age", "type": "numeric", "text": "Age", "required": true}],
                      "ruleset": {"eligible": [{"conditions": [{"questionId": "age", "operator": "greater_than", "value": 40}]}]}
                    }
                    """);

            assertThatThrownBy(() -> engine.evaluate(definition, answers("{\"age\": 1e400}")))
                    .isInstanceOf(AnswerValidationException.class)
                    .extracting(e -> ((AnswerValidationException) e).getViolations(), MAP)
                    .containsEntry("age", "must be a number");
        }

        @Test
        @DisplayName("evaluate: when a single-choice answer is not an option then it is rejected")
        void choiceMustBeAnOption() {
            QuestionnaireDefinition definition = definition("""
                    {
                      "title": "Frequency",
                      "questions": [{"id": "freq", "type": "single_choice", "text": "How often?", "required": true,
                                     "options": ["daily", "weekly"]}],
                      "ruleset": {"eligible": [{"conditions": [{"questionId": "freq", "operator": "equals", "value": "daily"}]}]}
                    }
                    """);

            assertThatThrownBy(() -> engine.evaluate(definition, answers("{\"freq\": \"hourly\"}")))
                    .isInstanceOf(AnswerValidationException.class);
        }

        @Test
        @DisplayName("evaluate: when validation fails then no outcome is produced even if a bucket would match")
        void validationRunsBeforeRules() {
            assertThatThrownBy(() -> engine.evaluate(sampleDefinition(),
                    answers("{\"pregnancy_check\": true}")))
                    .isInstanceOf(AnswerValidationException.class);
        }
    }

    @Nested
    @DisplayName("comparisons")
    class Comparisons {

        private final QuestionnaireDefinition numericDefinition = definition("""
                {
                  "title": "LDL",
                  "questions": [{"id": "ldl", "type": "numeric", "text": "LDL", "required": true}],
                  "ruleset": {
                    "ineligible": [{"conditions": [{"questionId": "ldl", "operator": "greater_than_or_equal", "value": 190}]}],
                    "eligible": [{"conditions": [{"questionId": "ldl", "operator": "less_than", "value": 130.5}]}]
                  }
                }
                """);

        @Test
        @DisplayName("evaluate: when a numeric answer arrives as a string then it is compared as a number")
        void numericStringsAreNumbers() {
            EvaluationResult result = engine.evaluate(numericDefinition, answers("{\"ldl\": \" 190.0 \"}"));

            assertThat(result.outcome()).isEqualTo(Outcome.INELIGIBLE);
            assertThat(result.normalizedAnswers().get("ldl").decimalValue()).isEqualByComparingTo("190");
        }

        @Test
        @DisplayName("evaluate: when the value sits on a decimal boundary then the comparison is exact")
        void decimalBoundary() {
            assertThat(engine.evaluate(numericDefinition, answers("{\"ldl\": 130.49}")).outcome())
                    .isEqualTo(Outcome.ELIGIBLE);
            assertThat(engine.evaluate(numericDefinition, answers("{\"ldl\": 130.5}")).outcome())
                    .isEqualTo(Outcome.CONSULT_PROFESSIONAL);
        }

        @Test
        @DisplayName("evaluate: when option strings differ only in case then they do not match")
        void stringsAreCaseSensitive() {
            QuestionnaireDefinition definition = definition("""
                    {
                      "title": "Case",
                      "questions": [{"id": "answer", "type": "single_choice", "text": "Pick", "required": true,
                                     "options": ["Daily", "daily"]}],
                      "ruleset": {"eligible": [{"conditions": [{"questionId": "answer", "operator": "equals", "value": "Daily"}]}]}
                    }
                    """);

            assertThat(engine.evaluate(definition, answers("{\"answer\": \"daily\"}")).outcome())
                    .isEqualTo(Outcome.CONSULT_PROFESSIONAL);
            assertThat(engine.evaluate(definition, answers("{\"answer\": \"Daily\"}")).outcome())
                    .isEqualTo(Outcome.ELIGIBLE);
        }

        @Test
        @DisplayName("evaluate: when an optional question is unanswered then conditions on it are false")
        void absentAnswerIsFalse() {
            QuestionnaireDefinition definition = definition("""
                    {
                      "title": "Optional",
                      "questions": [{"id": "allergy", "type": "boolean", "text": "Allergic?", "required": false}],
                      "ruleset": {"ineligible": [{"conditions": [{"questionId": "allergy", "operator": "not_equals", "value": false}]}]}
                    }
                    """);

            assertThat(engine.evaluate(definition, answers("{}")).outcome())
                    .isEqualTo(Outcome.CONSULT_PROFESSIONAL);
        }

        @Test
        @DisplayName("evaluate: when conditions address diagnostic-test fields then each field is compared")
        void diagnosticTestFields() {
            QuestionnaireDefinition definition = definition("""
                    {
                      "title": "Lab",
                      "questions": [{"id": "lipid_panel", "type": "diagnostic_test", "text": "Recent lipid panel", "required": true,
                                     "testType": "lipid"}],
                      "ruleset": {
                        "eligible": [{"conditions": [
                          {"questionId": "lipid_panel", "field": "hasTest", "operator": "equals", "value": true},
                          {"questionId": "lipid_panel", "field": "result", "operator": "less_than", "value": 160}
                        ]}]
                      }
                    }
                    """);

            assertThat(engine.evaluate(definition,
                    answers("{\"lipid_panel\": {\"hasTest\": true, \"result\": 120, \"testName\": \" LDL \"}}")).outcome())
                    .isEqualTo(Outcome.ELIGIBLE);
            assertThat(engine.evaluate(definition,
                    answers("{\"lipid_panel\": {\"hasTest\": false}}")).outcome())
                    .isEqualTo(Outcome.CONSULT_PROFESSIONAL);
        }

        @Test
        @DisplayName("evaluate: when a diagnostic-test answer lacks hasTest then it is rejected")
        void diagnosticTestNeedsHasTest() {
            QuestionnaireDefinition definition = definition("""
                    {
                      "title": "Lab",
                      "questions": [{"id": "lab", "type": "diagnostic_test", "text": "Lab", "required": true}],
                      "ruleset": {"eligible": [{"conditions": [{"questionId": "lab", "field": "hasTest", "operator": "equals", "value": true}]}]}
                    }
                    """);

            assertThatThrownBy(() -> engine.evaluate(definition, answers("{\"lab\": {\"result\": \"normal\"}}")))
                    .isInstanceOf(AnswerValidationException.class)
                    .extracting(e -> ((AnswerValidationException) e).getViolations(), MAP)
                    .containsEntry("lab", "hasTest must be true or false");
        }
    }

    @Nested
    @DisplayName("configuration faults")
    class ConfigurationFaults {

        @Test
        @DisplayName("evaluate: when a condition references an unknown question then it fails closed")
        void unknownQuestionFailsClosed() {
            QuestionnaireDefinition base = sampleDefinition();
            QuestionnaireDefinition definition = new QuestionnaireDefinition(base.title(), null, base.questions(),
                    new Ruleset(List.of(), List.of(new OutcomeBucket(List.of(
                            Condition.of("age_check", ComparisonOperator.EQUALS, BooleanNode.TRUE),
                            Condition.of("ghost", ComparisonOperator.EQUALS, BooleanNode.TRUE)), null))),
                    List.of());

            assertThatThrownBy(() -> engine.evaluate(definition,
                    answers("{\"age_check\": false, \"pregnancy_check\": false}")))
                    .isInstanceOf(RulesetConfigurationException.class)
                    .hasMessageContaining("ghost");
        }

        @Test
        @DisplayName("evaluate: when a condition uses an unknown operator then it fails closed")
        void unknownOperatorFailsClosed() {
            QuestionnaireDefinition definition = definition("""
                    {
                      "title": "Bad",
                      "questions": [{"id": "q", "type": "boolean", "text": "Q", "required": true}],
                      "ruleset": {"eligible": [{"conditions": [{"questionId": "q", "operator": "roughly", "value": true}]}]}
                    }
                    """);

            assertThatThrownBy(() -> engine.evaluate(definition, answers("{\"q\": true}")))
                    .isInstanceOf(RulesetConfigurationException.class)
                    .hasMessageContaining("roughly");
        }

        @Test
        @DisplayName("evaluate: when a boolean question is compared with text then it fails closed instead of defaulting")
        void typeMismatchFailsClosed() {
            QuestionnaireDefinition definition = definition("""
                    {
                      "title": "Bad",
                      "questions": [{"id": "q", "type": "boolean", "text": "Q", "required": true}],
                      "ruleset": {"ineligible": [{"conditions": [{"questionId": "q", "operator": "equals", "value": "yes"}]}]}
                    }
                    """);

            assertThatThrownBy(() -> engine.evaluate(definition, answers("{\"q\": true}")))
                    .isInstanceOf(RulesetConfigurationException.class);
        }

        @Test
        @DisplayName("evaluate: when the definition has no ruleset then it fails closed")
        void missingRulesetFailsClosed() {
            QuestionnaireDefinition base = sampleDefinition();
            QuestionnaireDefinition definition = new QuestionnaireDefinition(base.title(), null, base.questions(), null, null);

            assertThatThrownBy(() -> engine.evaluate(definition,
                    answers("{\"age_check\": true, \"pregnancy_check\": false}")))
                    .isInstanceOf(RulesetConfigurationException.class);
        }
    }
}
