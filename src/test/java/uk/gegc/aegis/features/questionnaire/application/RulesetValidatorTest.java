package uk.gegc.aegis.features.questionnaire.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.aegis.features.questionnaire.domain.exception.RulesetConfigurationException;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionnaireDefinition;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowable;
import static uk.gegc.aegis.testsupport.QuestionnaireFixtures.definition;
import static uk.gegc.aegis.testsupport.QuestionnaireFixtures.handlerFactory;
import static uk.gegc.aegis.testsupport.QuestionnaireFixtures.sampleDefinition;

class RulesetValidatorTest {

    private RulesetValidator validator;

    @BeforeEach
    void setUp() {
        validator = new RulesetValidator(handlerFactory());
    }

    private List<String> violationsOf(QuestionnaireDefinition definition) {
        Throwable thrown = catchThrowable(() -> validator.validate(definition));
        assertThat(thrown).isInstanceOf(RulesetConfigurationException.class);
        return ((RulesetConfigurationException) thrown).getViolations();
    }

    @Test
    @DisplayName("validate: when the definition is well formed then it passes")
    void wellFormedPasses() {
        assertThatCode(() -> validator.validate(sampleDefinition())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("validate: when several problems exist then every one is listed")
    void listsEveryViolation() {
        List<String> violations = violationsOf(definition("""
                {
                  "title": "Broken",
                  "questions": [
                    {"id": "age", "type": "numeric", "text": "Age", "min": 90, "max": 18},
                    {"id": "age", "type": "boolean", "text": "Duplicate"},
                    {"id": "freq", "type": "single_choice", "text": "How often?"}
                  ],
                  "ruleset": {
                    "ineligible": [{"conditions": [{"questionId": "ghost", "operator": "equals", "value": true}]}],
                    "eligible": [{"conditions": []}]
                  }
                }
                """));

        assertThat(violations).hasSize(5);
        assertThat(violations).anySatisfy(v -> assertThat(v).contains("min greater than max"));
        assertThat(violations).anySatisfy(v -> assertThat(v).contains("'age' is used more than once"));
        assertThat(violations).anySatisfy(v -> assertThat(v).contains("'freq' must declare at least one option"));
        assertThat(violations).anySatisfy(v -> assertThat(v).contains("unknown question 'ghost'"));
        assertThat(violations).anySatisfy(v -> assertThat(v).contains("has no conditions"));
    }

    @Test
    @DisplayName("validate: when an ordering operator targets a boolean question then it is rejected")
    void orderingOnBooleanRejected() {
        List<String> violations = violationsOf(definition("""
                {
                  "title": "Bad",
                  "questions": [{"id": "smoker", "type": "boolean", "text": "Smoker?"}],
                  "ruleset": {"ineligible": [{"conditions": [{"questionId": "smoker", "operator": "greater_than", "value": true}]}]}
                }
                """));

        assertThat(violations).singleElement().asString().contains("cannot be applied");
    }

    @Test
    @DisplayName("validate: when a choice condition names a value outside the options then it is rejected")
    void choiceValueOutsideOptionsRejected() {
        List<String> violations = violationsOf(definition("""
                {
                  "title": "Bad",
                  "questions": [{"id": "freq", "type": "single_choice", "text": "How often?", "options": ["daily", "weekly"]}],
                  "ruleset": {"eligible": [{"conditions": [{"questionId": "freq", "operator": "equals", "value": "monthly"}]}]}
                }
                """));

        assertThat(violations).singleElement().asString().contains("'monthly'");
    }

    @Test
    @DisplayName("validate: when a numeric question is compared with text then it is rejected")
    void numericAgainstTextRejected() {
        List<String> violations = violationsOf(definition("""
                {
                  "title": "Bad",
                  "questions": [{"id": "age", "type": "numeric", "text": "Age"}],
                  "ruleset": {"eligible": [{"conditions": [{"questionId": "age", "operator": "greater_than", "value": "forty"}]}]}
                }
                """));

        assertThat(violations).singleElement().asString().contains("must compare against a number");
    }

    @Test
    @DisplayName("validate: when an operator is unknown then it is rejected")
    void unknownOperatorRejected() {
        List<String> violations = violationsOf(definition("""
                {
                  "title": "Bad",
                  "questions": [{"id": "age", "type": "numeric", "text": "Age"}],
                  "ruleset": {"eligible": [{"conditions": [{"questionId": "age", "operator": "between", "value": 4}]}]}
                }
                """));

        assertThat(violations).singleElement().asString().contains("unknown operator 'between'");
    }

    @Test
    @DisplayName("validate: when a diagnostic-test condition uses an unknown field then it is rejected")
    void unknownDiagnosticFieldRejected() {
        List<String> violations = violationsOf(definition("""
                {
                  "title": "Bad",
                  "questions": [{"id": "lab", "type": "diagnostic_test", "text": "Lab"}],
                  "ruleset": {"eligible": [{"conditions": [{"questionId": "lab", "field": "colour", "operator": "equals", "value": "red"}]}]}
                }
                """));

        assertThat(violations).singleElement().asString().contains("unknown field 'colour'");
    }

    @Test
    @DisplayName("validate: when the ruleset is missing then it is rejected")
    void missingRulesetRejected() {
        QuestionnaireDefinition base = sampleDefinition();

        List<String> violations = violationsOf(new QuestionnaireDefinition(base.title(), null, base.questions(), null, null));

        assertThat(violations).containsExactly("Questionnaire must define a ruleset");
    }
}
