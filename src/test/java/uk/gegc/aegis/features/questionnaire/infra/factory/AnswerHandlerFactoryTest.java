package uk.gegc.aegis.features.questionnaire.infra.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionType;
import uk.gegc.aegis.features.questionnaire.infra.handler.BooleanAnswerHandler;
import uk.gegc.aegis.features.questionnaire.infra.handler.SingleChoiceAnswerHandler;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.aegis.testsupport.QuestionnaireFixtures.handlerFactory;

class AnswerHandlerFactoryTest {

    @Test
    @DisplayName("getHandler: when every handler is registered then each question type resolves to its own handler")
    void everyTypeHasAHandler() {
        AnswerHandlerFactory factory = handlerFactory();

        Arrays.stream(QuestionType.values())
                .forEach(type -> assertThat(factory.getHandler(type).supportedType()).isEqualTo(type));
    }

    @Test
    @DisplayName("getHandler: when no handler is registered for a type then it throws")
    void missingHandlerThrows() {
        AnswerHandlerFactory factory = new AnswerHandlerFactory(List.of(new BooleanAnswerHandler(), new SingleChoiceAnswerHandler()));

        assertThatThrownBy(() -> factory.getHandler(QuestionType.NUMERIC))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> factory.getHandler(null))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
