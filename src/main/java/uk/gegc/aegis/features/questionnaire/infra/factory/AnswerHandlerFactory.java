package uk.gegc.aegis.features.questionnaire.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.aegis.features.questionnaire.domain.model.QuestionType;
import uk.gegc.aegis.features.questionnaire.infra.handler.AnswerHandler;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class AnswerHandlerFactory {
    private final Map<QuestionType, AnswerHandler> handlerMap = new EnumMap<>(QuestionType.class);

    public AnswerHandlerFactory(List<AnswerHandler> handlers) {
        handlers.forEach(handler -> handlerMap.put(handler.supportedType(), handler));
        log.info("AnswerHandlerFactory initialized with handlers for types: {}", handlerMap.keySet());
    }

    public AnswerHandler getHandler(QuestionType type) {
        AnswerHandler handler = type == null ? null : handlerMap.get(type);
        if (handler == null) {
            throw new UnsupportedOperationException("No answer handler for type " + type);
        }
        return handler;
    }
}
