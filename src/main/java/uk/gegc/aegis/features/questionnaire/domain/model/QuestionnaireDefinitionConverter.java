package uk.gegc.aegis.features.questionnaire.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

@Converter
public class QuestionnaireDefinitionConverter implements AttributeConverter<QuestionnaireDefinition, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().findAndRegisterModules();

    @Override
    public String convertToDatabaseColumn(QuestionnaireDefinition attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize questionnaire definition", e);
        }
    }

    @Override
    public QuestionnaireDefinition convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(dbData, QuestionnaireDefinition.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize questionnaire definition", e);
        }
    }
}
