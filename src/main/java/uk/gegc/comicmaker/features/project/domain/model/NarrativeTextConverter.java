package uk.gegc.comicmaker.features.project.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

@Converter
public class NarrativeTextConverter implements AttributeConverter<NarrativeText, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().findAndRegisterModules();

    @Override
    public String convertToDatabaseColumn(NarrativeText attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize narrative text", e);
        }
    }

    @Override
    public NarrativeText convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(dbData, NarrativeText.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize narrative text", e);
        }
    }
}
