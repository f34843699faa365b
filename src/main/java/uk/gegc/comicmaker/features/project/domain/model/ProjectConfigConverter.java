package uk.gegc.comicmaker.features.project.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

@Converter
public class ProjectConfigConverter implements AttributeConverter<ProjectConfig, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().findAndRegisterModules();

    @Override
    public String convertToDatabaseColumn(ProjectConfig attribute) {
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute == null ? ProjectConfig.defaults() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize project config", e);
        }
    }

    @Override
    public ProjectConfig convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return ProjectConfig.defaults();
        }
        try {
            return OBJECT_MAPPER.readValue(dbData, ProjectConfig.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize project config", e);
        }
    }
}
