package uk.gegc.comicmaker.features.story.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "StoryParseRequest", description = "Free-text story to turn into panels")
public record StoryParseRequest(
        @Schema(description = "Story description", example = "A lighthouse keeper finds a message in a bottle...")
        @NotBlank(message = "Input text is required")
        @Size(min = 10, max = 5000, message = "Input text must be between 10 and 5000 characters")
        String inputText
) {}
