package uk.gegc.comicmaker.features.story.api.dto;

import uk.gegc.comicmaker.features.story.domain.model.LlmUsage;

public record StoryParseResponse(
        String status,
        int pages,
        int totalPages,
        int firstPageScenes,
        LlmUsage usage
) {}
