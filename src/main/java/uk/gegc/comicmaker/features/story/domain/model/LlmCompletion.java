package uk.gegc.comicmaker.features.story.domain.model;

public record LlmCompletion(String content, LlmUsage usage) {}
