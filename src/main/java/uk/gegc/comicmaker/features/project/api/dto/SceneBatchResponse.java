package uk.gegc.comicmaker.features.project.api.dto;

import java.util.List;

public record SceneBatchResponse(int totalPages, List<SceneDto> scenes) {}
