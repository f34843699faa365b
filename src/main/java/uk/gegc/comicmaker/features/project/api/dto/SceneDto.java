package uk.gegc.comicmaker.features.project.api.dto;

import uk.gegc.comicmaker.features.project.domain.model.NarrativeText;

import java.util.UUID;

public record SceneDto(
        UUID id,
        int pageNo,
        int panelNo,
        NarrativeText narrativeText,
        String language,
        String promptUsed
) {}
