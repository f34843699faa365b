package uk.gegc.comicmaker.features.project.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Structured panel narrative as produced by the story engine and consumed by prompt building.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NarrativeText(
        String description,
        List<String> dialogue,
        String action,
        String setting,
        String caption
) {
    public NarrativeText {
        dialogue = dialogue == null ? List.of() : List.copyOf(dialogue);
    }

    public boolean hasDialogue() {
        return dialogue.stream().anyMatch(line -> line != null && !line.isBlank());
    }
}
