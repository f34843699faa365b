package uk.gegc.comicmaker.features.comic.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.comic.config.ImageGenerationProperties;
import uk.gegc.comicmaker.features.project.domain.model.NarrativeText;
import uk.gegc.comicmaker.features.project.domain.model.ProjectConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a panel's narrative into an image prompt. Dialogue is never drawn, only room is left for it.
 */
@Component
@RequiredArgsConstructor
public class PanelPromptBuilder {

    private static final String ELLIPSIS = "...";

    private final ImageGenerationProperties properties;

    public String build(NarrativeText narrative, ProjectConfig config) {
        List<String> parts = new ArrayList<>();
        String style = config != null ? config.styleOrDefault() : ProjectConfig.defaults().styleOrDefault();
        parts.add("Comic panel in " + style + " style.");

        if (narrative != null) {
            if (hasText(narrative.setting())) {
                parts.add("Setting: " + narrative.setting() + ".");
            }
            if (hasText(narrative.action())) {
                parts.add("Action: " + narrative.action() + ".");
            }
            if (narrative.hasDialogue()) {
                parts.add("Leave space for speech bubbles.");
            }
        }
        parts.add("High quality, detailed, dynamic composition.");

        String prompt = String.join(" ", parts);
        int max = properties.getMaxPromptLength();
        if (prompt.length() > max) {
            prompt = prompt.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
        }
        return prompt;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
