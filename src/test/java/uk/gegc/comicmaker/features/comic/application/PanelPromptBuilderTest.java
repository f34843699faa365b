package uk.gegc.comicmaker.features.comic.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.comicmaker.features.comic.config.ImageGenerationProperties;
import uk.gegc.comicmaker.features.project.domain.model.NarrativeText;
import uk.gegc.comicmaker.features.project.domain.model.ProjectConfig;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PanelPromptBuilder Unit Tests")
class PanelPromptBuilderTest {

    private final ImageGenerationProperties properties = new ImageGenerationProperties();
    private final PanelPromptBuilder builder = new PanelPromptBuilder(properties);

    @Test
    @DisplayName("build: includes style, setting and action in order, ending with the quality suffix")
    void build_FullNarrative() {
        NarrativeText narrative = new NarrativeText("A cat leaps", List.of("Meow!"), "The cat leaps over a fence",
                "a moonlit alley", null);

        String prompt = builder.build(narrative, new ProjectConfig("manga", "english"));

        assertThat(prompt).isEqualTo("Comic panel in manga style. Setting: a moonlit alley. "
                + "Action: The cat leaps over a fence. Leave space for speech bubbles. "
                + "High quality, detailed, dynamic composition.");
    }

    @Test
    @DisplayName("build: without dialogue there is no speech bubble hint")
    void build_NoDialogue_NoBubbleHint() {
        NarrativeText narrative = new NarrativeText("Quiet street", List.of(" "), "Nothing moves", "implied", null);

        String prompt = builder.build(narrative, ProjectConfig.defaults());

        assertThat(prompt)
                .startsWith("Comic panel in comic style.")
                .doesNotContain("speech bubbles");
    }

    @Test
    @DisplayName("build: null config falls back to the default style")
    void build_NullConfig_DefaultStyle() {
        String prompt = builder.build(new NarrativeText(null, null, null, null, null), null);

        assertThat(prompt).isEqualTo("Comic panel in comic style. High quality, detailed, dynamic composition.");
    }

    @Test
    @DisplayName("build: prompts longer than the limit are truncated with an ellipsis")
    void build_LongPrompt_Truncated() {
        String action = "x".repeat(2000);
        NarrativeText narrative = new NarrativeText(action, null, action, "implied", null);

        String prompt = builder.build(narrative, ProjectConfig.defaults());

        assertThat(prompt).hasSize(properties.getMaxPromptLength()).endsWith("...");
    }
}
