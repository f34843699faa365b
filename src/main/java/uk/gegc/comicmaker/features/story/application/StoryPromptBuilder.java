package uk.gegc.comicmaker.features.story.application;

import org.springframework.stereotype.Component;

/**
 * Prompt text for turning a story description into a four-panels-per-page script.
 */
@Component
public class StoryPromptBuilder {

    private static final String SYSTEM_TEMPLATE = """
            You are an expert comic book writer and storyboard artist.
            Your task is to turn a story description into a structured comic script.

            STRICT RULES:
            1. Output MUST be valid JSON matching the schema below.
            2. The comic MUST be divided into pages, with EXACTLY 4 panels per page.
            3. If the story is short, pad it to fill 4 panels. If long, split it into several pages of 4 panels each.
            4. Each panel needs:
               - description: visual details for an artist to draw.
               - dialogue: character dialogue, or null.
               - caption: narrative text, or null.
            5. Do NOT wrap the JSON in markdown fences. Return the raw JSON only.
            6. Language: write text in %s, but keep the keys in English.

            JSON SCHEMA:
            {
              "pages": [
                {
                  "page_no": 1,
                  "panels": [
                    {"panel_no": 1, "description": "...", "dialogue": "...", "caption": "..."}
                  ]
                }
              ]
            }
            """;

    private static final String USER_TEMPLATE = """
            STORY INPUT:
            %s

            STYLE: %s
            THEME: %s

            Generate the comic script now. Remember: exactly 4 panels per page.
            """;

    public String systemPrompt(String language) {
        return SYSTEM_TEMPLATE.formatted(language);
    }

    public String userPrompt(String inputText, String style, String theme) {
        return USER_TEMPLATE.formatted(inputText, style, theme);
    }
}
