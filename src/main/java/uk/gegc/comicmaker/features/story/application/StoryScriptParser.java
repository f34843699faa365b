package uk.gegc.comicmaker.features.story.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.comicmaker.features.project.domain.model.Scene;
import uk.gegc.comicmaker.features.story.domain.exception.StoryScriptInvalidException;
import uk.gegc.comicmaker.features.story.domain.model.StoryScript;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads and validates LLM script output: at least one page, unique page numbers,
 * panels numbered exactly 1..4 with a description each.
 */
@Component
@RequiredArgsConstructor
public class StoryScriptParser {

    private static final List<Integer> EXPECTED_PANELS = List.of(1, 2, 3, 4);

    private final ObjectMapper objectMapper;

    public StoryScript parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new StoryScriptInvalidException("Empty script");
        }
        StoryScript script;
        try {
            script = objectMapper.readValue(stripFences(raw), StoryScript.class);
        } catch (JsonProcessingException e) {
            throw new StoryScriptInvalidException("Script is not valid JSON: " + e.getOriginalMessage(), e);
        }
        validate(script);
        return script;
    }

    private void validate(StoryScript script) {
        if (script == null || script.pages() == null || script.pages().isEmpty()) {
            throw new StoryScriptInvalidException("Script has no pages");
        }
        Set<Integer> pageNumbers = new HashSet<>();
        for (StoryScript.Page page : script.pages()) {
            if (page.pageNo() == null || page.pageNo() < 1) {
                throw new StoryScriptInvalidException("Page number missing or below 1");
            }
            if (!pageNumbers.add(page.pageNo())) {
                throw new StoryScriptInvalidException("Duplicate page number " + page.pageNo());
            }
            List<StoryScript.Panel> panels = page.panels();
            if (panels == null || panels.size() != Scene.PANELS_PER_PAGE) {
                throw new StoryScriptInvalidException("Page " + page.pageNo() + " must have exactly 4 panels; got "
                        + (panels == null ? 0 : panels.size()));
            }
            List<Integer> numbers = panels.stream()
                    .map(StoryScript.Panel::panelNo)
                    .map(n -> n == null ? -1 : n)
                    .sorted()
                    .toList();
            if (!numbers.equals(EXPECTED_PANELS)) {
                throw new StoryScriptInvalidException("Panels on page " + page.pageNo() + " must be numbered 1 through 4");
            }
            for (StoryScript.Panel panel : panels) {
                if (panel.description() == null || panel.description().isBlank()) {
                    throw new StoryScriptInvalidException("Panel " + panel.panelNo() + " on page " + page.pageNo()
                            + " has no description");
                }
            }
        }
    }

    private static String stripFences(String raw) {
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            int lastFence = text.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                text = text.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return text;
    }
}
