package uk.gegc.comicmaker.features.story.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Comic script returned by the LLM: pages of exactly four panels.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoryScript(List<Page> pages) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Page(
            @JsonProperty("page_no") Integer pageNo,
            List<Panel> panels
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Panel(
            @JsonProperty("panel_no") Integer panelNo,
            String description,
            String dialogue,
            String caption
    ) {}
}
