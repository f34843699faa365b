package uk.gegc.comicmaker.features.project.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(String style, String language) {

    public static final String DEFAULT_STYLE = "comic";
    public static final String DEFAULT_LANGUAGE = "english";

    public static ProjectConfig defaults() {
        return new ProjectConfig(DEFAULT_STYLE, DEFAULT_LANGUAGE);
    }

    public String styleOrDefault() {
        return style == null || style.isBlank() ? DEFAULT_STYLE : style;
    }

    public String languageOrDefault() {
        return language == null || language.isBlank() ? DEFAULT_LANGUAGE : language;
    }
}
