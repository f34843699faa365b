package uk.gegc.comicmaker.features.story.domain.exception;

public class StoryParseFailedException extends RuntimeException {

    public StoryParseFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
