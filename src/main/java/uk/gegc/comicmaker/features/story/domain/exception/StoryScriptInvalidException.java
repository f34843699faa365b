package uk.gegc.comicmaker.features.story.domain.exception;

/**
 * LLM output that is not valid JSON or does not satisfy the script rules.
 */
public class StoryScriptInvalidException extends RuntimeException {

    public StoryScriptInvalidException(String message) {
        super(message);
    }

    public StoryScriptInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
