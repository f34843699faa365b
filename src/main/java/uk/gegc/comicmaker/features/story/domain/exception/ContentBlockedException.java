package uk.gegc.comicmaker.features.story.domain.exception;

public class ContentBlockedException extends RuntimeException {

    public ContentBlockedException() {
        super("Story input contains content that is not allowed");
    }
}
