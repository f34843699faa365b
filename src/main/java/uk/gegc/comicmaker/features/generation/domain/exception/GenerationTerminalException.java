package uk.gegc.comicmaker.features.generation.domain.exception;

/**
 * A job failure that retrying cannot fix. Workers record it on the Generation and stop.
 */
public class GenerationTerminalException extends RuntimeException {

    public GenerationTerminalException(String message) {
        super(message);
    }
}
