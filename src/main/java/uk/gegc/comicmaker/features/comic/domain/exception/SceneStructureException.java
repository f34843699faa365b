package uk.gegc.comicmaker.features.comic.domain.exception;

/**
 * A page does not carry exactly four panels. Retrying cannot repair it.
 */
public class SceneStructureException extends RuntimeException {

    public SceneStructureException(String message) {
        super(message);
    }
}
