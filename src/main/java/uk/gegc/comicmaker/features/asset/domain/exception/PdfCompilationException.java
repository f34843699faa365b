package uk.gegc.comicmaker.features.asset.domain.exception;

public class PdfCompilationException extends RuntimeException {

    public PdfCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
