package uk.gegc.comicmaker.features.asset.domain.exception;

public class AssetMissingException extends RuntimeException {

    public AssetMissingException(String message) {
        super(message);
    }
}
