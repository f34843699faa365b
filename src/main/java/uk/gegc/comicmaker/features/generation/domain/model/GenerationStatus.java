package uk.gegc.comicmaker.features.generation.domain.model;

public enum GenerationStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
