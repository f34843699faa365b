package uk.gegc.comicmaker.features.generation.domain.model;

public enum TaskType {
    IMAGE_GENERATION,
    PDF_COMPILATION
}
