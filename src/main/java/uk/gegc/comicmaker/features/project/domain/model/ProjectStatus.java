package uk.gegc.comicmaker.features.project.domain.model;

/**
 * DRAFT -> GENERATING -> COMPLETED | FAILED
 */
public enum ProjectStatus {
    DRAFT,
    GENERATING,
    COMPLETED,
    FAILED
}
