package uk.gegc.comicmaker.features.user.domain.model;

public enum AccountStatus {
    ACTIVE,
    SUSPENDED,
    DELETED
}
