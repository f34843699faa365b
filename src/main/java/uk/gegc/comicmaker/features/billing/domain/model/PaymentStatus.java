package uk.gegc.comicmaker.features.billing.domain.model;

public enum PaymentStatus {
    CREATED,
    PENDING,
    SUCCESS,
    FAILED,
    REFUNDED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == REFUNDED;
    }
}
