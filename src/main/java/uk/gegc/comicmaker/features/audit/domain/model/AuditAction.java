package uk.gegc.comicmaker.features.audit.domain.model;

public enum AuditAction {
    PAYMENT_CREATED,
    PAYMENT_SUCCESS,
    PAYMENT_FAILED,
    PLAN_UPGRADED
}
