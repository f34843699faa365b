package uk.gegc.comicmaker.features.plan.domain.exception;

public class PaymentNotSuccessfulException extends RuntimeException {

    public PaymentNotSuccessfulException(String message) {
        super(message);
    }
}
