package uk.gegc.comicmaker.features.billing.domain.exception;

import uk.gegc.comicmaker.shared.exception.ResourceNotFoundException;

public class PaymentNotFoundException extends ResourceNotFoundException {

    public PaymentNotFoundException(String orderId) {
        super("Payment order " + orderId + " not found");
    }
}
