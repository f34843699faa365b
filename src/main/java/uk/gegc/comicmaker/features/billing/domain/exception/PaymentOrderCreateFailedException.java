package uk.gegc.comicmaker.features.billing.domain.exception;

import uk.gegc.comicmaker.shared.exception.UpstreamServiceException;

public class PaymentOrderCreateFailedException extends UpstreamServiceException {

    public PaymentOrderCreateFailedException(String message, boolean transientFailure, Throwable cause) {
        super(message, transientFailure, cause);
    }

    public PaymentOrderCreateFailedException(String message) {
        super(message, false);
    }
}
