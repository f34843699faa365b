package uk.gegc.comicmaker.features.billing.application;

import java.util.Map;

/**
 * Outbound order creation at the payment gateway.
 */
public interface PaymentGatewayClient {

    record GatewayOrder(String id, long amount, String currency, String status, String receipt) {
    }

    /**
     * @throws uk.gegc.comicmaker.features.billing.domain.exception.PaymentOrderCreateFailedException
     *         when the gateway rejects the request or cannot be reached
     */
    GatewayOrder createOrder(long amount, String currency, String receipt, Map<String, String> notes);
}
