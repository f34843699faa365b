package uk.gegc.comicmaker.features.billing.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging fields for payment webhook handling.
 */
@Data
@Builder
public class WebhookLoggingContext {
    private String eventId;
    private String eventType;
    private String orderId;
    private String paymentId;
    private UUID userId;

    public void setMDC() {
        if (eventId != null) MDC.put("payment_event_id", eventId);
        if (eventType != null) MDC.put("payment_event_type", eventType);
        if (orderId != null) MDC.put("payment_order_id", orderId);
        if (paymentId != null) MDC.put("payment_id", paymentId);
        if (userId != null) MDC.put("user_id", userId.toString());
    }

    public static void clearMDC() {
        MDC.remove("payment_event_id");
        MDC.remove("payment_event_type");
        MDC.remove("payment_order_id");
        MDC.remove("payment_id");
        MDC.remove("user_id");
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.error(message, args);
        } finally {
            clearMDC();
        }
    }
}
