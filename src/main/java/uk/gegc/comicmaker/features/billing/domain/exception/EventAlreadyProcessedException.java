package uk.gegc.comicmaker.features.billing.domain.exception;

import lombok.Getter;

/**
 * The gateway event id has already been applied. Webhook callers acknowledge this as success.
 */
@Getter
public class EventAlreadyProcessedException extends RuntimeException {

    private final String eventId;

    public EventAlreadyProcessedException(String eventId) {
        super("Event already processed: " + eventId);
        this.eventId = eventId;
    }
}
