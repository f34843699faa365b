package uk.gegc.comicmaker.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Gateway event ids already applied to a payment. The primary key on {@code event_id} is what
 * turns two concurrent deliveries of the same event into one insert and one constraint violation.
 * The id is assigned, so the entity reports itself new until persisted or loaded; otherwise
 * {@code save} would merge onto a row committed by a concurrent delivery instead of inserting.
 */
@Entity
@Table(name = "processed_payment_events", indexes = {
        @Index(name = "idx_processed_payment_events_payment", columnList = "payment_id")
})
@Getter
@Setter
@NoArgsConstructor
public class ProcessedPaymentEvent implements Persistable<String> {

    @Id
    @Column(name = "event_id", length = 255, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "payment_id", nullable = false, updatable = false)
    private UUID paymentId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 64)
    private String eventType;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private LocalDateTime processedAt;

    @Transient
    private boolean isNew = true;

    public ProcessedPaymentEvent(String eventId, UUID paymentId, String eventType, LocalDateTime processedAt) {
        this.eventId = eventId;
        this.paymentId = paymentId;
        this.eventType = eventType;
        this.processedAt = processedAt;
    }

    @Override
    public String getId() {
        return eventId;
    }

    @Override
    @Transient
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }
}
