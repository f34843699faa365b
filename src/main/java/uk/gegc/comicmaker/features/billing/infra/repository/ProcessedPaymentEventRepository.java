package uk.gegc.comicmaker.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.comicmaker.features.billing.domain.model.ProcessedPaymentEvent;

public interface ProcessedPaymentEventRepository extends JpaRepository<ProcessedPaymentEvent, String> {

    boolean existsByEventId(String eventId);
}
