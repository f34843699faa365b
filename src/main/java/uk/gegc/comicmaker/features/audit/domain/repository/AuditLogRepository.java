package uk.gegc.comicmaker.features.audit.domain.repository;

import org.springframework.data.repository.Repository;
import uk.gegc.comicmaker.features.audit.domain.model.AuditAction;
import uk.gegc.comicmaker.features.audit.domain.model.AuditLog;

import java.util.List;
import java.util.UUID;

/**
 * Insert and read only. Deliberately not a {@code JpaRepository} so no delete path is exposed.
 */
public interface AuditLogRepository extends Repository<AuditLog, UUID> {

    AuditLog save(AuditLog auditLog);

    List<AuditLog> findByUserIdOrderByCreatedAtAsc(UUID userId);

    List<AuditLog> findByResourceTypeAndResourceIdOrderByCreatedAtAsc(String resourceType, String resourceId);

    long countByUserIdAndAction(UUID userId, AuditAction action);

    long count();
}
