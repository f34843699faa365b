package uk.gegc.comicmaker.features.audit.application;

import uk.gegc.comicmaker.features.audit.domain.model.AuditAction;
import uk.gegc.comicmaker.features.audit.domain.model.AuditLog;

import java.util.Map;
import java.util.UUID;

public interface AuditService {

    AuditLog record(UUID userId,
                    AuditAction action,
                    String resourceType,
                    String resourceId,
                    String oldValue,
                    String newValue,
                    Map<String, Object> metadata);
}
