package uk.gegc.comicmaker.features.audit.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.comicmaker.features.audit.application.AuditService;
import uk.gegc.comicmaker.features.audit.domain.model.AuditAction;
import uk.gegc.comicmaker.features.audit.domain.model.AuditLog;
import uk.gegc.comicmaker.features.audit.domain.repository.AuditLogRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditServiceImpl implements AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditLog record(UUID userId,
                           AuditAction action,
                           String resourceType,
                           String resourceId,
                           String oldValue,
                           String newValue,
                           Map<String, Object> metadata) {
        AuditLog entry = new AuditLog(
                userId,
                action,
                resourceType,
                resourceId,
                oldValue,
                newValue,
                serialize(metadata),
                LocalDateTime.now(clock)
        );
        AuditLog saved = auditLogRepository.save(entry);
        log.info("Audit: action={} user={} resource={}:{} {} -> {}",
                action, userId, resourceType, resourceId, oldValue, newValue);
        return saved;
    }

    private String serialize(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit metadata", e);
        }
    }
}
