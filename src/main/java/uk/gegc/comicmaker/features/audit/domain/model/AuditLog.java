package uk.gegc.comicmaker.features.audit.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only audit record. No setters: rows are written once through the constructor.
 */
@Entity
@Immutable
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_logs_user", columnList = "user_id"),
        @Index(name = "idx_audit_logs_resource", columnList = "resource_type, resource_id")
})
@Getter
@NoArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 32)
    private AuditAction action;

    @Column(name = "resource_type", nullable = false, updatable = false, length = 32)
    private String resourceType;

    @Column(name = "resource_id", updatable = false, length = 255)
    private String resourceId;

    @Column(name = "old_value", updatable = false, length = 255)
    private String oldValue;

    @Column(name = "new_value", updatable = false, length = 255)
    private String newValue;

    @Column(name = "metadata", updatable = false, columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public AuditLog(UUID userId, AuditAction action, String resourceType, String resourceId,
                    String oldValue, String newValue, String metadata, LocalDateTime createdAt) {
        this.userId = userId;
        this.action = action;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.metadata = metadata;
        this.createdAt = createdAt;
    }
}
