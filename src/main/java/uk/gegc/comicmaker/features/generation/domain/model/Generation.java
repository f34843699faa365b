package uk.gegc.comicmaker.features.generation.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One asynchronous job. {@code activeProjectId} mirrors {@code projectId} while the job is QUEUED
 * or PROCESSING and is cleared on completion or failure; its unique index is what limits a
 * project to one active job.
 */
@Entity
@Table(name = "generations", indexes = {
        @Index(name = "idx_generations_project_type", columnList = "project_id, task_type, created_at")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_generations_job_id", columnNames = {"job_id"}),
        @UniqueConstraint(name = "uk_generations_active_project", columnNames = {"active_project_id"})
})
@Getter
@Setter
@NoArgsConstructor
public class Generation {

    public static final int MAX_ERROR_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, updatable = false, length = 32)
    private TaskType taskType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private GenerationStatus status = GenerationStatus.QUEUED;

    @Column(name = "progress", nullable = false)
    private int progress;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "job_id", length = 64)
    private String jobId;

    @Column(name = "error_message", length = MAX_ERROR_LENGTH)
    private String errorMessage;

    @Column(name = "active_project_id")
    private UUID activeProjectId;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
        if (status == null) {
            status = GenerationStatus.QUEUED;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public static String truncateError(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH
                ? message.substring(0, MAX_ERROR_LENGTH - 3) + "..."
                : message;
    }
}
