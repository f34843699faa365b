package uk.gegc.comicmaker.features.project.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A comic project. {@code planSnapshot} is fixed at creation and every limit check downstream
 * reads it instead of the owner's current plan.
 */
@Entity
@Table(name = "projects", indexes = {
        @Index(name = "idx_projects_user_deleted", columnList = "user_id, deleted_at")
})
@Getter
@Setter
@NoArgsConstructor
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Convert(converter = ProjectConfigConverter.class)
    @Column(name = "config", columnDefinition = "TEXT")
    private ProjectConfig config = ProjectConfig.defaults();

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_snapshot", nullable = false, updatable = false, length = 16)
    private PlanTier planSnapshot;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ProjectStatus status = ProjectStatus.DRAFT;

    @Column(name = "total_pages", nullable = false)
    private int totalPages;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
