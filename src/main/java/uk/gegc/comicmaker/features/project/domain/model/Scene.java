package uk.gegc.comicmaker.features.project.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One panel of one page. Panels are numbered 1..4.
 */
@Entity
@Table(name = "scenes", uniqueConstraints = {
        @UniqueConstraint(name = "uk_scenes_project_page_panel", columnNames = {"project_id", "page_no", "panel_no"})
})
@Getter
@Setter
@NoArgsConstructor
public class Scene {

    public static final int PANELS_PER_PAGE = 4;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "page_no", nullable = false)
    private int pageNo;

    @Column(name = "panel_no", nullable = false)
    private int panelNo;

    @Convert(converter = NarrativeTextConverter.class)
    @Column(name = "narrative_text", columnDefinition = "TEXT", nullable = false)
    private NarrativeText narrativeText;

    @Column(name = "language", length = 32)
    private String language;

    @Column(name = "prompt_used", columnDefinition = "TEXT")
    private String promptUsed;

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
}
