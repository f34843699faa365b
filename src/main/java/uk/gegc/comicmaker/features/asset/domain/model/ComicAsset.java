package uk.gegc.comicmaker.features.asset.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.comicmaker.features.comic.domain.model.ImageResolution;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Metadata for one rendered page. The image itself lives in blob storage under {@code blobPath}.
 */
@Entity
@Table(name = "comic_assets", uniqueConstraints = {
        @UniqueConstraint(name = "uk_comic_assets_project_page", columnNames = {"project_id", "page_no"})
})
@Getter
@Setter
@NoArgsConstructor
public class ComicAsset {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "page_no", nullable = false, updatable = false)
    private int pageNo;

    @Column(name = "blob_path", nullable = false, length = 512)
    private String blobPath;

    @Column(name = "blob_url", length = 2048)
    private String blobUrl;

    @Column(name = "url_expires_at")
    private LocalDateTime urlExpiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution", nullable = false, length = 16)
    private ImageResolution resolution;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_snapshot", nullable = false, length = 16)
    private PlanTier planSnapshot;

    @Column(name = "watermarked", nullable = false)
    private boolean watermarked;

    @Column(name = "seed", nullable = false)
    private long seed;

    @Column(name = "generation_id")
    private UUID generationId;

    @Column(name = "download_count", nullable = false)
    private long downloadCount;

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

    public boolean isUrlExpired(LocalDateTime now) {
        return blobUrl == null || urlExpiresAt == null || !urlExpiresAt.isAfter(now);
    }
}
