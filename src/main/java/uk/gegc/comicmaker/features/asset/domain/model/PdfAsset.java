package uk.gegc.comicmaker.features.asset.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "pdf_assets", uniqueConstraints = {
        @UniqueConstraint(name = "uk_pdf_assets_project", columnNames = {"project_id"})
})
@Getter
@Setter
@NoArgsConstructor
public class PdfAsset {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "blob_path", nullable = false, length = 512)
    private String blobPath;

    @Column(name = "blob_url", length = 2048)
    private String blobUrl;

    @Column(name = "url_expires_at")
    private LocalDateTime urlExpiresAt;

    @Column(name = "dpi", nullable = false)
    private int dpi;

    @Column(name = "file_size_bytes", nullable = false)
    private long fileSizeBytes;

    @Column(name = "page_count", nullable = false)
    private int pageCount;

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
