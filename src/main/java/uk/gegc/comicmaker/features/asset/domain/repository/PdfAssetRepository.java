package uk.gegc.comicmaker.features.asset.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.comicmaker.features.asset.domain.model.PdfAsset;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PdfAssetRepository extends JpaRepository<PdfAsset, UUID> {

    Optional<PdfAsset> findByProjectId(UUID projectId);

    boolean existsByProjectId(UUID projectId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PdfAsset a SET a.downloadCount = a.downloadCount + 1 WHERE a.id = :id")
    int incrementDownloadCount(@Param("id") UUID id);
}
