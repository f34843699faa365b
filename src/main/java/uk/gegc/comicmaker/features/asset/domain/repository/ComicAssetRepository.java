package uk.gegc.comicmaker.features.asset.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.comicmaker.features.asset.domain.model.ComicAsset;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ComicAssetRepository extends JpaRepository<ComicAsset, UUID> {

    Optional<ComicAsset> findByProjectIdAndPageNo(UUID projectId, int pageNo);

    List<ComicAsset> findByProjectIdOrderByPageNoAsc(UUID projectId);

    long countByProjectId(UUID projectId);
}
