package uk.gegc.comicmaker.features.project.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.comicmaker.features.project.domain.model.Scene;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SceneRepository extends JpaRepository<Scene, UUID> {

    List<Scene> findByProjectIdAndDeletedAtIsNullOrderByPageNoAscPanelNoAsc(UUID projectId);

    List<Scene> findByProjectIdAndPageNoAndDeletedAtIsNullOrderByPanelNoAsc(UUID projectId, int pageNo);

    Optional<Scene> findByProjectIdAndPageNoAndPanelNo(UUID projectId, int pageNo, int panelNo);

    @Query("SELECT COUNT(DISTINCT s.pageNo) FROM Scene s WHERE s.projectId = :projectId AND s.deletedAt IS NULL")
    long countDistinctPages(@Param("projectId") UUID projectId);

    @Query("SELECT DISTINCT s.pageNo FROM Scene s WHERE s.projectId = :projectId AND s.deletedAt IS NULL ORDER BY s.pageNo")
    List<Integer> findDistinctPageNumbers(@Param("projectId") UUID projectId);
}
