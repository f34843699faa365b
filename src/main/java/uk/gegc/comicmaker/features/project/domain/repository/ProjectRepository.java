package uk.gegc.comicmaker.features.project.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.comicmaker.features.project.domain.model.Project;
import uk.gegc.comicmaker.features.project.domain.model.ProjectStatus;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Soft-deleted rows are filtered explicitly by every finder here.
 */
@Repository
public interface ProjectRepository extends JpaRepository<Project, UUID> {

    Optional<Project> findByIdAndDeletedAtIsNull(UUID id);

    Page<Project> findByUserIdAndDeletedAtIsNull(UUID userId, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Project p
        SET p.status = :status, p.updatedAt = :now
        WHERE p.id = :id AND p.deletedAt IS NULL
    """)
    int updateStatus(@Param("id") UUID id, @Param("status") ProjectStatus status, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Project p
        SET p.status = uk.gegc.comicmaker.features.project.domain.model.ProjectStatus.COMPLETED,
            p.completedAt = :now,
            p.updatedAt = :now
        WHERE p.id = :id AND p.deletedAt IS NULL
    """)
    int markCompleted(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Project p
        SET p.status = :to, p.updatedAt = :now
        WHERE p.id = :id AND p.status = :from AND p.deletedAt IS NULL
    """)
    int transitionStatus(@Param("id") UUID id,
                         @Param("from") ProjectStatus from,
                         @Param("to") ProjectStatus to,
                         @Param("now") LocalDateTime now);
}
