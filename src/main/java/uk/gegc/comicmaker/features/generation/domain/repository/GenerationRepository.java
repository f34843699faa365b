package uk.gegc.comicmaker.features.generation.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.comicmaker.features.generation.domain.model.Generation;
import uk.gegc.comicmaker.features.generation.domain.model.TaskType;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * State changes are conditional single-statement updates. Only the owning job writes its row, so
 * the conditions guard against replays and late retries rather than concurrent writers.
 */
@Repository
public interface GenerationRepository extends JpaRepository<Generation, UUID> {

    Optional<Generation> findByJobId(String jobId);

    boolean existsByActiveProjectId(UUID activeProjectId);

    Optional<Generation> findFirstByProjectIdAndTaskTypeOrderByCreatedAtDesc(UUID projectId, TaskType taskType);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Generation g
        SET g.status = uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.PROCESSING,
            g.startedAt = COALESCE(g.startedAt, :now),
            g.updatedAt = :now
        WHERE g.id = :id
          AND g.status IN (uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.QUEUED,
                           uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.PROCESSING)
    """)
    int markProcessing(@Param("id") UUID id, @Param("now") LocalDateTime now);

    /**
     * Progress never moves backwards: a lower value than the stored one is ignored.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Generation g
        SET g.progress = :progress, g.updatedAt = :now
        WHERE g.id = :id
          AND g.progress <= :progress
          AND g.status = uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.PROCESSING
    """)
    int updateProgress(@Param("id") UUID id, @Param("progress") int progress, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Generation g
        SET g.status = uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.COMPLETED,
            g.progress = 100,
            g.errorMessage = NULL,
            g.activeProjectId = NULL,
            g.completedAt = :now,
            g.updatedAt = :now
        WHERE g.id = :id
          AND g.status IN (uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.QUEUED,
                           uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.PROCESSING)
    """)
    int markCompleted(@Param("id") UUID id, @Param("now") LocalDateTime now);

    /**
     * A completed job is never moved to FAILED.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Generation g
        SET g.status = uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.FAILED,
            g.errorMessage = :error,
            g.activeProjectId = NULL,
            g.completedAt = :now,
            g.updatedAt = :now
        WHERE g.id = :id
          AND g.status IN (uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.QUEUED,
                           uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.PROCESSING)
    """)
    int markFailed(@Param("id") UUID id, @Param("error") String error, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Generation g
        SET g.retryCount = g.retryCount + 1,
            g.errorMessage = :error,
            g.updatedAt = :now
        WHERE g.id = :id
          AND g.status IN (uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.QUEUED,
                           uk.gegc.comicmaker.features.generation.domain.model.GenerationStatus.PROCESSING)
    """)
    int recordRetry(@Param("id") UUID id, @Param("error") String error, @Param("now") LocalDateTime now);
}
