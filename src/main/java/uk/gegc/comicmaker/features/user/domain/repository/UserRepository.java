package uk.gegc.comicmaker.features.user.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.comicmaker.features.user.domain.model.User;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByUsername(String username);

    Optional<User> findByEmail(String email);

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    /**
     * Find user by ID with pessimistic lock, used while changing the plan tier
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.id = :id")
    Optional<User> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Compare-and-set flip of the free story flags. Only the first caller that observes
     * {@code freeStoryUsed = false} at write time changes the row.
     *
     * @return 1 if this call consumed the free story, 0 if it was already consumed
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE User u
        SET u.freeStoryUsed = true,
            u.freeStoryAvailable = false,
            u.updatedAt = :now
        WHERE u.id = :userId AND u.freeStoryUsed = false
    """)
    int markFreeStoryUsed(@Param("userId") UUID userId, @Param("now") LocalDateTime now);

    /**
     * Atomically consume one unit of the monthly generation quota.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET u.quotaUsed = u.quotaUsed + 1, u.updatedAt = :now WHERE u.id = :userId")
    int incrementQuotaUsed(@Param("userId") UUID userId, @Param("now") LocalDateTime now);

    /**
     * Reset the monthly counter once its window has elapsed. The condition on {@code quotaResetAt}
     * makes concurrent resets collapse into one.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE User u
        SET u.quotaUsed = 0,
            u.quotaResetAt = :nextResetAt,
            u.updatedAt = :now
        WHERE u.id = :userId AND (u.quotaResetAt IS NULL OR u.quotaResetAt <= :now)
    """)
    int resetQuotaIfDue(@Param("userId") UUID userId,
                        @Param("nextResetAt") LocalDateTime nextResetAt,
                        @Param("now") LocalDateTime now);
}
