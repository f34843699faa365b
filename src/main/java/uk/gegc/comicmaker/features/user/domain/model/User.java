package uk.gegc.comicmaker.features.user.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "username", nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "email", nullable = false, unique = true, length = 254)
    private String email;

    @Column(name = "password", nullable = false)
    private String hashedPassword;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan", nullable = false, length = 16)
    private PlanTier plan = PlanTier.FREE;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_status", nullable = false, length = 16)
    private AccountStatus accountStatus = AccountStatus.ACTIVE;

    @Column(name = "monthly_quota", nullable = false)
    private int monthlyQuota;

    @Column(name = "quota_used", nullable = false)
    private int quotaUsed;

    @Column(name = "quota_reset_at")
    private LocalDateTime quotaResetAt;

    // FREE tier: both flags flip together, exactly once
    @Column(name = "free_story_available", nullable = false)
    private boolean freeStoryAvailable = true;

    @Column(name = "free_story_used", nullable = false)
    private boolean freeStoryUsed = false;

    @Column(name = "plan_upgraded_at")
    private LocalDateTime planUpgradedAt;

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

    public boolean isActive() {
        return accountStatus == AccountStatus.ACTIVE;
    }
}
