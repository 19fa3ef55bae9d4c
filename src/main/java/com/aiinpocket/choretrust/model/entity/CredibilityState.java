package com.aiinpocket.choretrust.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 使用者的信用分狀態。歷史紀錄另存於 {@link CredibilityEvent}。
 */
@Entity
@Table(name = "credibility_state", uniqueConstraints = {
        @UniqueConstraint(name = "uk_credibility_state_user", columnNames = {"user_id"})
}, indexes = {
        @Index(name = "idx_credibility_bonus", columnList = "has_redemption_bonus")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CredibilityState {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;
    public static final int DEFAULT_SCORE = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(nullable = false)
    @Builder.Default
    private Integer score = DEFAULT_SCORE;

    /** 連續核准次數，任何一次退件即歸零 */
    @Column(name = "consecutive_approved_tasks", nullable = false)
    @Builder.Default
    private Integer consecutiveApprovedTasks = 0;

    @Column(name = "has_redemption_bonus", nullable = false)
    @Builder.Default
    private boolean hasRedemptionBonus = false;

    @Column(name = "redemption_bonus_expiry")
    private Instant redemptionBonusExpiry;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * 救贖加成是否仍有效。過期後即視為無效，不需要另外寫回資料庫。
     */
    public boolean isRedemptionBonusActive(Instant now) {
        return hasRedemptionBonus
                && redemptionBonusExpiry != null
                && !now.isAfter(redemptionBonusExpiry);
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }
}
