package com.aiinpocket.choretrust.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 使用者的 XP 餘額，每位使用者一筆，首次使用時建立。
 * 不變式：currentXp == lifetimeEarned - lifetimeSpent。
 */
@Entity
@Table(name = "xp_balance", uniqueConstraints = {
        @UniqueConstraint(name = "uk_xp_balance_user", columnNames = {"user_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class XpBalance {

    /** 超過此餘額後入帳只算一半 */
    public static final int SOFT_CAP = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "current_xp", nullable = false)
    @Builder.Default
    private Integer currentXp = 0;

    @Column(name = "lifetime_earned", nullable = false)
    @Builder.Default
    private Integer lifetimeEarned = 0;

    @Column(name = "lifetime_spent", nullable = false)
    @Builder.Default
    private Integer lifetimeSpent = 0;

    /** 新手獎勵只發一次 */
    @Column(name = "starter_bonus_granted", nullable = false)
    @Builder.Default
    private boolean starterBonusGranted = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    public void credit(int amount, Instant now) {
        this.currentXp += amount;
        this.lifetimeEarned += amount;
        this.lastUpdated = now;
    }

    public void debit(int amount, Instant now) {
        this.currentXp -= amount;
        this.lifetimeSpent += amount;
        this.lastUpdated = now;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.lastUpdated == null) {
            this.lastUpdated = this.createdAt;
        }
    }
}
