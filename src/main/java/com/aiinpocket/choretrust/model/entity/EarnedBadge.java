package com.aiinpocket.choretrust.model.entity;

import com.aiinpocket.choretrust.model.enums.BadgeDef;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "earned_badge", uniqueConstraints = {
        @UniqueConstraint(name = "uk_earned_badge", columnNames = {"child_id", "badge"})
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EarnedBadge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "child_id", nullable = false, updatable = false)
    private UUID childId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40, updatable = false)
    private BadgeDef badge;

    @Column(name = "earned_at", nullable = false, updatable = false)
    private Instant earnedAt;

    @Column(name = "bonus_xp_awarded", nullable = false, updatable = false)
    private Integer bonusXpAwarded;

    @PrePersist
    protected void onCreate() {
        if (this.earnedAt == null) {
            this.earnedAt = Instant.now();
        }
    }
}
