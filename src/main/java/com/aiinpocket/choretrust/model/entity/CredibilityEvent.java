package com.aiinpocket.choretrust.model.entity;

import com.aiinpocket.choretrust.model.enums.CredibilityEventType;
import com.aiinpocket.choretrust.model.enums.DecayStage;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 信用分歷史事件（每位使用者一列一事件，依時間建索引）。
 *
 * <p>amount 為規則上的名目分數（例如扣分 -10 / -15），appliedDelta 為夾在 0–100 之後實際造成的分數變化，
 * 撤銷操作一律使用 appliedDelta。只有 DOWNVOTE 會使用衰減相關欄位。
 */
@Entity
@Table(name = "credibility_event", indexes = {
        @Index(name = "idx_cred_event_user_time", columnList = "user_id, created_at"),
        @Index(name = "idx_cred_event_decay", columnList = "event_type, decay_stage, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CredibilityEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40, updatable = false)
    private CredibilityEventType eventType;

    @Column(nullable = false, updatable = false)
    private Integer amount;

    @Column(name = "applied_delta", nullable = false, updatable = false)
    private Integer appliedDelta;

    @Column(name = "score_after", nullable = false, updatable = false)
    private Integer scoreAfter;

    @Column(name = "task_id", updatable = false)
    private UUID taskId;

    @Column(name = "reviewer_id", updatable = false)
    private UUID reviewerId;

    @Column(length = 500, updatable = false)
    private String notes;

    @Column(name = "streak_count", updatable = false)
    private Integer streakCount;

    /** 退件前的連續核准數，撤銷退件時還原 */
    @Column(name = "streak_before", updatable = false)
    private Integer streakBefore;

    @Enumerated(EnumType.STRING)
    @Column(name = "decay_stage", nullable = false, length = 10)
    @Builder.Default
    private DecayStage decayStage = DecayStage.NONE;

    /** 已經因衰減返還的分數 */
    @Column(name = "decayed_amount", nullable = false)
    @Builder.Default
    private Integer decayedAmount = 0;

    @Column(name = "decayed_at")
    private Instant decayedAt;

    /** 已被審核者撤銷，不再參與疊加判斷與衰減 */
    @Column(nullable = false)
    @Builder.Default
    private boolean reversed = false;

    /** 完全衰減後移出有效歷史，但保留在表中供稽核 */
    @Column(nullable = false)
    @Builder.Default
    private boolean archived = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public int penaltyMagnitude() {
        return Math.abs(amount);
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
