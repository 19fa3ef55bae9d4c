package com.aiinpocket.choretrust.model.entity;

import com.aiinpocket.choretrust.model.enums.XpTransactionType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * XP 異動紀錄，只新增不修改。
 */
@Entity
@Table(name = "xp_transaction", indexes = {
        @Index(name = "idx_xp_tx_user_time", columnList = "user_id, created_at")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class XpTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private XpTransactionType type;

    @Column(nullable = false, updatable = false)
    private Integer amount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "related_task_id", updatable = false)
    private UUID relatedTaskId;

    /** 入帳當下的信用分快照 */
    @Column(name = "credibility_at_time", updatable = false)
    private Integer credibilityAtTime;

    @Column(length = 300, updatable = false)
    private String notes;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
