package com.aiinpocket.choretrust.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 家長對孩子的審核權限。家庭帳號管理屬於外部系統，這裡只保存審核所需的對應關係。
 */
@Entity
@Table(name = "guardian_link", uniqueConstraints = {
        @UniqueConstraint(name = "uk_guardian_child", columnNames = {"guardian_id", "child_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GuardianLink {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "guardian_id", nullable = false)
    private UUID guardianId;

    @Column(name = "child_id", nullable = false)
    private UUID childId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
