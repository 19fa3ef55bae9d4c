package com.aiinpocket.choretrust.model.entity;

import com.aiinpocket.choretrust.model.enums.TaskCategory;
import com.aiinpocket.choretrust.model.enums.TaskLevel;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 任務範本（唯讀目錄資料）。指派任務時複製標題、說明與分類。
 */
@Entity
@Table(name = "task_template", indexes = {
        @Index(name = "idx_template_category", columnList = "category")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 120)
    private String title;

    @Column(nullable = false, length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TaskCategory category;

    @Enumerated(EnumType.STRING)
    @Column(name = "suggested_level", nullable = false, length = 10)
    private TaskLevel suggestedLevel;

    @Column(name = "estimated_minutes", nullable = false)
    private Integer estimatedMinutes;

    /** 逗號分隔的搜尋標籤 */
    @Column(length = 300)
    private String tags;

    /** true = 系統預設範本 */
    @Column(name = "default_template", nullable = false)
    private boolean defaultTemplate;

    /** 家長自訂範本的建立者 */
    @Column(name = "created_by")
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
