package com.aiinpocket.choretrust.model.entity;

import com.aiinpocket.choretrust.model.enums.AssignmentStatus;
import com.aiinpocket.choretrust.model.enums.ReviewDecision;
import com.aiinpocket.choretrust.model.enums.TaskCategory;
import com.aiinpocket.choretrust.model.enums.TaskLevel;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 指派給（或由）孩子認領的單一任務實例。
 * 審核前只有認領的孩子可以推進狀態；審核欄位只由家長寫入。
 */
@Entity
@Table(name = "task_assignment", indexes = {
        @Index(name = "idx_assignment_child_status", columnList = "child_id, status"),
        @Index(name = "idx_assignment_status_due", columnList = "status, due_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private Long version;

    @Column(name = "template_id", nullable = false, updatable = false)
    private Long templateId;

    @Column(name = "child_id", nullable = false, updatable = false)
    private UUID childId;

    /** 指派的家長；null 代表孩子自行認領 */
    @Column(name = "assigned_by", updatable = false)
    private UUID assignedBy;

    // ===== 任務內容（自範本複製，家長可修改） =====

    @Column(nullable = false, length = 120)
    private String title;

    @Column(nullable = false, length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TaskCategory category;

    @Enumerated(EnumType.STRING)
    @Column(name = "assigned_level", nullable = false, length = 10)
    private TaskLevel assignedLevel;

    /** 家長審核時調整的等級 */
    @Enumerated(EnumType.STRING)
    @Column(name = "adjusted_level", length = 10)
    private TaskLevel adjustedLevel;

    // ===== 狀態與時間 =====

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AssignmentStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "due_date")
    private Instant dueDate;

    // ===== 完成證明 =====

    @Column(name = "photo_url", length = 500)
    private String photoUrl;

    @Column(name = "child_notes", length = 500)
    private String childNotes;

    @Column(name = "completion_time_minutes")
    private Integer completionTimeMinutes;

    // ===== 審核結果 =====

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    @Column(name = "parent_notes", length = 500)
    private String parentNotes;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_decision", length = 20)
    private ReviewDecision reviewDecision;

    @Column(name = "xp_awarded")
    private Integer xpAwarded;

    // ===== 申訴 =====

    @Column(name = "appeal_deadline")
    private Instant appealDeadline;

    @Column(name = "appeal_notes", length = 500)
    private String appealNotes;

    @Column(name = "appealed_at")
    private Instant appealedAt;

    @Column(name = "decline_viewed_by_child", nullable = false)
    private boolean declineViewedByChild;

    public TaskLevel effectiveLevel() {
        return adjustedLevel != null ? adjustedLevel : assignedLevel;
    }

    public boolean isParentAssigned() {
        return assignedBy != null;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
