package com.aiinpocket.choretrust.model.dto;

import com.aiinpocket.choretrust.model.entity.TaskAssignment;
import com.aiinpocket.choretrust.model.enums.AssignmentStatus;
import com.aiinpocket.choretrust.model.enums.ReviewDecision;
import com.aiinpocket.choretrust.model.enums.TaskCategory;
import com.aiinpocket.choretrust.model.enums.TaskLevel;

import java.time.Instant;
import java.util.UUID;

/**
 * 任務實例的唯讀檢視，供 API 回傳。
 */
public record AssignmentView(
        UUID id,
        long version,
        Long templateId,
        UUID childId,
        UUID assignedBy,
        String title,
        String description,
        TaskCategory category,
        TaskLevel assignedLevel,
        TaskLevel adjustedLevel,
        AssignmentStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant reviewedAt,
        Instant dueDate,
        String photoUrl,
        String childNotes,
        Integer completionTimeMinutes,
        UUID reviewedBy,
        String parentNotes,
        ReviewDecision reviewDecision,
        Integer xpAwarded,
        Instant appealDeadline,
        String appealNotes,
        boolean declineViewedByChild
) {
    public static AssignmentView from(TaskAssignment a) {
        return new AssignmentView(
                a.getId(),
                a.getVersion() != null ? a.getVersion() : 0L,
                a.getTemplateId(),
                a.getChildId(),
                a.getAssignedBy(),
                a.getTitle(),
                a.getDescription(),
                a.getCategory(),
                a.getAssignedLevel(),
                a.getAdjustedLevel(),
                a.getStatus(),
                a.getCreatedAt(),
                a.getStartedAt(),
                a.getCompletedAt(),
                a.getReviewedAt(),
                a.getDueDate(),
                a.getPhotoUrl(),
                a.getChildNotes(),
                a.getCompletionTimeMinutes(),
                a.getReviewedBy(),
                a.getParentNotes(),
                a.getReviewDecision(),
                a.getXpAwarded(),
                a.getAppealDeadline(),
                a.getAppealNotes(),
                a.isDeclineViewedByChild()
        );
    }
}
