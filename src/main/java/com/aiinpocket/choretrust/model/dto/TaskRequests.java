package com.aiinpocket.choretrust.model.dto;

import com.aiinpocket.choretrust.model.enums.TaskLevel;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.UUID;

/**
 * 任務相關 API 的請求物件。
 */
public final class TaskRequests {

    private TaskRequests() {
    }

    public record Claim(@NotNull Long templateId, TaskLevel level) {}

    public record Assign(@NotNull UUID childId, @NotNull Long templateId, TaskLevel level, Instant dueDate) {}

    public record Edit(@Size(max = 120) String title, @Size(max = 500) String description) {}

    public record Submit(@NotBlank @Size(max = 500) String photoUrl,
                         @Size(max = 500) String notes,
                         @Min(0) Integer completionTimeMinutes) {}

    public record Approve(TaskLevel adjustedLevel, @Size(max = 500) String notes) {}

    public record Decline(@NotBlank @Size(max = 500) String reason) {}

    public record Appeal(@NotBlank @Size(max = 500) String reason) {}
}
