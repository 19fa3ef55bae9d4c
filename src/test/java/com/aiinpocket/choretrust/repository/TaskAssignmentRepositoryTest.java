package com.aiinpocket.choretrust.repository;

import com.aiinpocket.choretrust.model.entity.CredibilityEvent;
import com.aiinpocket.choretrust.model.entity.TaskAssignment;
import com.aiinpocket.choretrust.model.enums.AssignmentStatus;
import com.aiinpocket.choretrust.model.enums.CredibilityEventType;
import com.aiinpocket.choretrust.model.enums.DecayStage;
import com.aiinpocket.choretrust.model.enums.TaskCategory;
import com.aiinpocket.choretrust.model.enums.TaskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * 任務與信用事件的自訂查詢。
 */
@DataJpaTest
@ActiveProfiles("test")
@DisplayName("TaskAssignmentRepository Tests")
class TaskAssignmentRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

    @Autowired
    private TaskAssignmentRepository assignmentRepo;

    @Autowired
    private CredibilityEventRepository eventRepo;

    private UUID childId;

    @BeforeEach
    void setUp() {
        childId = UUID.randomUUID();
    }

    private TaskAssignment saveTask(AssignmentStatus status, Instant dueDate) {
        return assignmentRepo.saveAndFlush(TaskAssignment.builder()
                .templateId(1L)
                .childId(childId)
                .title("倒垃圾")
                .description("把垃圾拿到樓下")
                .category(TaskCategory.INDOOR_CLEANING)
                .assignedLevel(TaskLevel.LEVEL_1)
                .status(status)
                .createdAt(NOW.minus(Duration.ofDays(1)))
                .dueDate(dueDate)
                .build());
    }

    private CredibilityEvent saveDownvote(Instant createdAt, DecayStage stage, boolean reversed) {
        return eventRepo.saveAndFlush(CredibilityEvent.builder()
                .userId(childId)
                .eventType(CredibilityEventType.DOWNVOTE)
                .amount(-10)
                .appliedDelta(-10)
                .scoreAfter(90)
                .decayStage(stage)
                .reversed(reversed)
                .createdAt(createdAt)
                .build());
    }

    @Test
    @DisplayName("expireOverdue should only touch unfinished overdue tasks and bump their version")
    void expireOverdueShouldBumpVersion() {
        // Given
        TaskAssignment overdue = saveTask(AssignmentStatus.IN_PROGRESS, NOW.minusSeconds(60));
        TaskAssignment notDue = saveTask(AssignmentStatus.ASSIGNED, NOW.plusSeconds(60));
        TaskAssignment noDueDate = saveTask(AssignmentStatus.ASSIGNED, null);
        TaskAssignment submitted = saveTask(AssignmentStatus.PENDING_REVIEW, NOW.minusSeconds(60));
        long versionBefore = overdue.getVersion();

        // When
        int expired = assignmentRepo.expireOverdue(
                EnumSet.of(AssignmentStatus.ASSIGNED, AssignmentStatus.IN_PROGRESS), NOW);

        // Then
        assertThat(expired).isEqualTo(1);
        TaskAssignment reloaded = assignmentRepo.findById(overdue.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(AssignmentStatus.EXPIRED);
        assertThat(reloaded.getVersion()).isEqualTo(versionBefore + 1);
        assertThat(assignmentRepo.findById(notDue.getId()).orElseThrow().getStatus())
                .isEqualTo(AssignmentStatus.ASSIGNED);
        assertThat(assignmentRepo.findById(noDueDate.getId()).orElseThrow().getStatus())
                .isEqualTo(AssignmentStatus.ASSIGNED);
        assertThat(assignmentRepo.findById(submitted.getId()).orElseThrow().getStatus())
                .isEqualTo(AssignmentStatus.PENDING_REVIEW);
    }

    @Test
    @DisplayName("Stacking lookup should skip decayed and reversed downvotes")
    void stackingLookupShouldSkipDecayedAndReversed() {
        // Given
        CredibilityEvent live = saveDownvote(NOW.minus(Duration.ofDays(3)), DecayStage.NONE, false);
        saveDownvote(NOW.minus(Duration.ofDays(2)), DecayStage.HALF, false);
        saveDownvote(NOW.minus(Duration.ofDays(1)), DecayStage.NONE, true);

        // When
        var latest = eventRepo
                .findFirstByUserIdAndEventTypeAndDecayStageAndReversedFalseOrderByCreatedAtDescIdDesc(
                        childId, CredibilityEventType.DOWNVOTE, DecayStage.NONE);

        // Then
        assertThat(latest).map(CredibilityEvent::getId).contains(live.getId());
    }

    @Test
    @DisplayName("Decay lookup should return only old, active, not fully decayed downvotes in order")
    void decayLookupShouldFilterByAgeAndStage() {
        Instant cutoff = NOW.minus(Duration.ofDays(30));
        CredibilityEvent oldest = saveDownvote(NOW.minus(Duration.ofDays(61)), DecayStage.HALF, false);
        CredibilityEvent older = saveDownvote(NOW.minus(Duration.ofDays(31)), DecayStage.NONE, false);
        saveDownvote(NOW.minus(Duration.ofDays(90)), DecayStage.FULL, false);
        saveDownvote(NOW.minus(Duration.ofDays(40)), DecayStage.NONE, true);
        saveDownvote(NOW.minus(Duration.ofDays(5)), DecayStage.NONE, false);

        assertThat(eventRepo.findDecayableDownvotes(childId, cutoff))
                .extracting(CredibilityEvent::getId)
                .containsExactly(oldest.getId(), older.getId());
        assertThat(eventRepo.findUserIdsWithDecayableDownvotes(cutoff)).contains(childId);
    }
}
