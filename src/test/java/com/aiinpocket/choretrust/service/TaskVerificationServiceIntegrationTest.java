package com.aiinpocket.choretrust.service;

import com.aiinpocket.choretrust.exception.ReviewAuthorityException;
import com.aiinpocket.choretrust.exception.StateConflictException;
import com.aiinpocket.choretrust.exception.ValidationException;
import com.aiinpocket.choretrust.model.dto.ApprovalResult;
import com.aiinpocket.choretrust.model.dto.AssignmentView;
import com.aiinpocket.choretrust.model.dto.DeclineResult;
import com.aiinpocket.choretrust.model.dto.XpBalanceView;
import com.aiinpocket.choretrust.model.entity.XpTransaction;
import com.aiinpocket.choretrust.model.enums.AssignmentStatus;
import com.aiinpocket.choretrust.model.enums.BadgeDef;
import com.aiinpocket.choretrust.model.enums.ReviewDecision;
import com.aiinpocket.choretrust.model.enums.TaskLevel;
import com.aiinpocket.choretrust.model.enums.XpTransactionType;
import com.aiinpocket.choretrust.repository.TaskTemplateRepository;
import com.aiinpocket.choretrust.repository.XpTransactionRepository;
import com.aiinpocket.choretrust.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TaskVerificationService Integration Tests")
class TaskVerificationServiceIntegrationTest extends IntegrationTestSupport {

    private static final String PHOTO = "https://photos.example.com/evidence.jpg";

    @Autowired
    private TaskVerificationService verificationService;

    @Autowired
    private CredibilityService credibilityService;

    @Autowired
    private ReviewAuthorityService authority;

    @Autowired
    private XpLedgerService xpLedger;

    @Autowired
    private TaskTemplateRepository templateRepo;

    @Autowired
    private XpTransactionRepository txRepo;

    private UUID childId;
    private UUID guardianId;
    private Long homeworkTemplateId;

    @BeforeEach
    void setUp() {
        childId = UUID.randomUUID();
        guardianId = UUID.randomUUID();
        authority.link(guardianId, childId);
        homeworkTemplateId = templateRepo
                .findByTitleContainingIgnoreCaseOrTagsContainingIgnoreCase("完成作業", "完成作業")
                .get(0).getId();
    }

    private UUID pendingTask(TaskLevel level) {
        AssignmentView claimed = verificationService.claimTask(childId, homeworkTemplateId, level);
        verificationService.start(claimed.id(), childId);
        verificationService.submit(claimed.id(), childId, PHOTO, "完成了", 25);
        return claimed.id();
    }

    @Nested
    @DisplayName("Approval")
    class Approval {

        @Test
        @DisplayName("Streak 10 approval at score 100 should award ceil(30 x 1.2) = 36 XP")
        void shouldAwardExcellentTierXpOnTenthApproval() {
            // Given
            givenCredibility(childId, 100, 9);
            UUID taskId = pendingTask(TaskLevel.LEVEL_3);

            // When
            ApprovalResult result = verificationService.approve(taskId, guardianId, null, "做得好");

            // Then
            assertThat(result.xpAwarded()).isEqualTo(36);
            assertThat(result.credibility().newScore()).isEqualTo(100);
            assertThat(result.credibility().streak()).isEqualTo(10);
            assertThat(result.credibility().streakBonusApplied()).isTrue();
            assertThat(result.assignment().status()).isEqualTo(AssignmentStatus.APPROVED);
            assertThat(result.assignment().reviewDecision()).isEqualTo(ReviewDecision.APPROVED);
            assertThat(result.assignment().reviewedBy()).isEqualTo(guardianId);
            assertThat(result.badgesEarned())
                    .contains(BadgeDef.FIRST_TASK_COMPLETE, BadgeDef.STREAK_3, BadgeDef.STREAK_7);

            List<XpTransaction> earned = txRepo.findByUserIdAndRelatedTaskId(childId, taskId);
            assertThat(earned).hasSize(1);
            assertThat(earned.get(0).getType()).isEqualTo(XpTransactionType.EARNED);
            assertThat(earned.get(0).getAmount()).isEqualTo(36);
            assertThat(earned.get(0).getCredibilityAtTime()).isEqualTo(100);
        }

        @Test
        @DisplayName("Level override should be recorded as an edited approval")
        void shouldRecordEditedApproval() {
            givenCredibility(childId, 80, 0);
            UUID taskId = pendingTask(TaskLevel.LEVEL_3);

            ApprovalResult result = verificationService.approve(taskId, guardianId, TaskLevel.LEVEL_5, null);

            assertThat(result.assignment().reviewDecision()).isEqualTo(ReviewDecision.APPROVED_EDITED);
            assertThat(result.assignment().adjustedLevel()).isEqualTo(TaskLevel.LEVEL_5);
            assertThat(result.xpAwarded()).isEqualTo(60);
        }

        @Test
        @DisplayName("Approving an already approved task should be a state conflict")
        void shouldRejectDoubleApproval() {
            UUID taskId = pendingTask(TaskLevel.LEVEL_2);
            verificationService.approve(taskId, guardianId, null, null);

            assertThatThrownBy(() -> verificationService.approve(taskId, guardianId, null, null))
                    .isInstanceOf(StateConflictException.class);
            assertThatThrownBy(() -> verificationService.decline(taskId, guardianId, "改判"))
                    .isInstanceOf(StateConflictException.class);
        }

        @Test
        @DisplayName("Undoing an approval reverses only trust; the task stays approved and its XP stays credited")
        void undoApprovalShouldOnlyReverseTrust() {
            // Given
            givenCredibility(childId, 80, 0);
            UUID taskId = pendingTask(TaskLevel.LEVEL_3);
            verificationService.approve(taskId, guardianId, null, null);
            int xpBefore = xpLedger.getBalance(childId).currentXp();

            // When
            credibilityService.undoApproval(childId, taskId);

            // Then
            assertThat(credibilityOf(childId).getScore()).isEqualTo(80);
            assertThat(credibilityOf(childId).getConsecutiveApprovedTasks()).isZero();
            assertThat(verificationService.getAssignment(taskId).status()).isEqualTo(AssignmentStatus.APPROVED);
            assertThat(xpLedger.getBalance(childId).currentXp()).isEqualTo(xpBefore);
        }

        @Test
        @DisplayName("Only a linked guardian may review")
        void shouldRejectUnlinkedReviewer() {
            UUID taskId = pendingTask(TaskLevel.LEVEL_2);

            assertThatThrownBy(() -> verificationService.approve(taskId, UUID.randomUUID(), null, null))
                    .isInstanceOf(ReviewAuthorityException.class);
            assertThat(verificationService.getAssignment(taskId).status()).isEqualTo(AssignmentStatus.PENDING_REVIEW);
        }
    }

    @Nested
    @DisplayName("Decline and appeal")
    class DeclineAndAppeal {

        @Test
        @DisplayName("Two declines should move a Poor child to Very Poor")
        void shouldDropToVeryPoor() {
            // Given
            givenCredibility(childId, 55, 0);
            UUID first = pendingTask(TaskLevel.LEVEL_2);
            UUID second = pendingTask(TaskLevel.LEVEL_2);

            // When
            DeclineResult r1 = verificationService.decline(first, guardianId, "沒有完成");
            String tierAfterFirst = credibilityService.getCredibilityStatus(childId).tier().name();
            DeclineResult r2 = verificationService.decline(second, guardianId, "照片不符");

            // Then
            assertThat(r1.credibility().newScore()).isEqualTo(45);
            assertThat(tierAfterFirst).isEqualTo("Poor");
            assertThat(r2.credibility().newScore()).isEqualTo(30);
            assertThat(credibilityService.getCredibilityStatus(childId).tier().name()).isEqualTo("Very Poor");
            assertThat(r2.assignment().xpAwarded()).isZero();
            assertThat(r2.assignment().appealDeadline())
                    .isEqualTo(clock.instant().plus(TaskVerificationService.APPEAL_WINDOW));
        }

        @Test
        @DisplayName("Decline should require a reason")
        void shouldRequireReason() {
            UUID taskId = pendingTask(TaskLevel.LEVEL_2);

            assertThatThrownBy(() -> verificationService.decline(taskId, guardianId, " "))
                    .isInstanceOf(ValidationException.class);
            assertThat(verificationService.getAssignment(taskId).status()).isEqualTo(AssignmentStatus.PENDING_REVIEW);
        }

        @Test
        @DisplayName("Appeal one second before the deadline should succeed")
        void shouldAcceptAppealBeforeDeadline() {
            UUID taskId = pendingTask(TaskLevel.LEVEL_2);
            verificationService.decline(taskId, guardianId, "沒有完成");

            clock.advance(Duration.ofHours(24).minusSeconds(1));
            AssignmentView appealed = verificationService.appeal(taskId, childId, "我有做完，請再看一次");

            assertThat(appealed.status()).isEqualTo(AssignmentStatus.APPEALED);
            assertThat(appealed.appealNotes()).isEqualTo("我有做完，請再看一次");
        }

        @Test
        @DisplayName("Appeal at the deadline should fail and leave the task declined")
        void shouldRejectAppealAtDeadline() {
            UUID taskId = pendingTask(TaskLevel.LEVEL_2);
            verificationService.decline(taskId, guardianId, "沒有完成");

            clock.advance(Duration.ofHours(24));

            assertThatThrownBy(() -> verificationService.appeal(taskId, childId, "請再看一次"))
                    .isInstanceOf(ValidationException.class);
            AssignmentView after = verificationService.getAssignment(taskId);
            assertThat(after.status()).isEqualTo(AssignmentStatus.DECLINED);
            assertThat(after.appealNotes()).isNull();
        }

        @Test
        @DisplayName("Approving an appealed task should first restore the decline penalty")
        void approveAfterAppealShouldRestorePenalty() {
            // Given
            givenCredibility(childId, 80, 0);
            UUID taskId = pendingTask(TaskLevel.LEVEL_3);
            verificationService.decline(taskId, guardianId, "沒有完成");
            verificationService.appeal(taskId, childId, "有做完");

            // When
            ApprovalResult result = verificationService.approve(taskId, guardianId, null, "看錯了");

            // Then
            assertThat(result.credibility().newScore()).isEqualTo(82);
            assertThat(result.xpAwarded()).isEqualTo(30);
            assertThat(result.assignment().appealDeadline()).isNull();
        }

        @Test
        @DisplayName("Declining an appealed task should uphold the decision without a second penalty")
        void declineAfterAppealShouldUphold() {
            // Given
            givenCredibility(childId, 80, 0);
            UUID taskId = pendingTask(TaskLevel.LEVEL_3);
            verificationService.decline(taskId, guardianId, "沒有完成");
            verificationService.appeal(taskId, childId, "有做完");

            // When
            DeclineResult upheld = verificationService.decline(taskId, guardianId, "維持原判");

            // Then
            assertThat(upheld.credibility()).isNull();
            assertThat(upheld.assignment().reviewDecision()).isEqualTo(ReviewDecision.DECLINE_UPHELD);
            assertThat(upheld.assignment().status()).isEqualTo(AssignmentStatus.DECLINED);
            assertThat(upheld.assignment().appealDeadline()).isNull();
            assertThat(credibilityOf(childId).getScore()).isEqualTo(70);
            assertThatThrownBy(() -> verificationService.appeal(taskId, childId, "再申訴"))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Retracting a decline should restore the score and reopen review")
        void retractDeclineShouldReopenReview() {
            givenCredibility(childId, 80, 3);
            UUID taskId = pendingTask(TaskLevel.LEVEL_3);
            verificationService.decline(taskId, guardianId, "沒有完成");

            AssignmentView reopened = verificationService.retractDecline(taskId, guardianId);

            assertThat(reopened.status()).isEqualTo(AssignmentStatus.PENDING_REVIEW);
            assertThat(reopened.reviewDecision()).isNull();
            assertThat(credibilityOf(childId).getScore()).isEqualTo(80);
            assertThat(credibilityOf(childId).getConsecutiveApprovedTasks()).isEqualTo(3);
            assertThat(verificationService.getPendingReviews(guardianId))
                    .extracting(AssignmentView::id)
                    .contains(taskId);
        }

        @Test
        @DisplayName("Decline cannot be retracted once the appeal window has closed")
        void retractAfterWindowShouldFail() {
            // Given
            givenCredibility(childId, 80, 0);
            UUID taskId = pendingTask(TaskLevel.LEVEL_3);
            verificationService.decline(taskId, guardianId, "沒有完成");

            // When
            clock.advance(Duration.ofDays(3));

            // Then
            assertThatThrownBy(() -> verificationService.retractDecline(taskId, guardianId))
                    .isInstanceOf(StateConflictException.class);
            assertThat(verificationService.getAssignment(taskId).status()).isEqualTo(AssignmentStatus.DECLINED);
            assertThat(credibilityOf(childId).getScore()).isEqualTo(70);
        }

        @Test
        @DisplayName("Upheld decline cannot be retracted")
        void retractAfterUpheldShouldFail() {
            givenCredibility(childId, 80, 0);
            UUID taskId = pendingTask(TaskLevel.LEVEL_3);
            verificationService.decline(taskId, guardianId, "沒有完成");
            verificationService.appeal(taskId, childId, "有做完");
            verificationService.decline(taskId, guardianId, "維持原判");

            assertThatThrownBy(() -> verificationService.retractDecline(taskId, guardianId))
                    .isInstanceOf(StateConflictException.class);
            AssignmentView after = verificationService.getAssignment(taskId);
            assertThat(after.status()).isEqualTo(AssignmentStatus.DECLINED);
            assertThat(after.reviewDecision()).isEqualTo(ReviewDecision.DECLINE_UPHELD);
            assertThat(credibilityOf(childId).getScore()).isEqualTo(70);
        }

        @Test
        @DisplayName("Child should be able to mark a decline as viewed")
        void shouldMarkDeclineViewed() {
            UUID taskId = pendingTask(TaskLevel.LEVEL_1);
            verificationService.decline(taskId, guardianId, "沒有完成");

            AssignmentView viewed = verificationService.markDeclineViewed(taskId, childId);

            assertThat(viewed.declineViewedByChild()).isTrue();
        }
    }

    @Nested
    @DisplayName("Child transitions")
    class ChildTransitions {

        @Test
        @DisplayName("Submit without a photo should fail and leave the task in progress")
        void submitWithoutPhotoShouldFail() {
            AssignmentView claimed = verificationService.claimTask(childId, homeworkTemplateId, null);
            verificationService.start(claimed.id(), childId);

            assertThatThrownBy(() -> verificationService.submit(claimed.id(), childId, "", null, null))
                    .isInstanceOf(ValidationException.class);
            AssignmentView after = verificationService.getAssignment(claimed.id());
            assertThat(after.status()).isEqualTo(AssignmentStatus.IN_PROGRESS);
            assertThat(after.photoUrl()).isNull();
            assertThat(after.completedAt()).isNull();
        }

        @Test
        @DisplayName("Claim should copy the template and use its suggested level")
        void claimShouldCopyTemplate() {
            AssignmentView claimed = verificationService.claimTask(childId, homeworkTemplateId, null);

            assertThat(claimed.title()).isEqualTo("完成作業");
            assertThat(claimed.assignedLevel()).isEqualTo(TaskLevel.LEVEL_3);
            assertThat(claimed.assignedBy()).isNull();
            assertThat(claimed.status()).isEqualTo(AssignmentStatus.ASSIGNED);
        }

        @Test
        @DisplayName("Only the claiming child may start the task, and only once")
        void startShouldBeSingleWriter() {
            AssignmentView claimed = verificationService.claimTask(childId, homeworkTemplateId, null);

            assertThatThrownBy(() -> verificationService.start(claimed.id(), UUID.randomUUID()))
                    .isInstanceOf(ReviewAuthorityException.class);
            verificationService.start(claimed.id(), childId);
            assertThatThrownBy(() -> verificationService.start(claimed.id(), childId))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Guardian may edit details before review")
        void guardianShouldEditBeforeReview() {
            AssignmentView claimed = verificationService.claimTask(childId, homeworkTemplateId, null);

            AssignmentView edited = verificationService.editDetails(claimed.id(), guardianId, "數學作業", null);

            assertThat(edited.title()).isEqualTo("數學作業");
            assertThat(edited.description()).isEqualTo(claimed.description());
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("Overdue unfinished tasks should expire while submitted ones stay")
        void shouldExpireOverdueTasks() {
            // Given
            Instant due = clock.instant().plus(Duration.ofHours(1));
            AssignmentView idle = verificationService.assignTask(guardianId, childId, homeworkTemplateId, null, due);
            AssignmentView submitted = verificationService.assignTask(guardianId, childId, homeworkTemplateId, null, due);
            verificationService.start(submitted.id(), childId);
            verificationService.submit(submitted.id(), childId, PHOTO, null, null);

            // When
            clock.advance(Duration.ofHours(2));
            int expired = verificationService.expireOverdue();

            // Then
            assertThat(expired).isGreaterThanOrEqualTo(1);
            assertThat(verificationService.getAssignment(idle.id()).status()).isEqualTo(AssignmentStatus.EXPIRED);
            assertThat(verificationService.getAssignment(submitted.id()).status())
                    .isEqualTo(AssignmentStatus.PENDING_REVIEW);
            assertThatThrownBy(() -> verificationService.start(idle.id(), childId))
                    .isInstanceOf(StateConflictException.class);
        }

        @Test
        @DisplayName("Starting a task past its due date should expire it even before the sweep")
        void startPastDueShouldExpire() {
            // Given
            AssignmentView task = verificationService.assignTask(guardianId, childId, homeworkTemplateId, null,
                    clock.instant().plus(Duration.ofHours(1)));

            // When
            clock.advance(Duration.ofHours(5));

            // Then
            assertThatThrownBy(() -> verificationService.start(task.id(), childId))
                    .isInstanceOf(StateConflictException.class);
            assertThat(verificationService.getAssignment(task.id()).status()).isEqualTo(AssignmentStatus.EXPIRED);
        }

        @Test
        @DisplayName("Submitting past the due date should expire the task and award nothing")
        void submitPastDueShouldExpire() {
            // Given
            AssignmentView task = verificationService.assignTask(guardianId, childId, homeworkTemplateId, null,
                    clock.instant().plus(Duration.ofHours(1)));
            verificationService.start(task.id(), childId);

            // When
            clock.advance(Duration.ofHours(2));

            // Then
            assertThatThrownBy(() -> verificationService.submit(task.id(), childId, PHOTO, null, null))
                    .isInstanceOf(StateConflictException.class);
            AssignmentView after = verificationService.getAssignment(task.id());
            assertThat(after.status()).isEqualTo(AssignmentStatus.EXPIRED);
            assertThat(after.photoUrl()).isNull();
            assertThat(verificationService.getPendingReviews(guardianId))
                    .extracting(AssignmentView::id)
                    .doesNotContain(task.id());
            assertThat(txRepo.findByUserIdAndRelatedTaskId(childId, task.id())).isEmpty();
        }

        @Test
        @DisplayName("Due date must be in the future")
        void dueDateMustBeFuture() {
            assertThatThrownBy(() -> verificationService.assignTask(guardianId, childId, homeworkTemplateId, null,
                    clock.instant().minusSeconds(1)))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Test
    @DisplayName("Concurrent approvals for the same child should serialize without lost updates")
    void concurrentApprovalsShouldSerialize() throws Exception {
        // Given
        givenCredibility(childId, 80, 0);
        xpLedger.getBalance(childId);
        UUID first = pendingTask(TaskLevel.LEVEL_3);
        UUID second = pendingTask(TaskLevel.LEVEL_3);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            Future<ApprovalResult> a = pool.submit(() -> {
                go.await();
                return verificationService.approve(first, guardianId, null, null);
            });
            Future<ApprovalResult> b = pool.submit(() -> {
                go.await();
                return verificationService.approve(second, guardianId, null, null);
            });

            // When
            go.countDown();
            a.get(30, TimeUnit.SECONDS);
            b.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        // Then
        assertThat(credibilityOf(childId).getScore()).isEqualTo(84);
        assertThat(credibilityOf(childId).getConsecutiveApprovedTasks()).isEqualTo(2);

        XpBalanceView balance = xpLedger.getBalance(childId);
        assertThat(balance.currentXp()).isEqualTo(balance.lifetimeEarned() - balance.lifetimeSpent());
        int ledgerTotal = txRepo.findByUserIdOrderByCreatedAtDescIdDesc(childId, PageRequest.of(0, 100)).stream()
                .mapToInt(t -> t.getType() == XpTransactionType.REDEEMED ? -t.getAmount() : t.getAmount())
                .sum();
        assertThat(ledgerTotal).isEqualTo(balance.currentXp());
        assertThat(txRepo.findByUserIdAndRelatedTaskId(childId, first)).hasSize(1);
        assertThat(txRepo.findByUserIdAndRelatedTaskId(childId, second)).hasSize(1);
    }
}
