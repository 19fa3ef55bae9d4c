package com.aiinpocket.choretrust.service;

import com.aiinpocket.choretrust.exception.NotFoundException;
import com.aiinpocket.choretrust.exception.ReviewAuthorityException;
import com.aiinpocket.choretrust.exception.StateConflictException;
import com.aiinpocket.choretrust.exception.ValidationException;
import com.aiinpocket.choretrust.model.dto.ApprovalResult;
import com.aiinpocket.choretrust.model.dto.AssignmentView;
import com.aiinpocket.choretrust.model.dto.CredibilityChange;
import com.aiinpocket.choretrust.model.dto.CredibilitySnapshot;
import com.aiinpocket.choretrust.model.dto.DeclineResult;
import com.aiinpocket.choretrust.model.dto.TaskTemplateInfo;
import com.aiinpocket.choretrust.model.entity.TaskAssignment;
import com.aiinpocket.choretrust.model.enums.AssignmentStatus;
import com.aiinpocket.choretrust.model.enums.BadgeDef;
import com.aiinpocket.choretrust.model.enums.ReviewDecision;
import com.aiinpocket.choretrust.model.enums.TaskLevel;
import com.aiinpocket.choretrust.model.event.TaskReviewed;
import com.aiinpocket.choretrust.repository.TaskAssignmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * 任務審核流程（狀態機）。
 *
 * <pre>
 * ASSIGNED → IN_PROGRESS → PENDING_REVIEW → APPROVED | DECLINED
 * DECLINED → APPEALED → APPROVED | DECLINED（維持原判）
 * ASSIGNED / IN_PROGRESS → EXPIRED（逾期）
 * </pre>
 *
 * <p>每個操作都先以 SELECT ... FOR UPDATE 鎖住任務列，再依序呼叫信用分引擎、XP 帳本與徽章追蹤，
 * 全部在同一個交易內完成；任何一步失敗都會整筆回滾。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskVerificationService {

    /** 退件後可申訴的時間 */
    public static final Duration APPEAL_WINDOW = Duration.ofHours(24);

    private static final List<AssignmentStatus> EXPIRABLE =
            List.of(AssignmentStatus.ASSIGNED, AssignmentStatus.IN_PROGRESS);
    private static final List<AssignmentStatus> AWAITING_REVIEW =
            List.of(AssignmentStatus.PENDING_REVIEW, AssignmentStatus.APPEALED);

    private final TaskAssignmentRepository assignmentRepo;
    private final TaskCatalogService catalog;
    private final ReviewAuthorityService authority;
    private final CredibilityService credibilityService;
    private final XpLedgerService xpLedger;
    private final BadgeService badgeService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // ===== 建立任務 =====

    /**
     * 孩子自行認領範本任務。未指定等級時使用範本建議等級。
     */
    @Transactional
    public AssignmentView claimTask(UUID childId, Long templateId, TaskLevel level) {
        TaskTemplateInfo template = catalog.getTemplate(templateId);
        TaskAssignment saved = assignmentRepo.save(newAssignment(template, childId, null, level, null));
        log.info("[任務審核] 孩子 {} 認領任務「{}」({})", childId, saved.getTitle(), saved.getId());
        return AssignmentView.from(saved);
    }

    /**
     * 家長指派任務給孩子，可設定期限。
     */
    @Transactional
    public AssignmentView assignTask(UUID guardianId, UUID childId, Long templateId, TaskLevel level, Instant dueDate) {
        authority.requireReviewer(guardianId, childId);
        if (dueDate != null && !dueDate.isAfter(clock.instant())) {
            throw new ValidationException("任務期限必須在未來");
        }
        TaskTemplateInfo template = catalog.getTemplate(templateId);
        TaskAssignment saved = assignmentRepo.save(newAssignment(template, childId, guardianId, level, dueDate));
        log.info("[任務審核] 家長 {} 指派任務「{}」給孩子 {} ({})", guardianId, saved.getTitle(), childId, saved.getId());
        return AssignmentView.from(saved);
    }

    /**
     * 家長在審核前修改任務標題或說明。
     */
    @Transactional
    public AssignmentView editDetails(UUID assignmentId, UUID guardianId, String title, String description) {
        if (title != null && title.isBlank()) {
            throw new ValidationException("任務標題不可為空白");
        }
        TaskAssignment a = lock(assignmentId);
        authority.requireReviewer(guardianId, a.getChildId());
        requireStatus(a, AssignmentStatus.ASSIGNED, AssignmentStatus.IN_PROGRESS, AssignmentStatus.PENDING_REVIEW);
        if (title != null) {
            a.setTitle(title.strip());
        }
        if (description != null) {
            a.setDescription(description.strip());
        }
        return AssignmentView.from(a);
    }

    // ===== 孩子操作 =====

    /**
     * 開始進行任務。已超過期限的任務會直接標記為過期並拒絕（不等排程掃描）。
     */
    @Transactional(noRollbackFor = StateConflictException.class)
    public AssignmentView start(UUID assignmentId, UUID childId) {
        TaskAssignment a = lock(assignmentId);
        requireChild(a, childId);
        requireStatus(a, AssignmentStatus.ASSIGNED);
        expireIfOverdue(a);
        a.setStatus(AssignmentStatus.IN_PROGRESS);
        a.setStartedAt(clock.instant());
        log.info("[任務審核] 任務 {} 開始進行", assignmentId);
        return AssignmentView.from(a);
    }

    /**
     * 提交完成證明。沒有照片就不能送審；超過期限的任務改為過期。
     */
    @Transactional(noRollbackFor = StateConflictException.class)
    public AssignmentView submit(UUID assignmentId, UUID childId, String photoUrl, String notes,
                                 Integer completionTimeMinutes) {
        if (photoUrl == null || photoUrl.isBlank()) {
            throw new ValidationException("提交任務必須附上照片");
        }
        if (completionTimeMinutes != null && completionTimeMinutes < 0) {
            throw new ValidationException("完成時間不可為負數");
        }
        TaskAssignment a = lock(assignmentId);
        requireChild(a, childId);
        requireStatus(a, AssignmentStatus.IN_PROGRESS);
        expireIfOverdue(a);
        a.setStatus(AssignmentStatus.PENDING_REVIEW);
        a.setPhotoUrl(photoUrl.strip());
        a.setChildNotes(notes);
        a.setCompletionTimeMinutes(completionTimeMinutes);
        a.setCompletedAt(clock.instant());
        log.info("[任務審核] 任務 {} 已提交，等待審核", assignmentId);
        return AssignmentView.from(a);
    }

    /**
     * 對退件提出申訴，只能在退件後 24 小時內（不含）提出。
     */
    @Transactional
    public AssignmentView appeal(UUID assignmentId, UUID childId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("申訴必須填寫理由");
        }
        TaskAssignment a = lock(assignmentId);
        requireChild(a, childId);
        if (a.getStatus() != AssignmentStatus.DECLINED) {
            throw wrongStatus(a);
        }
        Instant now = clock.instant();
        if (a.getAppealDeadline() == null || !now.isBefore(a.getAppealDeadline())) {
            throw new ValidationException("已超過申訴期限");
        }
        a.setStatus(AssignmentStatus.APPEALED);
        a.setAppealNotes(reason.strip());
        a.setAppealedAt(now);
        log.info("[任務審核] 任務 {} 提出申訴", assignmentId);
        return AssignmentView.from(a);
    }

    @Transactional
    public AssignmentView markDeclineViewed(UUID assignmentId, UUID childId) {
        TaskAssignment a = lock(assignmentId);
        requireChild(a, childId);
        if (a.getStatus() != AssignmentStatus.DECLINED) {
            throw wrongStatus(a);
        }
        a.setDeclineViewedByChild(true);
        return AssignmentView.from(a);
    }

    // ===== 家長審核 =====

    /**
     * 核准任務。依序：（申訴中先撤銷原本的扣分）→ 快照倍率 → 信用分 +2 → XP 入帳 → 徽章檢查。
     *
     * @param adjustedLevel 家長調整的等級；與原等級不同時審核結果為 APPROVED_EDITED
     */
    @Transactional
    public ApprovalResult approve(UUID assignmentId, UUID reviewerId, TaskLevel adjustedLevel, String notes) {
        TaskAssignment a = lock(assignmentId);
        UUID childId = a.getChildId();
        authority.requireReviewer(reviewerId, childId);
        requireStatus(a, AssignmentStatus.PENDING_REVIEW, AssignmentStatus.APPEALED);

        if (a.getStatus() == AssignmentStatus.APPEALED) {
            credibilityService.undoDecline(childId, assignmentId);
        }

        boolean edited = adjustedLevel != null && adjustedLevel != a.getAssignedLevel();
        if (edited) {
            a.setAdjustedLevel(adjustedLevel);
        }
        TaskLevel level = a.effectiveLevel();
        int baseXp = catalog.getTemplate(a.getTemplateId()).baseXp(level);

        // 入帳倍率以核准前的信用分為準
        CredibilitySnapshot before = credibilityService.snapshot(childId);
        CredibilityChange change = credibilityService.applyApproval(childId, assignmentId, reviewerId, notes);
        int xp = xpLedger.earn(childId, baseXp, before.earningMultiplier(), assignmentId, before.score());

        Instant now = clock.instant();
        ReviewDecision decision = edited ? ReviewDecision.APPROVED_EDITED : ReviewDecision.APPROVED;
        a.setStatus(AssignmentStatus.APPROVED);
        a.setReviewedAt(now);
        a.setReviewedBy(reviewerId);
        a.setParentNotes(notes);
        a.setReviewDecision(decision);
        a.setXpAwarded(xp);
        a.setAppealDeadline(null);

        List<BadgeDef> badges = badgeService.evaluateBadges(childId);
        eventPublisher.publishEvent(new TaskReviewed(assignmentId, childId, reviewerId, a.getTitle(),
                decision, xp, change.newScore()));

        log.info("[任務審核] 任務 {} 核准 ({}, {}): +{} XP，信用分 {} → {}",
                assignmentId, decision, level, xp, change.previousScore(), change.newScore());
        return new ApprovalResult(AssignmentView.from(a), xp, change, badges);
    }

    /**
     * 退件。待審任務會扣信用分並開啟 24 小時申訴期；申訴中的任務再次退件則維持原判，不重複扣分。
     */
    @Transactional
    public DeclineResult decline(UUID assignmentId, UUID reviewerId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("退件必須填寫原因");
        }
        TaskAssignment a = lock(assignmentId);
        UUID childId = a.getChildId();
        authority.requireReviewer(reviewerId, childId);
        requireStatus(a, AssignmentStatus.PENDING_REVIEW, AssignmentStatus.APPEALED);

        Instant now = clock.instant();
        boolean upheld = a.getStatus() == AssignmentStatus.APPEALED;
        CredibilityChange change = null;
        int scoreAfter;
        if (upheld) {
            a.setReviewDecision(ReviewDecision.DECLINE_UPHELD);
            a.setAppealDeadline(null);
            scoreAfter = credibilityService.snapshot(childId).score();
        } else {
            change = credibilityService.applyDecline(childId, assignmentId, reviewerId, reason.strip());
            a.setReviewDecision(ReviewDecision.DECLINED);
            a.setAppealDeadline(now.plus(APPEAL_WINDOW));
            scoreAfter = change.newScore();
        }
        a.setStatus(AssignmentStatus.DECLINED);
        a.setReviewedAt(now);
        a.setReviewedBy(reviewerId);
        a.setParentNotes(reason.strip());
        a.setXpAwarded(0);
        a.setDeclineViewedByChild(false);

        eventPublisher.publishEvent(new TaskReviewed(assignmentId, childId, reviewerId, a.getTitle(),
                a.getReviewDecision(), 0, scoreAfter));

        log.info("[任務審核] 任務 {} {}：{}", assignmentId, upheld ? "維持退件" : "退件", reason);
        return new DeclineResult(AssignmentView.from(a), change);
    }

    /**
     * 家長撤回尚未被申訴的退件：返還扣分，任務回到待審。
     * 只能在申訴期內撤回；申訴期結束或申訴後維持原判的退件已是定案。
     */
    @Transactional
    public AssignmentView retractDecline(UUID assignmentId, UUID reviewerId) {
        TaskAssignment a = lock(assignmentId);
        authority.requireReviewer(reviewerId, a.getChildId());
        if (a.getStatus() != AssignmentStatus.DECLINED) {
            throw wrongStatus(a);
        }
        if (a.getAppealDeadline() == null || !clock.instant().isBefore(a.getAppealDeadline())) {
            throw new StateConflictException("退件已定案，無法撤回");
        }
        credibilityService.undoDecline(a.getChildId(), assignmentId);
        a.setStatus(AssignmentStatus.PENDING_REVIEW);
        a.setReviewedAt(null);
        a.setReviewedBy(null);
        a.setReviewDecision(null);
        a.setParentNotes(null);
        a.setXpAwarded(null);
        a.setAppealDeadline(null);
        log.info("[任務審核] 家長 {} 撤回任務 {} 的退件", reviewerId, assignmentId);
        return AssignmentView.from(a);
    }

    /**
     * 將逾期仍未完成（ASSIGNED / IN_PROGRESS）的任務標記為過期，不影響信用分與 XP。
     *
     * @return 過期的任務數
     */
    @Transactional
    public int expireOverdue() {
        int expired = assignmentRepo.expireOverdue(EXPIRABLE, clock.instant());
        if (expired > 0) {
            log.info("[任務審核] {} 個任務已逾期", expired);
        }
        return expired;
    }

    // ===== 查詢 =====

    @Transactional(readOnly = true)
    public List<AssignmentView> getPendingReviews(UUID reviewerId) {
        List<UUID> children = authority.childrenOf(reviewerId);
        if (children.isEmpty()) {
            return List.of();
        }
        return assignmentRepo.findByChildIdInAndStatusInOrderByCompletedAtAsc(children, AWAITING_REVIEW).stream()
                .map(AssignmentView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<AssignmentView> getChildTasks(UUID childId, AssignmentStatus status) {
        List<TaskAssignment> tasks = status == null
                ? assignmentRepo.findByChildIdOrderByCreatedAtDesc(childId)
                : assignmentRepo.findByChildIdAndStatusOrderByCreatedAtDesc(childId, status);
        return tasks.stream().map(AssignmentView::from).toList();
    }

    @Transactional(readOnly = true)
    public AssignmentView getAssignment(UUID assignmentId) {
        return assignmentRepo.findById(assignmentId)
                .map(AssignmentView::from)
                .orElseThrow(() -> NotFoundException.of("任務", assignmentId));
    }

    // ===== 內部工具 =====

    private TaskAssignment newAssignment(TaskTemplateInfo template, UUID childId, UUID guardianId,
                                         TaskLevel level, Instant dueDate) {
        return TaskAssignment.builder()
                .templateId(template.id())
                .childId(childId)
                .assignedBy(guardianId)
                .title(template.title())
                .description(template.description())
                .category(template.category())
                .assignedLevel(level != null ? level : template.suggestedLevel())
                .status(AssignmentStatus.ASSIGNED)
                .createdAt(clock.instant())
                .dueDate(dueDate)
                .build();
    }

    private TaskAssignment lock(UUID assignmentId) {
        return assignmentRepo.lockById(assignmentId)
                .orElseThrow(() -> NotFoundException.of("任務", assignmentId));
    }

    /**
     * 期限已過但排程尚未掃到的任務，在此直接轉為過期。
     */
    private void expireIfOverdue(TaskAssignment a) {
        Instant now = clock.instant();
        if (a.getDueDate() == null || !now.isAfter(a.getDueDate())) {
            return;
        }
        a.setStatus(AssignmentStatus.EXPIRED);
        log.info("[任務審核] 任務 {} 已超過期限 {}，標記為過期", a.getId(), a.getDueDate());
        throw new StateConflictException("任務已超過期限");
    }

    private static void requireChild(TaskAssignment a, UUID actorId) {
        if (!a.getChildId().equals(actorId)) {
            throw new ReviewAuthorityException("只有認領此任務的孩子可以執行此操作");
        }
    }

    private static void requireStatus(TaskAssignment a, AssignmentStatus... allowed) {
        if (Arrays.asList(allowed).contains(a.getStatus())) {
            return;
        }
        throw wrongStatus(a);
    }

    /**
     * 已結束的任務（核准、退件、過期）代表呼叫端讀到舊狀態，其餘則是操作順序錯誤。
     */
    private static RuntimeException wrongStatus(TaskAssignment a) {
        String message = "任務目前狀態為 " + a.getStatus() + "，無法執行此操作";
        if (a.getStatus().isSettled()) {
            return new StateConflictException(message);
        }
        return new ValidationException(message);
    }
}
