package com.aiinpocket.choretrust.service;

import com.aiinpocket.choretrust.exception.NotFoundException;
import com.aiinpocket.choretrust.exception.ValidationException;
import com.aiinpocket.choretrust.model.dto.CredibilityChange;
import com.aiinpocket.choretrust.model.dto.CredibilitySnapshot;
import com.aiinpocket.choretrust.model.dto.CredibilityStatus;
import com.aiinpocket.choretrust.model.dto.CredibilityStatus.HistoryEntry;
import com.aiinpocket.choretrust.model.dto.CredibilityStatus.TierInfo;
import com.aiinpocket.choretrust.model.dto.DecaySweepResult;
import com.aiinpocket.choretrust.model.entity.CredibilityEvent;
import com.aiinpocket.choretrust.model.entity.CredibilityState;
import com.aiinpocket.choretrust.model.enums.CredibilityEventType;
import com.aiinpocket.choretrust.model.enums.CredibilityTier;
import com.aiinpocket.choretrust.model.enums.DecayStage;
import com.aiinpocket.choretrust.model.event.RedemptionBonusActivated;
import com.aiinpocket.choretrust.model.event.RedemptionBonusEnded;
import com.aiinpocket.choretrust.repository.CredibilityEventRepository;
import com.aiinpocket.choretrust.repository.CredibilityStateRepository;
import com.aiinpocket.choretrust.service.CredibilityCalculator.DecayStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 信用分引擎。
 *
 * <p>每個異動都在呼叫端的交易中以 SELECT ... FOR UPDATE 鎖住信用分狀態列，
 * 並寫入一筆或多筆 {@link CredibilityEvent}。撤銷操作使用事件上記錄的實際變化量，
 * 不重新計算（疊加扣分讓變化量取決於當時的歷史）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredibilityService {

    private final CredibilityStateRepository stateRepo;
    private final CredibilityEventRepository eventRepo;
    private final UserStateProvisioner provisioner;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    // ===== 核准 / 退件 =====

    /**
     * 任務核准：+2 分、連續核准數 +1；連續核准數為 10 的倍數時再加 5 分（獨立一筆事件）。
     */
    @Transactional
    public CredibilityChange applyApproval(UUID userId, UUID taskId, UUID reviewerId, String notes) {
        CredibilityState state = lockState(userId);
        Instant now = clock.instant();
        int before = state.getScore();
        int streak = state.getConsecutiveApprovedTasks() + 1;

        int score = CredibilityCalculator.clamp(before + CredibilityCalculator.APPROVAL_REWARD);
        eventRepo.save(CredibilityEvent.builder()
                .userId(userId)
                .eventType(CredibilityEventType.APPROVED_TASK)
                .amount(CredibilityCalculator.APPROVAL_REWARD)
                .appliedDelta(score - before)
                .scoreAfter(score)
                .taskId(taskId)
                .reviewerId(reviewerId)
                .notes(notes)
                .streakCount(streak)
                .createdAt(now)
                .build());

        boolean streakBonus = CredibilityCalculator.earnsStreakBonus(streak);
        if (streakBonus) {
            int withBonus = CredibilityCalculator.clamp(score + CredibilityCalculator.STREAK_BONUS);
            eventRepo.save(CredibilityEvent.builder()
                    .userId(userId)
                    .eventType(CredibilityEventType.STREAK_BONUS)
                    .amount(CredibilityCalculator.STREAK_BONUS)
                    .appliedDelta(withBonus - score)
                    .scoreAfter(withBonus)
                    .taskId(taskId)
                    .reviewerId(reviewerId)
                    .notes("連續 " + streak + " 次核准")
                    .streakCount(streak)
                    .createdAt(now)
                    .build());
            score = withBonus;
            log.info("[信用分] 使用者 {} 連續核准 {} 次，獲得連勝加分", userId, streak);
        }

        state.setScore(score);
        state.setConsecutiveApprovedTasks(streak);
        state.setUpdatedAt(now);
        boolean activated = activateRedemptionIfEarned(state, before, now);

        log.info("[信用分] 使用者 {} 任務 {} 核准：{} → {} (連續 {})", userId, taskId, before, score, streak);
        return new CredibilityChange(before, score, score - before, streak, streakBonus, activated);
    }

    /**
     * 任務退件：連續核准數歸零；7 天內（含）已有有效扣分時扣 15 分，否則扣 10 分。
     */
    @Transactional
    public CredibilityChange applyDecline(UUID userId, UUID taskId, UUID reviewerId, String reason) {
        CredibilityState state = lockState(userId);
        Instant now = clock.instant();
        Optional<Instant> lastDownvote = eventRepo
                .findFirstByUserIdAndEventTypeAndDecayStageAndReversedFalseOrderByCreatedAtDescIdDesc(
                        userId, CredibilityEventType.DOWNVOTE, DecayStage.NONE)
                .map(CredibilityEvent::getCreatedAt);

        int penalty = CredibilityCalculator.penaltyFor(now, lastDownvote);
        int before = state.getScore();
        int after = CredibilityCalculator.clamp(before - penalty);
        int streakBefore = state.getConsecutiveApprovedTasks();

        eventRepo.save(CredibilityEvent.builder()
                .userId(userId)
                .eventType(CredibilityEventType.DOWNVOTE)
                .amount(-penalty)
                .appliedDelta(after - before)
                .scoreAfter(after)
                .taskId(taskId)
                .reviewerId(reviewerId)
                .notes(reason)
                .streakCount(0)
                .streakBefore(streakBefore)
                .createdAt(now)
                .build());

        state.setScore(after);
        state.setConsecutiveApprovedTasks(0);
        state.setUpdatedAt(now);
        endRedemptionIfBelowTarget(state, now);

        log.info("[信用分] 使用者 {} 任務 {} 退件：-{}{} {} → {}", userId, taskId, penalty,
                penalty == CredibilityCalculator.STACKED_PENALTY ? "（疊加）" : "", before, after);
        return new CredibilityChange(before, after, after - before, 0, false, false);
    }

    /**
     * 撤銷退件：返還該次扣分實際扣掉（且尚未衰減返還）的分數，並還原被歸零的連續核准數。
     *
     * @throws NotFoundException 該任務沒有有效的扣分紀錄
     */
    @Transactional
    public CredibilityChange undoDecline(UUID userId, UUID taskId) {
        CredibilityState state = lockState(userId);
        CredibilityEvent downvote = eventRepo
                .findFirstByUserIdAndTaskIdAndEventTypeAndReversedFalseOrderByCreatedAtDescIdDesc(
                        userId, taskId, CredibilityEventType.DOWNVOTE)
                .orElseThrow(() -> NotFoundException.of("任務扣分紀錄", taskId));

        Instant now = clock.instant();
        int restore = Math.max(0, -downvote.getAppliedDelta() - downvote.getDecayedAmount());
        int before = state.getScore();
        int after = CredibilityCalculator.clamp(before + restore);
        int streakBefore = downvote.getStreakBefore() != null ? downvote.getStreakBefore() : 0;
        int streak = streakBefore + state.getConsecutiveApprovedTasks();

        downvote.setReversed(true);
        eventRepo.save(CredibilityEvent.builder()
                .userId(userId)
                .eventType(CredibilityEventType.DOWNVOTE_UNDONE)
                .amount(restore)
                .appliedDelta(after - before)
                .scoreAfter(after)
                .taskId(taskId)
                .reviewerId(downvote.getReviewerId())
                .streakCount(streak)
                .createdAt(now)
                .build());

        state.setScore(after);
        state.setConsecutiveApprovedTasks(streak);
        state.setUpdatedAt(now);
        boolean activated = activateRedemptionIfEarned(state, before, now);

        log.info("[信用分] 使用者 {} 任務 {} 撤銷退件：{} → {}", userId, taskId, before, after);
        return new CredibilityChange(before, after, after - before, streak, false, activated);
    }

    /**
     * 撤銷核准：扣回該次核准與其觸發的連勝加分實際加上的分數，連續核准數 -1。
     *
     * @throws NotFoundException 該任務沒有有效的核准紀錄
     */
    @Transactional
    public CredibilityChange undoApproval(UUID userId, UUID taskId) {
        CredibilityState state = lockState(userId);
        CredibilityEvent approval = eventRepo
                .findFirstByUserIdAndTaskIdAndEventTypeAndReversedFalseOrderByCreatedAtDescIdDesc(
                        userId, taskId, CredibilityEventType.APPROVED_TASK)
                .orElseThrow(() -> NotFoundException.of("任務核准紀錄", taskId));
        Optional<CredibilityEvent> bonus = eventRepo
                .findFirstByUserIdAndTaskIdAndEventTypeAndReversedFalseOrderByCreatedAtDescIdDesc(
                        userId, taskId, CredibilityEventType.STREAK_BONUS);

        Instant now = clock.instant();
        int delta = approval.getAppliedDelta() + bonus.map(CredibilityEvent::getAppliedDelta).orElse(0);
        int before = state.getScore();
        int after = CredibilityCalculator.clamp(before - delta);
        int streak = Math.max(0, state.getConsecutiveApprovedTasks() - 1);

        approval.setReversed(true);
        bonus.ifPresent(b -> b.setReversed(true));
        eventRepo.save(CredibilityEvent.builder()
                .userId(userId)
                .eventType(CredibilityEventType.APPROVAL_UNDONE)
                .amount(-delta)
                .appliedDelta(after - before)
                .scoreAfter(after)
                .taskId(taskId)
                .reviewerId(approval.getReviewerId())
                .streakCount(streak)
                .createdAt(now)
                .build());

        state.setScore(after);
        state.setConsecutiveApprovedTasks(streak);
        state.setUpdatedAt(now);
        endRedemptionIfBelowTarget(state, now);

        log.info("[信用分] 使用者 {} 任務 {} 撤銷核准：{} → {}", userId, taskId, before, after);
        return new CredibilityChange(before, after, after - before, streak, false, false);
    }

    // ===== 衰減排程 =====

    /**
     * 對所有有待衰減扣分的使用者執行衰減，每位使用者一個獨立交易；同時結束已過期的救贖加成。
     * 同一天重複執行不會重複返還。
     */
    public DecaySweepResult applyDecay() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(CredibilityCalculator.HALF_DECAY_DAYS));

        int users = 0;
        int points = 0;
        for (UUID userId : eventRepo.findUserIdsWithDecayableDownvotes(cutoff)) {
            Integer restored = transactionTemplate.execute(status -> decayUser(userId, now));
            if (restored != null && restored > 0) {
                users++;
                points += restored;
            }
        }

        int expired = 0;
        for (UUID userId : stateRepo.findUserIdsWithExpiredRedemptionBonus(now)) {
            Boolean ended = transactionTemplate.execute(status -> expireRedemptionBonus(userId, now));
            if (Boolean.TRUE.equals(ended)) {
                expired++;
            }
        }

        log.info("[信用分] 衰減完成：{} 位使用者共返還 {} 分，{} 個救贖加成到期", users, points, expired);
        return new DecaySweepResult(users, points, expired);
    }

    /**
     * 只對單一使用者執行衰減。
     *
     * @return 實際返還的分數
     */
    @Transactional
    public int applyDecay(UUID userId) {
        return decayUser(userId, clock.instant());
    }

    private int decayUser(UUID userId, Instant now) {
        CredibilityState state = lockState(userId);
        Instant cutoff = now.minus(Duration.ofDays(CredibilityCalculator.HALF_DECAY_DAYS));

        int total = 0;
        for (CredibilityEvent downvote : eventRepo.findDecayableDownvotes(userId, cutoff)) {
            Optional<DecayStep> step = CredibilityCalculator.decayStep(downvote, now);
            if (step.isEmpty()) {
                continue;
            }
            DecayStep s = step.get();
            downvote.setDecayedAmount(downvote.getDecayedAmount() + s.restore());
            downvote.setDecayStage(s.newStage());
            downvote.setDecayedAt(now);
            if (s.newStage() == DecayStage.FULL) {
                downvote.setArchived(true);
            }
            total += s.restore();
        }
        if (total == 0) {
            return 0;
        }

        int before = state.getScore();
        int after = CredibilityCalculator.clamp(before + total);
        eventRepo.save(CredibilityEvent.builder()
                .userId(userId)
                .eventType(CredibilityEventType.TIME_DECAY_RECOVERY)
                .amount(total)
                .appliedDelta(after - before)
                .scoreAfter(after)
                .notes("扣分隨時間返還")
                .createdAt(now)
                .build());
        state.setScore(after);
        state.setUpdatedAt(now);
        activateRedemptionIfEarned(state, before, now);

        log.info("[信用分] 使用者 {} 衰減返還 {} 分：{} → {}", userId, total, before, after);
        return after - before;
    }

    private boolean expireRedemptionBonus(UUID userId, Instant now) {
        CredibilityState state = lockState(userId);
        if (!state.isHasRedemptionBonus() || state.isRedemptionBonusActive(now)) {
            return false;
        }
        endRedemptionBonus(state, now, true);
        return true;
    }

    // ===== 倍率 / 查詢 =====

    /**
     * 鎖定並讀取目前的信用分快照，供同一交易中的後續計算使用。
     */
    @Transactional
    public CredibilitySnapshot snapshot(UUID userId) {
        CredibilityState state = lockState(userId);
        return new CredibilitySnapshot(
                state.getScore(),
                CredibilityTier.forScore(state.getScore()),
                state.getConsecutiveApprovedTasks(),
                state.isRedemptionBonusActive(clock.instant()));
    }

    /** 任務 XP 入帳倍率 */
    @Transactional
    public BigDecimal earningMultiplier(UUID userId) {
        return snapshot(userId).earningMultiplier();
    }

    @Transactional(readOnly = true)
    public BigDecimal conversionRate(UUID userId) {
        CredibilityState state = readState(userId);
        return CredibilityCalculator.conversionRate(state.getScore(), state.isRedemptionBonusActive(clock.instant()));
    }

    /**
     * 以目前的換算倍率估算 XP 可兌換的分鐘數（四捨五入）。
     */
    @Transactional(readOnly = true)
    public int quoteMinutes(UUID userId, int xp) {
        if (xp < 0) {
            throw new ValidationException("XP 不可為負數");
        }
        return BigDecimal.valueOf(xp)
                .multiply(conversionRate(userId))
                .setScale(0, RoundingMode.HALF_UP)
                .intValueExact();
    }

    @Transactional(readOnly = true)
    public CredibilityStatus getCredibilityStatus(UUID userId) {
        CredibilityState state = readState(userId);
        Instant now = clock.instant();
        int score = state.getScore();
        boolean bonusActive = state.isRedemptionBonusActive(now);

        List<HistoryEntry> history = eventRepo.findByUserIdAndArchivedFalseOrderByCreatedAtAscIdAsc(userId).stream()
                .map(e -> new HistoryEntry(
                        e.getId(),
                        e.getEventType().name(),
                        e.getAmount(),
                        e.getAppliedDelta(),
                        e.getScoreAfter(),
                        e.getCreatedAt(),
                        e.getTaskId() != null ? e.getTaskId().toString() : null,
                        e.getNotes(),
                        e.getDecayStage() != DecayStage.NONE,
                        e.isReversed()))
                .toList();

        return new CredibilityStatus(
                score,
                toTierInfo(CredibilityTier.forScore(score)),
                CredibilityCalculator.conversionRate(score, bonusActive),
                state.getConsecutiveApprovedTasks(),
                bonusActive,
                bonusActive ? state.getRedemptionBonusExpiry() : null,
                history,
                recoveryPath(score));
    }

    public List<TierInfo> listTiers() {
        return Arrays.stream(CredibilityTier.values())
                .map(CredibilityService::toTierInfo)
                .toList();
    }

    /**
     * 提示還需要多少次核准才能升到下一個等級。
     */
    public static String recoveryPath(int score) {
        return CredibilityTier.nextAbove(score)
                .map(next -> "再完成 " + CredibilityCalculator.approvalsToNextTier(score)
                        + " 個核准任務即可升到 " + next.getDisplayName())
                .orElse("已達最高等級");
    }

    // ===== 救贖加成 =====

    private boolean activateRedemptionIfEarned(CredibilityState state, int before, Instant now) {
        if (!CredibilityCalculator.triggersRedemption(before, state.getScore(), state.isRedemptionBonusActive(now))) {
            return false;
        }
        Instant expiry = now.plus(CredibilityCalculator.REDEMPTION_DURATION);
        state.setHasRedemptionBonus(true);
        state.setRedemptionBonusExpiry(expiry);
        eventRepo.save(CredibilityEvent.builder()
                .userId(state.getUserId())
                .eventType(CredibilityEventType.REDEMPTION_BONUS_ACTIVATED)
                .amount(0)
                .appliedDelta(0)
                .scoreAfter(state.getScore())
                .notes("救贖加成至 " + expiry)
                .createdAt(now)
                .build());
        eventPublisher.publishEvent(new RedemptionBonusActivated(state.getUserId(), state.getScore(), expiry));
        log.info("[信用分] 使用者 {} 由 {} 回升到 {}，啟動救贖加成至 {}", state.getUserId(), before, state.getScore(), expiry);
        return true;
    }

    private void endRedemptionIfBelowTarget(CredibilityState state, Instant now) {
        if (state.isRedemptionBonusActive(now) && state.getScore() < CredibilityCalculator.REDEMPTION_TARGET) {
            endRedemptionBonus(state, now, false);
        }
    }

    private void endRedemptionBonus(CredibilityState state, Instant now, boolean expired) {
        state.setHasRedemptionBonus(false);
        state.setRedemptionBonusExpiry(null);
        state.setUpdatedAt(now);
        eventRepo.save(CredibilityEvent.builder()
                .userId(state.getUserId())
                .eventType(CredibilityEventType.REDEMPTION_BONUS_EXPIRED)
                .amount(0)
                .appliedDelta(0)
                .scoreAfter(state.getScore())
                .notes(expired ? "到期" : "分數低於 " + CredibilityCalculator.REDEMPTION_TARGET)
                .createdAt(now)
                .build());
        eventPublisher.publishEvent(new RedemptionBonusEnded(state.getUserId(), expired));
        log.info("[信用分] 使用者 {} 救贖加成結束（{}）", state.getUserId(), expired ? "到期" : "分數下滑");
    }

    // ===== 內部工具 =====

    private CredibilityState lockState(UUID userId) {
        provisioner.ensureCredibility(userId);
        return stateRepo.lockByUserId(userId)
                .orElseThrow(() -> new IllegalStateException("Credibility state missing after provisioning: " + userId));
    }

    private CredibilityState readState(UUID userId) {
        provisioner.ensureCredibility(userId);
        return stateRepo.findByUserId(userId)
                .orElseThrow(() -> new IllegalStateException("Credibility state missing after provisioning: " + userId));
    }

    private static TierInfo toTierInfo(CredibilityTier tier) {
        return new TierInfo(tier.getDisplayName(), tier.getMinScore(), tier.getMaxScore(),
                tier.getMultiplier(), tier.getColor(), tier.getDescription());
    }
}
