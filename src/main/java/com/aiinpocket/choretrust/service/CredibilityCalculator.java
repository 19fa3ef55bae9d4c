package com.aiinpocket.choretrust.service;

import com.aiinpocket.choretrust.model.entity.CredibilityEvent;
import com.aiinpocket.choretrust.model.entity.CredibilityState;
import com.aiinpocket.choretrust.model.enums.CredibilityTier;
import com.aiinpocket.choretrust.model.enums.DecayStage;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 信用分規則（純函式，不碰資料庫）。
 *
 * <p>天數一律以完整天數計算（不足一天捨去）。
 */
public final class CredibilityCalculator {

    public static final int APPROVAL_REWARD = 2;
    public static final int STREAK_BONUS = 5;
    public static final int STREAK_BONUS_INTERVAL = 10;

    public static final int BASE_PENALTY = 10;
    public static final int STACKED_PENALTY = 15;
    public static final int STACKING_WINDOW_DAYS = 7;

    public static final int HALF_DECAY_DAYS = 30;
    public static final int FULL_DECAY_DAYS = 60;

    public static final int REDEMPTION_FLOOR = 60;
    public static final int REDEMPTION_TARGET = 95;
    public static final Duration REDEMPTION_DURATION = Duration.ofDays(7);
    public static final BigDecimal REDEMPTION_MULTIPLIER = new BigDecimal("1.3");

    private CredibilityCalculator() {
    }

    public static int clamp(int score) {
        return Math.max(CredibilityState.MIN_SCORE, Math.min(CredibilityState.MAX_SCORE, score));
    }

    /**
     * 扣分幅度：上一次有效扣分在 7 天內（含）就加重為 15 分。
     *
     * @param lastDownvoteAt 最近一筆未衰減、未撤銷的扣分時間
     */
    public static int penaltyFor(Instant now, Optional<Instant> lastDownvoteAt) {
        return lastDownvoteAt
                .filter(at -> Duration.between(at, now).toDays() <= STACKING_WINDOW_DAYS)
                .map(at -> STACKED_PENALTY)
                .orElse(BASE_PENALTY);
    }

    public static boolean earnsStreakBonus(int streak) {
        return streak > 0 && streak % STREAK_BONUS_INTERVAL == 0;
    }

    /**
     * 計算單筆扣分在此刻應返還多少分數。
     * 滿 30 天返還一半；滿 60 天返還剩餘部分並封存。不需要返還時為空。
     */
    public static Optional<DecayStep> decayStep(CredibilityEvent downvote, Instant now) {
        if (downvote.isReversed() || downvote.getDecayStage() == DecayStage.FULL) {
            return Optional.empty();
        }
        long ageDays = Duration.between(downvote.getCreatedAt(), now).toDays();
        int magnitude = downvote.penaltyMagnitude();
        if (ageDays >= FULL_DECAY_DAYS) {
            return Optional.of(new DecayStep(magnitude - downvote.getDecayedAmount(), DecayStage.FULL));
        }
        if (ageDays >= HALF_DECAY_DAYS && downvote.getDecayStage() == DecayStage.NONE) {
            return Optional.of(new DecayStep(magnitude / 2, DecayStage.HALF));
        }
        return Optional.empty();
    }

    /**
     * 分數從 60 以下一口氣回到 95 以上，且目前沒有有效加成時，啟動救贖加成。
     */
    public static boolean triggersRedemption(int before, int after, boolean bonusActive) {
        return !bonusActive && before < REDEMPTION_FLOOR && after >= REDEMPTION_TARGET;
    }

    /**
     * XP 換算螢幕時間的倍率：等級倍率，救贖加成有效時再乘 1.3。
     */
    public static BigDecimal conversionRate(int score, boolean redemptionBonusActive) {
        BigDecimal tierMultiplier = CredibilityTier.forScore(score).getMultiplier();
        return redemptionBonusActive ? tierMultiplier.multiply(REDEMPTION_MULTIPLIER) : tierMultiplier;
    }

    /**
     * 升到下一個等級還需要幾次核准（不計連勝加分）；已是最高等級時為 0。
     */
    public static int approvalsToNextTier(int score) {
        return CredibilityTier.nextAbove(score)
                .map(next -> (next.getMinScore() - score + APPROVAL_REWARD - 1) / APPROVAL_REWARD)
                .orElse(0);
    }

    public record DecayStep(int restore, DecayStage newStage) {}
}
