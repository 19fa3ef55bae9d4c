package com.aiinpocket.choretrust.model.enums;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;

/**
 * 信用分等級表（由分數推導，不落地保存）。
 * 倍率同時用於任務 XP 入帳與 XP 換算螢幕時間。
 */
@Getter
public enum CredibilityTier {

    EXCELLENT("Excellent", 90, 100, new BigDecimal("1.2"), "green", "信用極佳！享有最高換算倍率。"),
    GOOD("Good", 75, 89, new BigDecimal("1.0"), "green", "信用良好，標準換算倍率。"),
    FAIR("Fair", 60, 74, new BigDecimal("0.8"), "yellow", "信用普通，換算倍率降低。"),
    POOR("Poor", 40, 59, new BigDecimal("0.5"), "red", "信用不佳，換算倍率大幅降低。"),
    VERY_POOR("Very Poor", 0, 39, new BigDecimal("0.3"), "red", "信用極差，僅剩最低換算倍率。");

    private final String displayName;
    private final int minScore;
    private final int maxScore;
    private final BigDecimal multiplier;
    private final String color;
    private final String description;

    CredibilityTier(String displayName, int minScore, int maxScore, BigDecimal multiplier,
                    String color, String description) {
        this.displayName = displayName;
        this.minScore = minScore;
        this.maxScore = maxScore;
        this.multiplier = multiplier;
        this.color = color;
        this.description = description;
    }

    public boolean contains(int score) {
        return score >= minScore && score <= maxScore;
    }

    /**
     * 依分數查詢等級，超出 0–100 的分數先夾回範圍內。
     */
    public static CredibilityTier forScore(int score) {
        int clamped = Math.max(0, Math.min(100, score));
        return Arrays.stream(values())
                .filter(t -> t.contains(clamped))
                .findFirst()
                .orElse(VERY_POOR);
    }

    /**
     * 比目前分數更高的下一個等級；已在最高等級時為空。
     */
    public static Optional<CredibilityTier> nextAbove(int score) {
        return Arrays.stream(values())
                .filter(t -> t.minScore > score)
                .min(Comparator.comparingInt(CredibilityTier::getMinScore));
    }
}
