package com.aiinpocket.choretrust.model.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record CredibilityStatus(
        int score,
        TierInfo tier,
        BigDecimal conversionRate,
        int consecutiveApprovedTasks,
        boolean hasRedemptionBonus,
        Instant redemptionBonusExpiry,
        List<HistoryEntry> history,
        String recoveryPath
) {
    public record TierInfo(
            String name,
            int minScore,
            int maxScore,
            BigDecimal multiplier,
            String color,
            String description
    ) {}

    public record HistoryEntry(
            Long id,
            String event,
            int amount,
            int appliedDelta,
            int scoreAfter,
            Instant timestamp,
            String taskId,
            String notes,
            boolean decayed,
            boolean reversed
    ) {}
}
