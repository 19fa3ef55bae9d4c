package com.aiinpocket.choretrust.model.dto;

import com.aiinpocket.choretrust.model.entity.XpBalance;

import java.time.Instant;
import java.util.UUID;

public record XpBalanceView(
        UUID userId,
        int currentXp,
        int lifetimeEarned,
        int lifetimeSpent,
        boolean atSoftCap,
        double softCapPct,
        Instant createdAt,
        Instant lastUpdated
) {
    public static XpBalanceView from(XpBalance b) {
        double pct = Math.min((double) b.getCurrentXp() / XpBalance.SOFT_CAP * 100, 100);
        return new XpBalanceView(
                b.getUserId(),
                b.getCurrentXp(),
                b.getLifetimeEarned(),
                b.getLifetimeSpent(),
                b.getCurrentXp() >= XpBalance.SOFT_CAP,
                pct,
                b.getCreatedAt(),
                b.getLastUpdated()
        );
    }
}
