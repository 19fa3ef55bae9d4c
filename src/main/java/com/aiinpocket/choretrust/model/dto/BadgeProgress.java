package com.aiinpocket.choretrust.model.dto;

import com.aiinpocket.choretrust.model.enums.BadgeDef;
import com.aiinpocket.choretrust.model.enums.BadgeTier;

public record BadgeProgress(
        BadgeDef badge,
        String name,
        BadgeTier tier,
        long current,
        long target,
        boolean isEarned,
        double percentage
) {
    public static BadgeProgress of(BadgeDef badge, long current, boolean earned) {
        long target = badge.getTarget();
        double pct = earned ? 100.0 : Math.min((double) current / target * 100, 100.0);
        return new BadgeProgress(badge, badge.getDisplayName(), badge.getTier(), current, target, earned, pct);
    }
}
