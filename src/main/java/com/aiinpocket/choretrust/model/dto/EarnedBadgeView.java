package com.aiinpocket.choretrust.model.dto;

import com.aiinpocket.choretrust.model.entity.EarnedBadge;
import com.aiinpocket.choretrust.model.enums.BadgeDef;
import com.aiinpocket.choretrust.model.enums.BadgeTier;

import java.time.Instant;

public record EarnedBadgeView(
        BadgeDef badge,
        String name,
        String description,
        BadgeTier tier,
        Instant earnedAt,
        int bonusXpAwarded
) {
    public static EarnedBadgeView from(EarnedBadge b) {
        BadgeDef def = b.getBadge();
        return new EarnedBadgeView(def, def.getDisplayName(), def.getDescription(), def.getTier(),
                b.getEarnedAt(), b.getBonusXpAwarded());
    }
}
