package com.aiinpocket.choretrust.model.dto;

import com.aiinpocket.choretrust.model.enums.CredibilityTier;

import java.math.BigDecimal;

public record CredibilitySnapshot(
        int score,
        CredibilityTier tier,
        int streak,
        boolean redemptionBonusActive
) {
    /** 任務 XP 入帳倍率（只看等級，不含救贖加成） */
    public BigDecimal earningMultiplier() {
        return tier.getMultiplier();
    }
}
