package com.aiinpocket.choretrust.model.dto;

/**
 * 一次信用分異動的結果。appliedDelta 為實際變化量（已考慮 0–100 夾值）。
 */
public record CredibilityChange(
        int previousScore,
        int newScore,
        int appliedDelta,
        int streak,
        boolean streakBonusApplied,
        boolean redemptionBonusActivated
) {}
