package com.aiinpocket.choretrust.model.dto;

public record DecaySweepResult(
        int usersRecovered,
        int pointsRestored,
        int redemptionBonusesExpired
) {}
