package com.aiinpocket.choretrust.model.dto;

import java.time.LocalDate;

public record DailyXpSummary(
        LocalDate date,
        long earnedToday,
        long redeemedToday,
        int currentBalance
) {}
