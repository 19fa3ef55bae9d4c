package com.aiinpocket.choretrust.model.event;

import com.aiinpocket.choretrust.model.enums.ReviewDecision;

import java.util.UUID;

/**
 * 家長完成一次審核（核准、退件或維持原判）。
 */
public record TaskReviewed(
        UUID assignmentId,
        UUID childId,
        UUID reviewerId,
        String title,
        ReviewDecision decision,
        int xpAwarded,
        int credibilityAfter
) {}
