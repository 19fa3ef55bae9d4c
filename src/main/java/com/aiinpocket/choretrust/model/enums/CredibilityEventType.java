package com.aiinpocket.choretrust.model.enums;

public enum CredibilityEventType {
    DOWNVOTE,
    DOWNVOTE_UNDONE,
    APPROVED_TASK,
    APPROVAL_UNDONE,
    STREAK_BONUS,
    TIME_DECAY_RECOVERY,
    REDEMPTION_BONUS_ACTIVATED,
    REDEMPTION_BONUS_EXPIRED
}
