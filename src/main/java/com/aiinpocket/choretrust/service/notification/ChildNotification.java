package com.aiinpocket.choretrust.service.notification;

import java.util.UUID;

/**
 * 發送給孩子（或家長）的一則通知。
 */
public record ChildNotification(
        UUID recipientId,
        Kind kind,
        String title,
        String message
) {
    public enum Kind {
        TASK_APPROVED,
        TASK_DECLINED,
        DECLINE_UPHELD,
        BADGE_EARNED,
        REDEMPTION_BONUS_STARTED,
        REDEMPTION_BONUS_ENDED
    }
}
