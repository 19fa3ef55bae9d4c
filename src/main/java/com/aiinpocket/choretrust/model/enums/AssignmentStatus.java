package com.aiinpocket.choretrust.model.enums;

/**
 * 任務指派的生命週期狀態。
 * APPROVED 與 EXPIRED 為終態；DECLINED 在申訴期限內仍可申訴。
 */
public enum AssignmentStatus {
    ASSIGNED,
    IN_PROGRESS,
    PENDING_REVIEW,
    APPROVED,
    DECLINED,
    APPEALED,
    EXPIRED;

    /** 是否已經有審核結果（或已過期），對這類狀態再做審核代表呼叫端讀到舊資料 */
    public boolean isSettled() {
        return this == APPROVED || this == DECLINED || this == EXPIRED;
    }

    public boolean isAwaitingReview() {
        return this == PENDING_REVIEW || this == APPEALED;
    }
}
