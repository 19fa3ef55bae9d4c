package com.aiinpocket.choretrust.model.enums;

/**
 * 徽章的計數來源。
 */
public enum BadgeCriterion {
    /** 已核准的任務數（任務審核流程） */
    APPROVED_TASKS,
    /** 累計獲得的 XP（XP 帳本） */
    LIFETIME_XP,
    /** 連續核准次數（信用分引擎） */
    APPROVAL_STREAK
}
