package com.aiinpocket.choretrust.model.enums;

import lombok.Getter;

@Getter
public enum BadgeDef {

    // 任務成就
    FIRST_TASK_COMPLETE("第一步", "完成第一個任務", BadgeCriterion.APPROVED_TASKS, 1, BadgeTier.BRONZE, 75),
    TASKS_NOVICE("任務新手", "完成 5 個任務", BadgeCriterion.APPROVED_TASKS, 5, BadgeTier.BRONZE, 100),
    TASKS_APPRENTICE("任務學徒", "完成 25 個任務", BadgeCriterion.APPROVED_TASKS, 25, BadgeTier.SILVER, 250),
    TASKS_EXPERT("任務專家", "完成 100 個任務", BadgeCriterion.APPROVED_TASKS, 100, BadgeTier.GOLD, 400),
    TASKS_MASTER("任務大師", "完成 500 個任務", BadgeCriterion.APPROVED_TASKS, 500, BadgeTier.PLATINUM, 500),

    // XP 成就
    XP_BEGINNER("XP 入門", "累計獲得 100 XP", BadgeCriterion.LIFETIME_XP, 100, BadgeTier.BRONZE, 75),
    XP_INTERMEDIATE("XP 進階", "累計獲得 1,000 XP", BadgeCriterion.LIFETIME_XP, 1_000, BadgeTier.SILVER, 300),
    XP_ADVANCED("XP 高手", "累計獲得 10,000 XP", BadgeCriterion.LIFETIME_XP, 10_000, BadgeTier.GOLD, 450),
    XP_MASTER("XP 大師", "累計獲得 100,000 XP", BadgeCriterion.LIFETIME_XP, 100_000, BadgeTier.PLATINUM, 500),

    // 連續核准成就
    STREAK_3("三連勝", "連續 3 個任務獲得核准", BadgeCriterion.APPROVAL_STREAK, 3, BadgeTier.BRONZE, 100),
    STREAK_7("一週戰士", "連續 7 個任務獲得核准", BadgeCriterion.APPROVAL_STREAK, 7, BadgeTier.SILVER, 300),
    STREAK_30("月度大師", "連續 30 個任務獲得核准", BadgeCriterion.APPROVAL_STREAK, 30, BadgeTier.GOLD, 500),
    STREAK_100("連勝傳說", "連續 100 個任務獲得核准", BadgeCriterion.APPROVAL_STREAK, 100, BadgeTier.PLATINUM, 500);

    private final String displayName;
    private final String description;
    private final BadgeCriterion criterion;
    private final int target;
    private final BadgeTier tier;
    private final int bonusXp;

    BadgeDef(String displayName, String description, BadgeCriterion criterion, int target,
             BadgeTier tier, int bonusXp) {
        this.displayName = displayName;
        this.description = description;
        this.criterion = criterion;
        this.target = target;
        this.tier = tier;
        this.bonusXp = bonusXp;
    }
}
