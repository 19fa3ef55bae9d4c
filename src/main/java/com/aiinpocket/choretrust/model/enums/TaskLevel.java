package com.aiinpocket.choretrust.model.enums;

import lombok.Getter;

/**
 * 任務難度等級，等級決定任務的基礎 XP。
 */
@Getter
public enum TaskLevel {

    LEVEL_1(1, 5, "快速任務"),
    LEVEL_2(2, 15, "簡單任務"),
    LEVEL_3(3, 30, "中等任務"),
    LEVEL_4(4, 45, "困難任務"),
    LEVEL_5(5, 60, "非常困難");

    private final int number;
    private final int baseXp;
    private final String displayName;

    TaskLevel(int number, int baseXp, String displayName) {
        this.number = number;
        this.baseXp = baseXp;
        this.displayName = displayName;
    }
}
