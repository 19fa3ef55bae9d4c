package com.aiinpocket.choretrust.model.enums;

/**
 * 扣分紀錄的衰減階段。
 * NONE → HALF（30 天，返還一半）→ FULL（60 天，返還剩餘並封存）。
 */
public enum DecayStage {
    NONE,
    HALF,
    FULL
}
