package com.aiinpocket.choretrust.model.enums;

public enum ReviewDecision {
    APPROVED,
    APPROVED_EDITED,
    DECLINED,
    DECLINE_UPHELD
}
