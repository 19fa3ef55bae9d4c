package com.aiinpocket.choretrust.model.enums;

public enum XpTransactionType {
    EARNED,
    REDEEMED,
    GRANTED
}
