package com.aiinpocket.choretrust.model.enums;

import lombok.Getter;

@Getter
public enum BadgeTier {

    BRONZE("銅", "brown"),
    SILVER("銀", "gray"),
    GOLD("金", "yellow"),
    PLATINUM("白金", "cyan");

    private final String displayName;
    private final String color;

    BadgeTier(String displayName, String color) {
        this.displayName = displayName;
        this.color = color;
    }
}
