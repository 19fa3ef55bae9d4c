package com.aiinpocket.choretrust.model.enums;

import lombok.Getter;

@Getter
public enum TaskCategory {

    KITCHEN("廚房與烹飪"),
    INDOOR_CLEANING("室內清潔"),
    OUTDOOR("戶外與庭院"),
    PET_CARE("寵物照顧"),
    AUTOMOTIVE("汽車保養"),
    ERRANDS("跑腿採買"),
    SIBLING_CARE("照顧弟妹"),
    ACADEMIC("課業學習"),
    PERSONAL_DEVELOPMENT("自我成長"),
    HOME_IMPROVEMENT("居家修繕"),
    OTHER("其他");

    private final String displayName;

    TaskCategory(String displayName) {
        this.displayName = displayName;
    }
}
