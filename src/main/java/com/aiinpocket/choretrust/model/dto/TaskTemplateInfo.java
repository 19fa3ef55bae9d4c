package com.aiinpocket.choretrust.model.dto;

import com.aiinpocket.choretrust.model.entity.TaskTemplate;
import com.aiinpocket.choretrust.model.enums.TaskCategory;
import com.aiinpocket.choretrust.model.enums.TaskLevel;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public record TaskTemplateInfo(
        Long id,
        String title,
        String description,
        TaskCategory category,
        TaskLevel suggestedLevel,
        int estimatedMinutes,
        Map<TaskLevel, Integer> baseXpByLevel
) {
    public static TaskTemplateInfo from(TaskTemplate t) {
        Map<TaskLevel, Integer> xp = Arrays.stream(TaskLevel.values())
                .collect(Collectors.toMap(Function.identity(), TaskLevel::getBaseXp,
                        (a, b) -> a, () -> new EnumMap<>(TaskLevel.class)));
        return new TaskTemplateInfo(t.getId(), t.getTitle(), t.getDescription(), t.getCategory(),
                t.getSuggestedLevel(), t.getEstimatedMinutes(), xp);
    }

    public int baseXp(TaskLevel level) {
        return baseXpByLevel.getOrDefault(level, level.getBaseXp());
    }
}
