package com.aiinpocket.choretrust.config;

import com.aiinpocket.choretrust.model.entity.TaskTemplate;
import com.aiinpocket.choretrust.model.enums.TaskCategory;
import com.aiinpocket.choretrust.model.enums.TaskLevel;
import com.aiinpocket.choretrust.repository.TaskTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 應用啟動時確保預設任務範本存在。
 * 完整的範本目錄由外部匯入，這裡只放一小組常用任務，讓新家庭可以立即開始使用。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DefaultTemplateInitializer implements ApplicationRunner {

    private static final List<Seed> DEFAULT_TEMPLATES = List.of(
            new Seed("洗碗", "把餐後的碗盤洗乾淨並擦乾歸位", TaskCategory.KITCHEN, TaskLevel.LEVEL_2, 15, "碗盤,廚房"),
            new Seed("倒垃圾", "把家中垃圾與回收分類後拿到指定地點", TaskCategory.INDOOR_CLEANING, TaskLevel.LEVEL_1, 5, "垃圾,回收"),
            new Seed("整理房間", "床鋪整理好、玩具與衣物收納歸位", TaskCategory.INDOOR_CLEANING, TaskLevel.LEVEL_2, 20, "房間,收納"),
            new Seed("吸地板", "客廳與走廊全部吸過一遍", TaskCategory.INDOOR_CLEANING, TaskLevel.LEVEL_3, 30, "吸塵,地板"),
            new Seed("遛狗", "帶狗狗散步至少 20 分鐘", TaskCategory.PET_CARE, TaskLevel.LEVEL_2, 20, "寵物,散步"),
            new Seed("澆花", "替陽台與庭院的植物澆水", TaskCategory.OUTDOOR, TaskLevel.LEVEL_1, 10, "植物,庭院"),
            new Seed("洗車", "清洗車身並擦乾", TaskCategory.AUTOMOTIVE, TaskLevel.LEVEL_4, 60, "汽車,清潔"),
            new Seed("完成作業", "完成今天所有學校作業並請家長檢查", TaskCategory.ACADEMIC, TaskLevel.LEVEL_3, 45, "作業,學習"),
            new Seed("準備晚餐", "協助準備一道晚餐料理", TaskCategory.KITCHEN, TaskLevel.LEVEL_4, 45, "烹飪,晚餐"),
            new Seed("大掃除", "和家人一起完成整間房子的大掃除", TaskCategory.HOME_IMPROVEMENT, TaskLevel.LEVEL_5, 120, "掃除,整理")
    );

    private final TaskTemplateRepository templateRepo;

    @Override
    public void run(ApplicationArguments args) {
        int created = 0;
        for (Seed seed : DEFAULT_TEMPLATES) {
            if (templateRepo.existsByTitleAndDefaultTemplateTrue(seed.title())) {
                continue;
            }
            templateRepo.save(seed.toEntity());
            created++;
        }
        if (created > 0) {
            log.info("[預設範本] 已建立 {} 個預設任務範本", created);
        } else {
            log.debug("[預設範本] 預設任務範本皆已存在");
        }
    }

    private record Seed(String title, String description, TaskCategory category,
                        TaskLevel level, int minutes, String tags) {

        TaskTemplate toEntity() {
            return TaskTemplate.builder()
                    .title(title)
                    .description(description)
                    .category(category)
                    .suggestedLevel(level)
                    .estimatedMinutes(minutes)
                    .tags(tags)
                    .defaultTemplate(true)
                    .build();
        }
    }
}
