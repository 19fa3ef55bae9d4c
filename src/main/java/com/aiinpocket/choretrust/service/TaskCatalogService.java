package com.aiinpocket.choretrust.service;

import com.aiinpocket.choretrust.config.CacheConfig;
import com.aiinpocket.choretrust.exception.NotFoundException;
import com.aiinpocket.choretrust.model.dto.TaskTemplateInfo;
import com.aiinpocket.choretrust.model.enums.TaskCategory;
import com.aiinpocket.choretrust.repository.TaskTemplateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 任務範本目錄（唯讀）。單筆查詢結果以 Caffeine 快取。
 */
@Service
@RequiredArgsConstructor
public class TaskCatalogService {

    private final TaskTemplateRepository templateRepo;

    @Cacheable(CacheConfig.TASK_TEMPLATES)
    @Transactional(readOnly = true)
    public TaskTemplateInfo getTemplate(Long templateId) {
        return templateRepo.findById(templateId)
                .map(TaskTemplateInfo::from)
                .orElseThrow(() -> NotFoundException.of("任務範本", templateId));
    }

    @Transactional(readOnly = true)
    public List<TaskTemplateInfo> listByCategory(TaskCategory category) {
        return templateRepo.findByCategoryOrderByTitleAsc(category).stream()
                .map(TaskTemplateInfo::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<TaskTemplateInfo> search(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return templateRepo.findAll().stream().map(TaskTemplateInfo::from).toList();
        }
        String q = keyword.strip();
        return templateRepo.findByTitleContainingIgnoreCaseOrTagsContainingIgnoreCase(q, q).stream()
                .map(TaskTemplateInfo::from)
                .toList();
    }
}
