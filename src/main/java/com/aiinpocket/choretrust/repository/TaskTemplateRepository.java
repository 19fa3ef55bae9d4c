package com.aiinpocket.choretrust.repository;

import com.aiinpocket.choretrust.model.entity.TaskTemplate;
import com.aiinpocket.choretrust.model.enums.TaskCategory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TaskTemplateRepository extends JpaRepository<TaskTemplate, Long> {

    List<TaskTemplate> findByCategoryOrderByTitleAsc(TaskCategory category);

    List<TaskTemplate> findByTitleContainingIgnoreCaseOrTagsContainingIgnoreCase(String title, String tags);

    boolean existsByTitleAndDefaultTemplateTrue(String title);
}
