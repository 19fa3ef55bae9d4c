package com.aiinpocket.choretrust.controller;

import com.aiinpocket.choretrust.model.dto.TaskTemplateInfo;
import com.aiinpocket.choretrust.model.enums.TaskCategory;
import com.aiinpocket.choretrust.service.TaskCatalogService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/templates")
@RequiredArgsConstructor
public class TaskTemplateController {

    private final TaskCatalogService catalog;

    @GetMapping("/{id}")
    public TaskTemplateInfo get(@PathVariable Long id) {
        return catalog.getTemplate(id);
    }

    @GetMapping
    public List<TaskTemplateInfo> list(@RequestParam(required = false) TaskCategory category,
                                       @RequestParam(required = false) String q) {
        if (category != null) {
            return catalog.listByCategory(category);
        }
        return catalog.search(q);
    }
}
