package com.aiinpocket.choretrust.controller;

import com.aiinpocket.choretrust.model.dto.CredibilityChange;
import com.aiinpocket.choretrust.model.dto.CredibilityStatus;
import com.aiinpocket.choretrust.service.CredibilityService;
import com.aiinpocket.choretrust.service.ReviewAuthorityService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/credibility")
@RequiredArgsConstructor
public class CredibilityController {

    private final CredibilityService credibilityService;
    private final ReviewAuthorityService authority;

    @GetMapping("/tiers")
    public List<CredibilityStatus.TierInfo> tiers() {
        return credibilityService.listTiers();
    }

    @GetMapping("/{userId}")
    public CredibilityStatus status(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId,
                                    @PathVariable UUID userId) {
        authority.requireSelfOrReviewer(actorId, userId);
        return credibilityService.getCredibilityStatus(userId);
    }

    /** 估算 XP 以目前倍率可兌換的分鐘數 */
    @GetMapping("/{userId}/quote")
    public Map<String, Integer> quote(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId,
                                      @PathVariable UUID userId,
                                      @RequestParam int xp) {
        authority.requireSelfOrReviewer(actorId, userId);
        return Map.of("xp", xp, "minutes", credibilityService.quoteMinutes(userId, xp));
    }

    /**
     * 家長更正誤按的核准，只撤回信用分（核准加分、連勝加分與連續核准數）。
     *
     * <p>任務本身維持 APPROVED，已入帳的 XP 不扣回，也仍計入「完成任務數」類徽章。
     * 帳本沒有負向調整的交易類型，XP 的更正需另以兌換或人工方式處理。
     */
    @PostMapping("/{userId}/approvals/{taskId}/undo")
    public CredibilityChange undoApproval(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId,
                                          @PathVariable UUID userId,
                                          @PathVariable UUID taskId) {
        authority.requireReviewer(actorId, userId);
        return credibilityService.undoApproval(userId, taskId);
    }
}
