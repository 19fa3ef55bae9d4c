package com.aiinpocket.choretrust.controller;

import com.aiinpocket.choretrust.model.dto.BadgeProgress;
import com.aiinpocket.choretrust.model.dto.EarnedBadgeView;
import com.aiinpocket.choretrust.model.enums.BadgeDef;
import com.aiinpocket.choretrust.model.enums.BadgeTier;
import com.aiinpocket.choretrust.service.BadgeService;
import com.aiinpocket.choretrust.service.ReviewAuthorityService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/badges")
@RequiredArgsConstructor
public class BadgeController {

    private final BadgeService badgeService;
    private final ReviewAuthorityService authority;

    @GetMapping("/{childId}")
    public List<EarnedBadgeView> earned(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId,
                                        @PathVariable UUID childId) {
        authority.requireSelfOrReviewer(actorId, childId);
        return badgeService.getEarnedBadges(childId);
    }

    @GetMapping("/{childId}/progress")
    public List<BadgeProgress> progress(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId,
                                        @PathVariable UUID childId) {
        authority.requireSelfOrReviewer(actorId, childId);
        return badgeService.getBadgeProgress(childId);
    }

    @GetMapping("/{childId}/tiers")
    public Map<BadgeTier, Long> countByTier(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId,
                                            @PathVariable UUID childId) {
        authority.requireSelfOrReviewer(actorId, childId);
        return badgeService.getBadgeCountByTier(childId);
    }

    @PostMapping("/{childId}/evaluate")
    public List<BadgeDef> evaluate(@RequestHeader(TaskAssignmentController.ACTOR) UUID actorId,
                                   @PathVariable UUID childId) {
        authority.requireSelfOrReviewer(actorId, childId);
        return badgeService.evaluateBadges(childId);
    }
}
