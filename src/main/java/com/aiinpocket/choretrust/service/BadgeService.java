package com.aiinpocket.choretrust.service;

import com.aiinpocket.choretrust.model.dto.BadgeProgress;
import com.aiinpocket.choretrust.model.dto.EarnedBadgeView;
import com.aiinpocket.choretrust.model.entity.EarnedBadge;
import com.aiinpocket.choretrust.model.enums.AssignmentStatus;
import com.aiinpocket.choretrust.model.enums.BadgeCriterion;
import com.aiinpocket.choretrust.model.enums.BadgeDef;
import com.aiinpocket.choretrust.model.enums.BadgeTier;
import com.aiinpocket.choretrust.model.event.BadgeEarned;
import com.aiinpocket.choretrust.repository.EarnedBadgeRepository;
import com.aiinpocket.choretrust.repository.TaskAssignmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 徽章（成就）追蹤。依核准任務數、累計 XP、連續核准數判斷，每個徽章只頒發一次並附帶 XP 獎勵。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BadgeService {

    private final EarnedBadgeRepository badgeRepo;
    private final TaskAssignmentRepository assignmentRepo;
    private final XpLedgerService xpLedger;
    private final CredibilityService credibilityService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * 檢查並頒發符合條件的徽章。重複呼叫不會重複頒發。
     *
     * @return 本次新獲得的徽章
     */
    @Transactional
    public List<BadgeDef> evaluateBadges(UUID childId) {
        Counters counters = loadCounters(childId);

        // 批次查詢已取得的徽章（一次查詢取代多次 existsBy）
        Set<BadgeDef> held = heldBadges(childId);

        List<BadgeDef> earned = new ArrayList<>();
        for (BadgeDef badge : BadgeDef.values()) {
            if (held.contains(badge) || counters.valueFor(badge.getCriterion()) < badge.getTarget()) {
                continue;
            }
            badgeRepo.save(EarnedBadge.builder()
                    .childId(childId)
                    .badge(badge)
                    .earnedAt(clock.instant())
                    .bonusXpAwarded(badge.getBonusXp())
                    .build());
            xpLedger.grant(childId, badge.getBonusXp(), "徽章獎勵：" + badge.getDisplayName());
            eventPublisher.publishEvent(new BadgeEarned(childId, badge, badge.getBonusXp()));
            earned.add(badge);
            log.info("[徽章] 孩子 {} 獲得徽章: {} (+{} XP)", childId, badge.getDisplayName(), badge.getBonusXp());
        }
        return earned;
    }

    @Transactional(readOnly = true)
    public List<EarnedBadgeView> getEarnedBadges(UUID childId) {
        return badgeRepo.findByChildIdOrderByEarnedAtDesc(childId).stream()
                .map(EarnedBadgeView::from)
                .toList();
    }

    @Transactional
    public List<BadgeProgress> getBadgeProgress(UUID childId) {
        Counters counters = loadCounters(childId);
        Set<BadgeDef> held = heldBadges(childId);
        return Arrays.stream(BadgeDef.values())
                .map(b -> BadgeProgress.of(b, counters.valueFor(b.getCriterion()), held.contains(b)))
                .toList();
    }

    @Transactional(readOnly = true)
    public Map<BadgeTier, Long> getBadgeCountByTier(UUID childId) {
        Map<BadgeTier, Long> counts = new EnumMap<>(BadgeTier.class);
        for (BadgeTier tier : BadgeTier.values()) {
            counts.put(tier, 0L);
        }
        badgeRepo.findByChildIdOrderByEarnedAtDesc(childId)
                .forEach(b -> counts.merge(b.getBadge().getTier(), 1L, Long::sum));
        return counts;
    }

    private Set<BadgeDef> heldBadges(UUID childId) {
        return badgeRepo.findByChildIdOrderByEarnedAtDesc(childId).stream()
                .map(EarnedBadge::getBadge)
                .collect(Collectors.toSet());
    }

    private Counters loadCounters(UUID childId) {
        int streak = credibilityService.snapshot(childId).streak();
        long approved = assignmentRepo.countByChildIdAndStatus(childId, AssignmentStatus.APPROVED);
        long lifetimeXp = xpLedger.getBalance(childId).lifetimeEarned();
        return new Counters(approved, lifetimeXp, streak);
    }

    private record Counters(long approvedTasks, long lifetimeXp, long streak) {
        long valueFor(BadgeCriterion criterion) {
            return switch (criterion) {
                case APPROVED_TASKS -> approvedTasks;
                case LIFETIME_XP -> lifetimeXp;
                case APPROVAL_STREAK -> streak;
            };
        }
    }
}
