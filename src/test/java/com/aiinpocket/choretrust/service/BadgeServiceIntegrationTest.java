package com.aiinpocket.choretrust.service;

import com.aiinpocket.choretrust.model.dto.BadgeProgress;
import com.aiinpocket.choretrust.model.enums.BadgeDef;
import com.aiinpocket.choretrust.model.enums.BadgeTier;
import com.aiinpocket.choretrust.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BadgeService Integration Tests")
class BadgeServiceIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private BadgeService badgeService;

    @Autowired
    private XpLedgerService xpLedger;

    @Test
    @DisplayName("Reaching 100 lifetime XP should award XP_BEGINNER exactly once")
    void shouldAwardBadgeOnce() {
        // Given
        UUID childId = UUID.randomUUID();
        xpLedger.grant(childId, 100, "生日禮物");

        // When
        List<BadgeDef> first = badgeService.evaluateBadges(childId);
        List<BadgeDef> second = badgeService.evaluateBadges(childId);

        // Then
        assertThat(first).containsExactly(BadgeDef.XP_BEGINNER);
        assertThat(second).isEmpty();
        assertThat(xpLedger.getBalance(childId).currentXp()).isEqualTo(100 + BadgeDef.XP_BEGINNER.getBonusXp());
        assertThat(badgeService.getEarnedBadges(childId)).hasSize(1);
    }

    @Test
    @DisplayName("Progress should report current value against each badge target")
    void shouldReportProgress() {
        UUID childId = UUID.randomUUID();
        xpLedger.grant(childId, 50, "補發");

        List<BadgeProgress> progress = badgeService.getBadgeProgress(childId);

        assertThat(progress).hasSize(BadgeDef.values().length);
        BadgeProgress beginner = progress.stream()
                .filter(p -> p.badge() == BadgeDef.XP_BEGINNER)
                .findFirst()
                .orElseThrow();
        assertThat(beginner.current()).isEqualTo(50);
        assertThat(beginner.isEarned()).isFalse();
        assertThat(beginner.percentage()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Tier counts should include every tier, empty ones as zero")
    void shouldCountByTier() {
        UUID childId = UUID.randomUUID();
        xpLedger.grant(childId, 100, "生日禮物");
        badgeService.evaluateBadges(childId);

        assertThat(badgeService.getBadgeCountByTier(childId))
                .containsEntry(BadgeTier.BRONZE, 1L)
                .containsEntry(BadgeTier.SILVER, 0L)
                .containsEntry(BadgeTier.PLATINUM, 0L);
    }
}
