package com.aiinpocket.choretrust.service;

import com.aiinpocket.choretrust.model.entity.CredibilityEvent;
import com.aiinpocket.choretrust.model.enums.CredibilityEventType;
import com.aiinpocket.choretrust.model.enums.CredibilityTier;
import com.aiinpocket.choretrust.model.enums.DecayStage;
import com.aiinpocket.choretrust.service.CredibilityCalculator.DecayStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CredibilityCalculator Unit Tests")
class CredibilityCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    private static CredibilityEvent downvote(int amount, Duration age, DecayStage stage, int decayed) {
        return CredibilityEvent.builder()
                .userId(UUID.randomUUID())
                .eventType(CredibilityEventType.DOWNVOTE)
                .amount(amount)
                .appliedDelta(amount)
                .scoreAfter(50)
                .decayStage(stage)
                .decayedAmount(decayed)
                .createdAt(NOW.minus(age))
                .build();
    }

    @Nested
    @DisplayName("Stacking penalty")
    class Stacking {

        @Test
        @DisplayName("Should apply base penalty when there is no prior downvote")
        void shouldApplyBasePenaltyWithoutHistory() {
            assertThat(CredibilityCalculator.penaltyFor(NOW, Optional.empty())).isEqualTo(10);
        }

        @Test
        @DisplayName("Should stack penalty when prior downvote is exactly 7 whole days old")
        void shouldStackWithinSevenDays() {
            Instant sevenDaysAgo = NOW.minus(Duration.ofDays(7)).minusSeconds(3600);
            assertThat(CredibilityCalculator.penaltyFor(NOW, Optional.of(sevenDaysAgo))).isEqualTo(15);
        }

        @Test
        @DisplayName("Should not stack once 8 whole days have passed")
        void shouldNotStackAfterWindow() {
            Instant eightDaysAgo = NOW.minus(Duration.ofDays(8));
            assertThat(CredibilityCalculator.penaltyFor(NOW, Optional.of(eightDaysAgo))).isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("Decay")
    class Decay {

        @Test
        @DisplayName("Should return half of the magnitude at 30 days")
        void shouldHalfDecayAtThirtyDays() {
            Optional<DecayStep> step = CredibilityCalculator.decayStep(
                    downvote(-15, Duration.ofDays(31), DecayStage.NONE, 0), NOW);

            assertThat(step).contains(new DecayStep(7, DecayStage.HALF));
        }

        @Test
        @DisplayName("Should not decay a half-decayed entry again before 60 days")
        void shouldNotDecayTwiceAtSameStage() {
            Optional<DecayStep> step = CredibilityCalculator.decayStep(
                    downvote(-10, Duration.ofDays(45), DecayStage.HALF, 5), NOW);

            assertThat(step).isEmpty();
        }

        @Test
        @DisplayName("Should return the remainder at 60 days")
        void shouldFullyDecayRemainder() {
            Optional<DecayStep> step = CredibilityCalculator.decayStep(
                    downvote(-15, Duration.ofDays(60), DecayStage.HALF, 7), NOW);

            assertThat(step).contains(new DecayStep(8, DecayStage.FULL));
        }

        @Test
        @DisplayName("Should return the whole magnitude when the 30-day stage was skipped")
        void shouldFullyDecayUntouchedEntry() {
            Optional<DecayStep> step = CredibilityCalculator.decayStep(
                    downvote(-10, Duration.ofDays(75), DecayStage.NONE, 0), NOW);

            assertThat(step).contains(new DecayStep(10, DecayStage.FULL));
        }

        @Test
        @DisplayName("Should ignore entries younger than 30 days")
        void shouldIgnoreRecentEntries() {
            assertThat(CredibilityCalculator.decayStep(
                    downvote(-10, Duration.ofDays(29), DecayStage.NONE, 0), NOW)).isEmpty();
        }
    }

    @Test
    @DisplayName("Conversion rate should never decrease as the score rises")
    void conversionRateShouldBeMonotonic() {
        for (boolean bonus : new boolean[]{false, true}) {
            BigDecimal previous = BigDecimal.ZERO;
            for (int score = 0; score <= 100; score++) {
                BigDecimal rate = CredibilityCalculator.conversionRate(score, bonus);
                assertThat(rate).isGreaterThanOrEqualTo(previous);
                previous = rate;
            }
        }
    }

    @Test
    @DisplayName("Redemption bonus should multiply the tier rate by 1.3")
    void redemptionBonusShouldMultiplyRate() {
        assertThat(CredibilityCalculator.conversionRate(95, true)).isEqualByComparingTo("1.56");
        assertThat(CredibilityCalculator.conversionRate(95, false)).isEqualByComparingTo("1.2");
    }

    @ParameterizedTest(name = "{0} → {1} (active={2}) triggers={3}")
    @CsvSource({
            "59, 95, false, true",
            "60, 99, false, false",
            "40, 94, false, false",
            "50, 100, true, false"
    })
    @DisplayName("Redemption bonus should trigger only on a jump from below 60 to 95 or more")
    void redemptionTrigger(int before, int after, boolean active, boolean expected) {
        assertThat(CredibilityCalculator.triggersRedemption(before, after, active)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Streak bonus should apply on every tenth approval")
    void streakBonusEveryTenth() {
        assertThat(CredibilityCalculator.earnsStreakBonus(9)).isFalse();
        assertThat(CredibilityCalculator.earnsStreakBonus(10)).isTrue();
        assertThat(CredibilityCalculator.earnsStreakBonus(20)).isTrue();
        assertThat(CredibilityCalculator.earnsStreakBonus(0)).isFalse();
    }

    @Test
    @DisplayName("Should count approvals needed to reach the next tier")
    void approvalsToNextTier() {
        assertThat(CredibilityCalculator.approvalsToNextTier(35)).isEqualTo(3);
        assertThat(CredibilityCalculator.approvalsToNextTier(89)).isEqualTo(1);
        assertThat(CredibilityCalculator.approvalsToNextTier(95)).isZero();
        assertThat(CredibilityTier.forScore(35)).isEqualTo(CredibilityTier.VERY_POOR);
    }
}
