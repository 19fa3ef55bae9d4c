package com.aiinpocket.choretrust.job;

import com.aiinpocket.choretrust.model.dto.DecaySweepResult;
import com.aiinpocket.choretrust.service.CredibilityService;
import com.aiinpocket.choretrust.service.DistributedLockService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CredibilityDecayJob Unit Tests")
class CredibilityDecayJobTest {

    @Mock
    private CredibilityService credibilityService;

    @Mock
    private DistributedLockService lockService;

    @InjectMocks
    private CredibilityDecayJob job;

    private void lockAcquired() {
        when(lockService.executeWithLock(eq(CredibilityDecayJob.DECAY_LOCK_ID), anyString(), any(Runnable.class)))
                .thenAnswer(inv -> {
                    inv.getArgument(2, Runnable.class).run();
                    return true;
                });
    }

    @Test
    @DisplayName("Should run the decay sweep when the lock is acquired")
    void shouldSweepUnderLock() {
        // Given
        lockAcquired();
        when(credibilityService.applyDecay()).thenReturn(new DecaySweepResult(2, 15, 0));

        // When
        job.executeInternal(null);

        // Then
        verify(credibilityService).applyDecay();
    }

    @Test
    @DisplayName("Should skip the sweep when another instance holds the lock")
    void shouldSkipWithoutLock() {
        when(lockService.executeWithLock(anyLong(), anyString(), any(Runnable.class))).thenReturn(false);

        job.executeInternal(null);

        verify(credibilityService, never()).applyDecay();
    }

    @Test
    @DisplayName("Sweep failure should be logged, not rethrown to the scheduler")
    void shouldContainSweepFailure() {
        lockAcquired();
        when(credibilityService.applyDecay()).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> job.executeInternal(null)).doesNotThrowAnyException();
    }
}
