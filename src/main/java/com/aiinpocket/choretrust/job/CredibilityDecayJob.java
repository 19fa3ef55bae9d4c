package com.aiinpocket.choretrust.job;

import com.aiinpocket.choretrust.service.CredibilityService;
import com.aiinpocket.choretrust.service.DistributedLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 信用分衰減排程任務（每日）。
 * 返還滿 30 / 60 天的扣分，並結束已過期的救贖加成。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CredibilityDecayJob extends QuartzJobBean {

    private final CredibilityService credibilityService;
    private final DistributedLockService lockService;

    /** Advisory lock ID: CredibilityDecayJob 專用 */
    static final long DECAY_LOCK_ID = 3_000_001L;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        lockService.executeWithLock(DECAY_LOCK_ID, "CredibilityDecayJob", () -> {
            log.info("[排程] 開始執行信用分衰減");
            try {
                credibilityService.applyDecay();
            } catch (Exception e) {
                log.error("[排程] 信用分衰減執行失敗: {}", e.getMessage(), e);
            }
        });
    }
}
