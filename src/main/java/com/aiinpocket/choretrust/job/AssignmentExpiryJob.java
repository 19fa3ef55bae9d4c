package com.aiinpocket.choretrust.job;

import com.aiinpocket.choretrust.service.DistributedLockService;
import com.aiinpocket.choretrust.service.TaskVerificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 任務逾期排程任務。將超過期限仍未完成的任務標記為過期。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssignmentExpiryJob extends QuartzJobBean {

    private final TaskVerificationService verificationService;
    private final DistributedLockService lockService;

    /** Advisory lock ID: AssignmentExpiryJob 專用 */
    static final long EXPIRY_LOCK_ID = 3_000_002L;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        lockService.executeWithLock(EXPIRY_LOCK_ID, "AssignmentExpiryJob", () -> {
            try {
                int expired = verificationService.expireOverdue();
                log.debug("[排程] 逾期檢查完成，{} 個任務過期", expired);
            } catch (Exception e) {
                log.error("[排程] 逾期檢查執行失敗: {}", e.getMessage(), e);
            }
        });
    }
}
