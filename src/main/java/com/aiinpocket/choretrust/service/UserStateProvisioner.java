package com.aiinpocket.choretrust.service;

import com.aiinpocket.choretrust.model.entity.CredibilityState;
import com.aiinpocket.choretrust.model.entity.XpBalance;
import com.aiinpocket.choretrust.repository.CredibilityStateRepository;
import com.aiinpocket.choretrust.repository.XpBalanceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * 首次使用時建立 XP 餘額與信用分狀態列。
 *
 * <p>建立動作在獨立交易（REQUIRES_NEW）中提交，兩個請求同時建立同一位使用者時，
 * 較晚的一方會撞上 user_id 唯一鍵，之後直接沿用先建立的那一列。
 */
@Component
@Slf4j
public class UserStateProvisioner {

    private final XpBalanceRepository balanceRepo;
    private final CredibilityStateRepository credibilityRepo;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public UserStateProvisioner(XpBalanceRepository balanceRepo,
                                CredibilityStateRepository credibilityRepo,
                                PlatformTransactionManager transactionManager,
                                Clock clock) {
        this.balanceRepo = balanceRepo;
        this.credibilityRepo = credibilityRepo;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void ensureBalance(UUID userId) {
        if (balanceRepo.existsByUserId(userId)) {
            return;
        }
        Instant now = clock.instant();
        try {
            requiresNew.executeWithoutResult(status -> balanceRepo.saveAndFlush(XpBalance.builder()
                    .userId(userId)
                    .createdAt(now)
                    .lastUpdated(now)
                    .build()));
            log.debug("[XP帳本] 建立使用者 {} 的餘額", userId);
        } catch (DataIntegrityViolationException e) {
            log.debug("[XP帳本] 使用者 {} 的餘額已由其他請求建立", userId);
        }
    }

    public void ensureCredibility(UUID userId) {
        if (credibilityRepo.existsByUserId(userId)) {
            return;
        }
        Instant now = clock.instant();
        try {
            requiresNew.executeWithoutResult(status -> credibilityRepo.saveAndFlush(CredibilityState.builder()
                    .userId(userId)
                    .createdAt(now)
                    .updatedAt(now)
                    .build()));
            log.debug("[信用分] 建立使用者 {} 的信用分狀態（初始 {} 分）", userId, CredibilityState.DEFAULT_SCORE);
        } catch (DataIntegrityViolationException e) {
            log.debug("[信用分] 使用者 {} 的信用分狀態已由其他請求建立", userId);
        }
    }
}
