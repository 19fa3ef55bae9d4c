package com.aiinpocket.choretrust.service;

import com.aiinpocket.choretrust.config.ChoreTrustProperties;
import com.aiinpocket.choretrust.exception.StateConflictException;
import com.aiinpocket.choretrust.exception.ValidationException;
import com.aiinpocket.choretrust.model.dto.DailyXpSummary;
import com.aiinpocket.choretrust.model.dto.RedemptionResult;
import com.aiinpocket.choretrust.model.dto.XpBalanceView;
import com.aiinpocket.choretrust.model.dto.XpTransactionView;
import com.aiinpocket.choretrust.model.entity.XpBalance;
import com.aiinpocket.choretrust.model.entity.XpTransaction;
import com.aiinpocket.choretrust.model.enums.XpTransactionType;
import com.aiinpocket.choretrust.repository.XpBalanceRepository;
import com.aiinpocket.choretrust.repository.XpTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * XP 帳本。只處理餘額與異動紀錄，不知道任務或信用分的存在；
 * 倍率與信用分快照由呼叫端傳入。
 *
 * <p>所有異動都先以 SELECT ... FOR UPDATE 鎖住該使用者的餘額列，同一使用者的入帳與兌換依序執行。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class XpLedgerService {

    public static final int MAX_GRANT = 500;
    public static final int STARTER_BONUS = 30;
    private static final int MAX_HISTORY = 100;

    private final XpBalanceRepository balanceRepo;
    private final XpTransactionRepository txRepo;
    private final UserStateProvisioner provisioner;
    private final ChoreTrustProperties props;
    private final Clock clock;

    /**
     * 基礎 XP 乘上倍率後無條件進位，至少 1 XP。
     */
    public static int rawXp(int baseXp, BigDecimal multiplier) {
        int raw = BigDecimal.valueOf(baseXp)
                .multiply(multiplier)
                .setScale(0, RoundingMode.CEILING)
                .intValueExact();
        return Math.max(raw, 1);
    }

    /**
     * 軟上限遞減：餘額已達上限時只入帳一半；跨越上限時，上限以下的部分全額、以上的部分減半（無條件捨去）。
     */
    public static int applySoftCap(int currentXp, int raw) {
        if (currentXp >= XpBalance.SOFT_CAP) {
            return raw / 2;
        }
        int belowCap = XpBalance.SOFT_CAP - currentXp;
        if (raw <= belowCap) {
            return raw;
        }
        return belowCap + (raw - belowCap) / 2;
    }

    /**
     * 任務 XP 入帳。
     *
     * @return 實際入帳的 XP；baseXp ≤ 0 時不做任何事並回傳 0
     */
    @Transactional
    public int earn(UUID userId, int baseXp, BigDecimal multiplier, UUID taskId, Integer credibilityAtTime) {
        if (baseXp <= 0) {
            return 0;
        }
        XpBalance balance = lockBalance(userId);
        int raw = rawXp(baseXp, multiplier);
        int credited = applySoftCap(balance.getCurrentXp(), raw);
        if (credited == 0) {
            log.info("[XP帳本] 使用者 {} 已達軟上限，raw={} 減半後為 0，不入帳", userId, raw);
            return 0;
        }

        Instant now = clock.instant();
        balance.credit(credited, now);
        txRepo.save(XpTransaction.builder()
                .userId(userId)
                .type(XpTransactionType.EARNED)
                .amount(credited)
                .createdAt(now)
                .relatedTaskId(taskId)
                .credibilityAtTime(credibilityAtTime)
                .notes(credited < raw ? "軟上限遞減：" + raw + " → " + credited : null)
                .build());

        log.info("[XP帳本] 使用者 {} 入帳 {} XP (base={}, ×{}, raw={}) 餘額 {}",
                userId, credited, baseXp, multiplier, raw, balance.getCurrentXp());
        return credited;
    }

    /**
     * 兌換 XP（1 XP = 1 分鐘）。金額不合法或餘額不足時回傳失敗結果，不做任何異動。
     */
    @Transactional
    public RedemptionResult redeem(UUID userId, int amount) {
        if (amount <= 0) {
            return RedemptionResult.failed(currentXp(userId), "兌換數量必須大於 0");
        }
        XpBalance balance = balanceRepo.lockByUserId(userId).orElse(null);
        if (balance == null || balance.getCurrentXp() < amount) {
            int available = balance == null ? 0 : balance.getCurrentXp();
            log.info("[XP帳本] 使用者 {} 兌換 {} XP 失敗：餘額 {}", userId, amount, available);
            return RedemptionResult.failed(available,
                    "XP 不足：需要 " + amount + "，目前 " + available);
        }

        Instant now = clock.instant();
        balance.debit(amount, now);
        txRepo.save(XpTransaction.builder()
                .userId(userId)
                .type(XpTransactionType.REDEEMED)
                .amount(amount)
                .createdAt(now)
                .notes("兌換 " + amount + " 分鐘")
                .build());

        log.info("[XP帳本] 使用者 {} 兌換 {} XP，剩餘 {}", userId, amount, balance.getCurrentXp());
        return new RedemptionResult(true, amount, amount, balance.getCurrentXp(),
                "成功兌換 " + amount + " 分鐘");
    }

    /**
     * 手動發放 XP，不套用軟上限。
     *
     * @throws ValidationException 數量不在 1–500 或缺少原因
     */
    @Transactional
    public int grant(UUID userId, int amount, String reason) {
        if (amount < 1 || amount > MAX_GRANT) {
            throw new ValidationException("發放數量必須介於 1 到 " + MAX_GRANT + " 之間");
        }
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("發放 XP 必須填寫原因");
        }
        XpBalance balance = lockBalance(userId);
        Instant now = clock.instant();
        balance.credit(amount, now);
        txRepo.save(XpTransaction.builder()
                .userId(userId)
                .type(XpTransactionType.GRANTED)
                .amount(amount)
                .createdAt(now)
                .notes(reason.strip())
                .build());

        log.info("[XP帳本] 使用者 {} 獲得發放 {} XP（{}），餘額 {}", userId, amount, reason, balance.getCurrentXp());
        return balance.getCurrentXp();
    }

    /**
     * 新手獎勵，每位使用者只能領一次。
     */
    @Transactional
    public int grantStarterBonus(UUID userId) {
        XpBalance balance = lockBalance(userId);
        if (balance.isStarterBonusGranted()) {
            throw new StateConflictException("新手獎勵已領取");
        }
        balance.setStarterBonusGranted(true);
        return grant(userId, STARTER_BONUS, "新手獎勵");
    }

    @Transactional(readOnly = true)
    public XpBalanceView getBalance(UUID userId) {
        provisioner.ensureBalance(userId);
        return balanceRepo.findByUserId(userId)
                .map(XpBalanceView::from)
                .orElseThrow();
    }

    @Transactional(readOnly = true)
    public List<XpTransactionView> getRecentTransactions(UUID userId, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_HISTORY));
        return txRepo.findByUserIdOrderByCreatedAtDescIdDesc(userId, PageRequest.of(0, size)).stream()
                .map(XpTransactionView::from)
                .toList();
    }

    /**
     * 今日（依設定時區）入帳與兌換的總量。
     */
    @Transactional(readOnly = true)
    public DailyXpSummary getDailySummary(UUID userId) {
        ZoneId zone = props.zoneId();
        LocalDate today = LocalDate.now(clock.withZone(zone));
        Instant from = today.atStartOfDay(zone).toInstant();
        Instant to = today.plusDays(1).atStartOfDay(zone).toInstant();

        long earned = txRepo.sumAmount(userId,
                List.of(XpTransactionType.EARNED, XpTransactionType.GRANTED), from, to);
        long redeemed = txRepo.sumAmount(userId, List.of(XpTransactionType.REDEEMED), from, to);
        return new DailyXpSummary(today, earned, redeemed, currentXp(userId));
    }

    private XpBalance lockBalance(UUID userId) {
        provisioner.ensureBalance(userId);
        return balanceRepo.lockByUserId(userId)
                .orElseThrow(() -> new IllegalStateException("XP balance missing after provisioning: " + userId));
    }

    private int currentXp(UUID userId) {
        return balanceRepo.findByUserId(userId).map(XpBalance::getCurrentXp).orElse(0);
    }
}
