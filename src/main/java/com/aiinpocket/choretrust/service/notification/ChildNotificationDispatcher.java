package com.aiinpocket.choretrust.service.notification;

import com.aiinpocket.choretrust.model.enums.ReviewDecision;
import com.aiinpocket.choretrust.model.event.BadgeEarned;
import com.aiinpocket.choretrust.model.event.RedemptionBonusActivated;
import com.aiinpocket.choretrust.model.event.RedemptionBonusEnded;
import com.aiinpocket.choretrust.model.event.TaskReviewed;
import com.aiinpocket.choretrust.service.notification.ChildNotification.Kind;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * 通知分發器。
 *
 * <p>審核、徽章與救贖加成事件在交易內發布，交易提交後才在 {@code notificationExecutor} 執行緒池中轉成通知，
 * 交易回滾時不會送出任何通知。每個管道獨立處理，單一管道失敗不影響其他管道。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChildNotificationDispatcher {

    private final List<ChildNotificationSender> senders;

    @PostConstruct
    void init() {
        log.info("[通知分發] 已註冊 {} 個通知管道: {}", senders.size(),
                senders.stream().map(ChildNotificationSender::channel).toList());
    }

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTaskReviewed(TaskReviewed event) {
        ChildNotification notification;
        if (event.decision() == ReviewDecision.DECLINED) {
            notification = new ChildNotification(event.childId(), Kind.TASK_DECLINED, event.title(),
                    "任務未通過審核，24 小時內可以提出申訴。目前信用分 " + event.credibilityAfter());
        } else if (event.decision() == ReviewDecision.DECLINE_UPHELD) {
            notification = new ChildNotification(event.childId(), Kind.DECLINE_UPHELD, event.title(),
                    "申訴已審核，維持原判。");
        } else {
            notification = new ChildNotification(event.childId(), Kind.TASK_APPROVED, event.title(),
                    "任務已核准，獲得 " + event.xpAwarded() + " XP！");
        }
        dispatch(notification);
    }

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBadgeEarned(BadgeEarned event) {
        dispatch(new ChildNotification(event.childId(), Kind.BADGE_EARNED, event.badge().getDisplayName(),
                event.badge().getDescription() + "，獲得 " + event.bonusXp() + " XP 獎勵"));
    }

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRedemptionBonusActivated(RedemptionBonusActivated event) {
        dispatch(new ChildNotification(event.userId(), Kind.REDEMPTION_BONUS_STARTED, "救贖加成",
                "信用分回到 " + event.score() + "！7 天內兌換倍率提高 1.3 倍。"));
    }

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRedemptionBonusEnded(RedemptionBonusEnded event) {
        dispatch(new ChildNotification(event.userId(), Kind.REDEMPTION_BONUS_ENDED, "救贖加成",
                event.expired() ? "救贖加成已到期。" : "信用分下滑，救贖加成提前結束。"));
    }

    void dispatch(ChildNotification notification) {
        for (ChildNotificationSender sender : senders) {
            try {
                sender.send(notification);
            } catch (Exception e) {
                log.error("[通知分發] 發送失敗: recipient={}, channel={}, kind={}",
                        notification.recipientId(), sender.channel(), notification.kind(), e);
            }
        }
    }
}
