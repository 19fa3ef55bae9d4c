package com.aiinpocket.choretrust.service.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 預設的通知管道：只寫日誌。實際推播由外部通知服務實作 {@link ChildNotificationSender} 接上。
 */
@Component
@Slf4j
public class LoggingNotificationSender implements ChildNotificationSender {

    @Override
    public String channel() {
        return "log";
    }

    @Override
    public void send(ChildNotification notification) {
        log.info("[通知] → {} [{}] {}：{}", notification.recipientId(), notification.kind(),
                notification.title(), notification.message());
    }
}
