package com.aiinpocket.choretrust.service.notification;

/**
 * 通知發送器介面（Strategy Pattern）。
 * 推播、站內訊息等每種管道各有一個實作，由 {@link ChildNotificationDispatcher} 逐一呼叫。
 */
public interface ChildNotificationSender {

    /** 管道名稱（用於日誌） */
    String channel();

    /**
     * 發送通知。發送失敗時直接拋出例外，由分發器記錄。
     */
    void send(ChildNotification notification);
}
