package com.aiinpocket.choretrust.model.event;

import java.util.UUID;

/**
 * 救贖加成結束。expired=false 代表因分數跌破門檻而提前結束。
 */
public record RedemptionBonusEnded(UUID userId, boolean expired) {}
