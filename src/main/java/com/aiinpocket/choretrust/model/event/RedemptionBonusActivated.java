package com.aiinpocket.choretrust.model.event;

import java.time.Instant;
import java.util.UUID;

public record RedemptionBonusActivated(UUID userId, int score, Instant expiry) {}
