package com.aiinpocket.choretrust.model.event;

import com.aiinpocket.choretrust.model.enums.BadgeDef;

import java.util.UUID;

public record BadgeEarned(UUID childId, BadgeDef badge, int bonusXp) {}
