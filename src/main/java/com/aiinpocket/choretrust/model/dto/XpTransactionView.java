package com.aiinpocket.choretrust.model.dto;

import com.aiinpocket.choretrust.model.entity.XpTransaction;
import com.aiinpocket.choretrust.model.enums.XpTransactionType;

import java.time.Instant;
import java.util.UUID;

public record XpTransactionView(
        Long id,
        XpTransactionType type,
        int amount,
        Instant timestamp,
        UUID relatedTaskId,
        Integer credibilityAtTime,
        String notes
) {
    public static XpTransactionView from(XpTransaction t) {
        return new XpTransactionView(t.getId(), t.getType(), t.getAmount(), t.getCreatedAt(),
                t.getRelatedTaskId(), t.getCredibilityAtTime(), t.getNotes());
    }
}
