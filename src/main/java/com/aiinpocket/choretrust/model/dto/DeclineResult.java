package com.aiinpocket.choretrust.model.dto;

/**
 * 退件結果。維持原判時 credibility 為 null（不再扣分）。
 */
public record DeclineResult(
        AssignmentView assignment,
        CredibilityChange credibility
) {}
