package com.aiinpocket.choretrust.model.dto;

import com.aiinpocket.choretrust.model.enums.BadgeDef;

import java.util.List;

public record ApprovalResult(
        AssignmentView assignment,
        int xpAwarded,
        CredibilityChange credibility,
        List<BadgeDef> badgesEarned
) {}
