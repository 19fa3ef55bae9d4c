package com.aiinpocket.choretrust.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public final class XpRequests {

    private XpRequests() {
    }

    public record Redeem(@Min(1) int amount) {}

    public record Grant(@NotNull UUID childId,
                        @Min(1) @Max(500) int amount,
                        @NotBlank @Size(max = 300) String reason) {}
}
