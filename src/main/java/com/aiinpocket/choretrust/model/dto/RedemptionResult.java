package com.aiinpocket.choretrust.model.dto;

public record RedemptionResult(
        boolean success,
        int minutesGranted,
        int xpSpent,
        int newBalance,
        String message
) {
    public static RedemptionResult failed(int balance, String message) {
        return new RedemptionResult(false, 0, 0, balance, message);
    }
}
