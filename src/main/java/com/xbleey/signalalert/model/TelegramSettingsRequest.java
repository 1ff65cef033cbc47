package com.xbleey.signalalert.model;

public record TelegramSettingsRequest(
        String wallet,
        Boolean enabled,
        String minImpact,
        Integer minConfidence,
        Integer quietHoursStart,
        Integer quietHoursEnd,
        Boolean clearQuietHours
) {
}
