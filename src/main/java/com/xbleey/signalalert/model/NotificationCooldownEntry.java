package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.ImpactLevel;

import java.time.Instant;

public record NotificationCooldownEntry(Instant lastSentAt, ImpactLevel lastLevel) {
}
