package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.SignalSeverity;

import java.time.Instant;

public record CooldownEntry(Instant startedAt, Instant expiresAt, SignalSeverity lastSeverity) {

    public CooldownEntry {
        if (!expiresAt.isAfter(startedAt)) {
            throw new IllegalArgumentException("cooldown must expire after it starts");
        }
    }

    public boolean isActive(Instant now) {
        return now.isBefore(expiresAt);
    }

    public long remainingSeconds(Instant now) {
        if (!isActive(now)) {
            return 0;
        }
        return Math.max(0, (expiresAt.toEpochMilli() - now.toEpochMilli() + 999) / 1000);
    }
}
