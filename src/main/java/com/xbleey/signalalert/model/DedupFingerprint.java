package com.xbleey.signalalert.model;

import java.time.Instant;

public record DedupFingerprint(String hash, Instant seenAt, Instant expiresAt) {

    public boolean isActive(Instant now) {
        return now.isBefore(expiresAt);
    }
}
