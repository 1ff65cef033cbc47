package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.RecurrenceTrend;

import java.time.Instant;

public record RecurrenceInfo(
        int occurrences24h,
        RecurrenceTrend trend,
        boolean repeat,
        Integer previousImpact,
        Instant lastSeen,
        Long secondsSinceLast
) {
}
