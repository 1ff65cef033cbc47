package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.SignalSeverity;

import java.time.Instant;

public record RecurrenceEntry(Instant timestamp, SignalSeverity severity, int impactScore) {
}
