package com.xbleey.signalalert.enums;

public enum CooldownDecision {
    STARTED,
    ESCALATED,
    SUPPRESSED
}
