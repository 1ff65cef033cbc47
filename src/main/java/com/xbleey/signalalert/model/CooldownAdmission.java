package com.xbleey.signalalert.model;

import com.xbleey.signalalert.enums.CooldownDecision;
import com.xbleey.signalalert.enums.SignalSeverity;

public record CooldownAdmission(CooldownDecision decision, SignalSeverity previousSeverity, CooldownEntry entry) {

    public boolean suppressed() {
        return decision == CooldownDecision.SUPPRESSED;
    }

    public boolean escalated() {
        return decision == CooldownDecision.ESCALATED;
    }
}
